package org.cognita.document.merge;

import org.cognita.document.ActionKind;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentImport;
import org.cognita.document.DocumentParseException;
import org.cognita.document.Flow;
import org.cognita.document.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens a document and everything it imports into one self-contained document.
 * <p>
 * The flows, goals and actions of a document imported as {@code lib} are added under
 * {@code lib.<name>}; a document that {@code lib} itself imports as {@code util} ends up
 * under {@code lib.util.<name>}. Literal {@code goto}/{@code call} targets and continuation
 * default flows inside an imported document are rewritten with the same prefix, so they keep
 * pointing at the flows of their own document. Targets written as expressions are left alone.
 * <p>
 * The merged document keeps the root's id, version, metadata and {@code on_error} flow;
 * the document-level {@code on_error} of imported documents is not carried over.
 */
public final class DocumentMerger {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentMerger.class);

    private DocumentMerger() {
    }

    /**
     * Merges a document with its imports.
     * @param reference The reference the root was loaded from, used for cycle detection.
     * @param root The parsed root document.
     * @param resolver Loads imported documents.
     * @return The root itself if it has no imports, otherwise the flattened document.
     * @throws DocumentParseException on an import cycle, a missing import, a name clash or a
     *         flow target that does not exist after merging.
     * @throws IOException if the resolver fails.
     */
    public static BehaviorDocument merge(String reference, BehaviorDocument root, IDocumentResolver resolver)
            throws IOException, DocumentParseException {
        if (!root.hasImports()) {
            return root;
        }
        Merged merged = new Merged(new DiagnosticsEngine(reference));
        List<String> chain = new ArrayList<>();
        chain.add(reference);
        include(root, "", chain, resolver, merged);
        merged.validate(root.getOnErrorFlow());
        if (merged.diagnostics.hasErrors()) {
            throw new DocumentParseException("Failed to merge imports of '" + reference + "': "
                    + merged.diagnostics.summary(), merged.diagnostics.getDiagnostics());
        }
        LOG.debug("Merged '{}' into {} flows", reference, merged.flows.size());
        return new BehaviorDocument(root.getId(), root.getVersion(), root.getMetadata(), merged.flows,
                merged.goals, merged.actions, root.getOnErrorFlow(), List.of());
    }

    private static void include(BehaviorDocument document, String prefix, List<String> chain,
                                IDocumentResolver resolver, Merged merged) throws IOException, DocumentParseException {
        for (Flow flow : document.getFlows().values()) {
            String name = prefix + flow.name();
            Flow rewritten = new Flow(name, rewrite(flow.actions(), prefix), rewrite(flow.onError(), prefix));
            if (merged.flows.putIfAbsent(name, rewritten) != null) {
                merged.diagnostics.reportError("Flow '" + name + "' defined twice after merging", "flows." + name);
            }
        }
        document.getGoals().forEach((id, definition) -> put(merged.goals, prefix + id, definition, "goals", merged));
        document.getActions().forEach((id, definition) -> put(merged.actions, prefix + id, definition, "actions", merged));

        for (DocumentImport imported : document.getImports()) {
            if (chain.contains(imported.file())) {
                List<String> cycle = new ArrayList<>(chain);
                cycle.add(imported.file());
                throw new DocumentParseException("Import cycle: " + String.join(" -> ", cycle), List.of());
            }
            Optional<BehaviorDocument> loaded = resolver.resolve(imported.file());
            if (loaded.isEmpty()) {
                merged.diagnostics.reportError("Imported document '" + imported.file() + "' not found",
                        "imports." + imported.alias());
                continue;
            }
            chain.add(imported.file());
            include(loaded.get(), prefix + imported.alias() + ".", chain, resolver, merged);
            chain.remove(chain.size() - 1);
        }
    }

    private static void put(Map<String, Map<String, Object>> target, String name, Map<String, Object> definition,
                            String section, Merged merged) {
        if (target.putIfAbsent(name, definition) != null) {
            merged.diagnostics.reportError("'" + name + "' defined twice after merging", section + "." + name);
        }
    }

    private static List<ActionNode> rewrite(List<ActionNode> actions, String prefix) {
        if (prefix.isEmpty()) {
            return actions;
        }
        List<ActionNode> result = new ArrayList<>(actions.size());
        for (ActionNode action : actions) {
            Map<String, Object> params = action.params();
            String key = flowParam(action.kind());
            if (key != null && isLiteral(params.get(key))) {
                params = new LinkedHashMap<>(params);
                params.put(key, prefix + params.get(key));
            }
            List<ActionNode.ConditionalBranch> branches = new ArrayList<>();
            for (ActionNode.ConditionalBranch branch : action.branches()) {
                branches.add(new ActionNode.ConditionalBranch(branch.when(), rewrite(branch.then(), prefix)));
            }
            result.add(new ActionNode(action.kind(), action.name(), params, rewrite(action.body(), prefix),
                    branches, action.fatal(), rewrite(action.onError(), prefix), action.path()));
        }
        return result;
    }

    private static String flowParam(ActionKind kind) {
        return switch (kind) {
            case GOTO, CALL -> "flow";
            case CONTINUATION_POINT -> "default_flow";
            default -> null;
        };
    }

    private static boolean isLiteral(Object ref) {
        return ref instanceof String name && !name.contains("${");
    }

    private static final class Merged {
        final DiagnosticsEngine diagnostics;
        final Map<String, Flow> flows = new LinkedHashMap<>();
        final Map<String, Map<String, Object>> goals = new LinkedHashMap<>();
        final Map<String, Map<String, Object>> actions = new LinkedHashMap<>();

        Merged(DiagnosticsEngine diagnostics) {
            this.diagnostics = diagnostics;
        }

        void validate(String onErrorFlow) {
            if (onErrorFlow != null && !flows.containsKey(onErrorFlow)) {
                diagnostics.reportError("Document on_error flow '" + onErrorFlow + "' not found", "on_error");
            }
            for (Flow flow : flows.values()) {
                validate(flow.actions());
                validate(flow.onError());
            }
        }

        private void validate(List<ActionNode> actions) {
            for (ActionNode action : actions) {
                String key = flowParam(action.kind());
                Object ref = key != null ? action.param(key) : null;
                if (isLiteral(ref) && !flows.containsKey(ref)) {
                    diagnostics.reportError("Flow '" + ref + "' not found", action.path());
                }
                validate(action.body());
                validate(action.onError());
                action.branches().forEach(branch -> validate(branch.then()));
            }
        }
    }
}
