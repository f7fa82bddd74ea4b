package org.cognita.document.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.cognita.document.ActionKind;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentImport;
import org.cognita.document.DocumentParseException;
import org.cognita.document.Flow;
import org.cognita.document.diagnostics.DiagnosticsEngine;
import org.cognita.document.expression.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads YAML behavior documents into the immutable document AST.
 * <p>
 * The YAML is read into a plain tree with Jackson and then lowered action by action. Problems
 * are collected in a {@link DiagnosticsEngine}; if any error was reported the load fails with a
 * {@link DocumentParseException} that carries all of them. Literal {@code goto}/{@code call}
 * targets, continuation-point default flows and the document {@code on_error} flow are
 * checked against the declared flows; targets under an import alias ({@code lib.greet}) are
 * left to the merge step.
 */
public class DocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);
    private static final Set<String> ACTION_MODIFIERS = Set.of("severity", "on_error");
    private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Parses a document.
     * @param yaml The YAML source.
     * @return The parsed document.
     * @throws DocumentParseException if the YAML is invalid or the document has errors.
     */
    public BehaviorDocument parse(String yaml) throws DocumentParseException {
        return parse(yaml, "<memory>");
    }

    /**
     * Parses a document from UTF-8 bytes, as delivered by a model store.
     */
    public BehaviorDocument parse(byte[] yaml, String documentName) throws DocumentParseException {
        return parse(new String(yaml, StandardCharsets.UTF_8), documentName);
    }

    /**
     * Parses a document.
     * @param yaml The YAML source.
     * @param documentName The name used in diagnostics.
     * @return The parsed document.
     * @throws DocumentParseException if the YAML is invalid or the document has errors.
     */
    public BehaviorDocument parse(String yaml, String documentName) throws DocumentParseException {
        Object tree;
        try {
            tree = yamlMapper.readValue(yaml, Object.class);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException("Invalid YAML in " + documentName + ": " + e.getOriginalMessage(), e);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(documentName);
        BehaviorDocument document = lower(Values.normalize(tree), diagnostics);
        if (diagnostics.hasErrors()) {
            throw new DocumentParseException("Document " + documentName + " has errors:\n" + diagnostics.summary(),
                    diagnostics.getDiagnostics());
        }
        diagnostics.getDiagnostics().forEach(d -> LOG.debug("{}", d));
        return document;
    }

    private BehaviorDocument lower(Object tree, DiagnosticsEngine diagnostics) {
        if (!(tree instanceof Map<?, ?> root)) {
            diagnostics.reportError("Document root must be a mapping", "");
            return null;
        }
        String version = root.containsKey("version") ? Values.format(root.get("version")) : "2.0";
        Map<String, Object> metadata = asMap(root.get("metadata"), "metadata", diagnostics);
        String id = metadata.containsKey("id") ? Values.format(metadata.get("id")) : "anonymous";

        Map<String, Flow> flows = new LinkedHashMap<>();
        Object flowsNode = root.get("flows");
        if (!(flowsNode instanceof Map<?, ?> flowMap) || flowMap.isEmpty()) {
            diagnostics.reportError("Document must declare at least one flow under 'flows'", "flows");
        } else {
            flowMap.forEach((name, definition) -> {
                String flowName = String.valueOf(name);
                flows.put(flowName, lowerFlow(flowName, definition, diagnostics));
            });
        }

        String onErrorFlow = root.get("on_error") != null ? Values.format(root.get("on_error")) : null;
        Map<String, Map<String, Object>> goals = definitions(root.get("goals"), "goals", diagnostics);
        Map<String, Map<String, Object>> actions = definitions(root.get("actions"), "actions", diagnostics);
        List<DocumentImport> imports = lowerImports(root.get("imports"), diagnostics);

        if (!diagnostics.hasErrors()) {
            Set<String> aliases = new HashSet<>();
            imports.forEach(i -> aliases.add(i.alias()));
            validateTargets(flows, onErrorFlow, aliases, diagnostics);
        }
        return new BehaviorDocument(id, version, metadata, flows, goals, actions, onErrorFlow, imports);
    }

    private List<DocumentImport> lowerImports(Object node, DiagnosticsEngine diagnostics) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            diagnostics.reportError("'imports' must be a list", "imports");
            return List.of();
        }
        List<DocumentImport> imports = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            String path = "imports[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> entry) || entry.get("file") == null || entry.get("as") == null) {
                diagnostics.reportError("Import needs 'file' and 'as'", path);
                continue;
            }
            String alias = Values.format(entry.get("as"));
            if (!ALIAS.matcher(alias).matches()) {
                diagnostics.reportError("Import alias '" + alias + "' must be a plain identifier", path);
            } else if (!seen.add(alias)) {
                diagnostics.reportError("Import alias '" + alias + "' declared twice", path);
            } else {
                imports.add(new DocumentImport(Values.format(entry.get("file")), alias));
            }
        }
        return imports;
    }

    private Flow lowerFlow(String name, Object definition, DiagnosticsEngine diagnostics) {
        String path = "flows." + name;
        if (definition instanceof List<?> list) {
            return new Flow(name, lowerActions(list, path, diagnostics), List.of());
        }
        if (definition instanceof Map<?, ?> map) {
            List<ActionNode> actions = lowerActionList(map.get("actions"), path + ".actions", diagnostics);
            List<ActionNode> onError = lowerActionList(map.get("on_error"), path + ".on_error", diagnostics);
            return new Flow(name, actions, onError);
        }
        if (definition != null) {
            diagnostics.reportError("Flow must be a list of actions or a mapping with 'actions'", path);
        }
        return new Flow(name, List.of(), List.of());
    }

    private List<ActionNode> lowerActionList(Object node, String path, DiagnosticsEngine diagnostics) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            diagnostics.reportError("Expected a list of actions", path);
            return List.of();
        }
        return lowerActions(list, path, diagnostics);
    }

    private List<ActionNode> lowerActions(List<?> list, String path, DiagnosticsEngine diagnostics) {
        List<ActionNode> actions = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            ActionNode action = lowerAction(list.get(i), path + "[" + i + "]", diagnostics);
            if (action != null) {
                actions.add(action);
            }
        }
        return actions;
    }

    private ActionNode lowerAction(Object node, String path, DiagnosticsEngine diagnostics) {
        String key;
        Object args;
        boolean fatal = false;
        List<ActionNode> onError = List.of();
        if (node instanceof String s) {
            key = s;
            args = null;
        } else if (node instanceof Map<?, ?> actionMap) {
            List<String> keys = new ArrayList<>();
            for (Object k : actionMap.keySet()) {
                if (!ACTION_MODIFIERS.contains(String.valueOf(k))) {
                    keys.add(String.valueOf(k));
                }
            }
            if (keys.size() != 1) {
                diagnostics.reportError("Action must have exactly one action key, found " + keys, path);
                return null;
            }
            key = keys.get(0);
            args = actionMap.get(key);
            Object severity = actionMap.get("severity");
            if (severity != null) {
                String level = Values.format(severity);
                if (level.equalsIgnoreCase("fatal")) {
                    fatal = true;
                } else if (!level.equalsIgnoreCase("recoverable")) {
                    diagnostics.reportWarning("Unknown severity '" + level + "', treated as recoverable", path);
                }
            }
            onError = lowerActionList(actionMap.get("on_error"), path + ".on_error", diagnostics);
        } else {
            diagnostics.reportError("Action must be a mapping or a bare action name", path);
            return null;
        }

        ActionKind kind = ActionKind.fromKey(key);
        String actionPath = path + "." + key;
        Map<String, Object> params = new LinkedHashMap<>();
        List<ActionNode> body = List.of();
        List<ActionNode.ConditionalBranch> branches = List.of();

        switch (kind) {
            case SET, LOCAL, GLOBAL -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "variable", actionPath, diagnostics);
                params.put("variable", map.get("variable"));
                params.put("value", map.get("value"));
            }
            case CLEAR -> params.put("variable", scalarOr(args, "variable", actionPath, diagnostics));
            case INCREMENT, DECREMENT -> {
                if (args instanceof Map<?, ?>) {
                    Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                    requireKey(map, "variable", actionPath, diagnostics);
                    params.put("variable", map.get("variable"));
                    params.put("by", map.getOrDefault("by", 1.0));
                } else {
                    params.put("variable", scalarOr(args, "variable", actionPath, diagnostics));
                    params.put("by", 1.0);
                }
            }
            case LOG -> {
                if (args instanceof Map<?, ?>) {
                    params.putAll(requireMap(args, actionPath, diagnostics));
                } else {
                    params.put("message", args);
                }
            }
            case COND -> branches = lowerBranches(args, actionPath, diagnostics);
            case REPEAT -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "times", actionPath, diagnostics);
                params.put("times", map.get("times"));
                body = lowerActionList(map.get("do"), actionPath + ".do", diagnostics);
            }
            case FOR_EACH -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "variable", actionPath, diagnostics);
                requireKey(map, "collection", actionPath, diagnostics);
                params.put("variable", map.get("variable"));
                params.put("collection", map.get("collection"));
                body = lowerActionList(map.get("do"), actionPath + ".do", diagnostics);
            }
            case GOTO, CALL -> {
                if (args instanceof Map<?, ?>) {
                    Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                    requireKey(map, "flow", actionPath, diagnostics);
                    params.put("flow", map.get("flow"));
                    params.put("args", map.get("args"));
                } else {
                    params.put("flow", scalarOr(args, "flow", actionPath, diagnostics));
                }
            }
            case RETURN -> {
                if (args instanceof Map<?, ?> returnMap && returnMap.size() == 1 && returnMap.containsKey("value")) {
                    params.put("value", returnMap.get("value"));
                } else {
                    params.put("value", args);
                }
            }
            case CONTINUATION_POINT -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "name", actionPath, diagnostics);
                requireKey(map, "default_flow", actionPath, diagnostics);
                params.putAll(map);
            }
            case WAIT -> {
                if (args instanceof Map<?, ?>) {
                    params.putAll(requireMap(args, actionPath, diagnostics));
                } else {
                    params.put("ms", args);
                }
                if (params.get("ms") == null) {
                    diagnostics.reportError("'wait' requires 'ms'", actionPath);
                }
            }
            case SELF_TERMINATE, TRIGGER_GOAP_REPLAN -> {
                if (args instanceof Map<?, ?>) {
                    params.putAll(requireMap(args, actionPath, diagnostics));
                } else if (args != null) {
                    params.put(kind == ActionKind.SELF_TERMINATE ? "reason" : "urgency", args);
                }
            }
            case SET_FEELING -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "name", actionPath, diagnostics);
                requireKey(map, "value", actionPath, diagnostics);
                params.putAll(map);
            }
            case SET_GOAL -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "name", actionPath, diagnostics);
                params.putAll(map);
            }
            case REMEMBER -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                requireKey(map, "key", actionPath, diagnostics);
                params.putAll(map);
            }
            case EMIT -> {
                Map<String, Object> map = requireMap(args, actionPath, diagnostics);
                if (map.get("intent") == null && map.get("signal") == null) {
                    diagnostics.reportError("'emit' requires 'intent' or 'signal'", actionPath);
                }
                params.putAll(map);
            }
            case WAIT_FOR -> {
                if (args instanceof Map<?, ?>) {
                    params.putAll(requireMap(args, actionPath, diagnostics));
                } else {
                    params.put("signal", args);
                }
                if (params.get("signal") == null) {
                    diagnostics.reportError("'wait_for' requires 'signal'", actionPath);
                }
            }
            case SYNC -> params.put("point", scalarOr(args, "point", actionPath, diagnostics));
            case EXTENSION -> {
                if (args instanceof Map<?, ?>) {
                    params.putAll(requireMap(args, actionPath, diagnostics));
                } else if (args != null) {
                    params.put("value", args);
                }
            }
        }
        return new ActionNode(kind, key, params, body, branches, fatal, onError, path);
    }

    private List<ActionNode.ConditionalBranch> lowerBranches(Object args, String path, DiagnosticsEngine diagnostics) {
        if (!(args instanceof List<?> list)) {
            diagnostics.reportError("'cond' expects a list of branches", path);
            return List.of();
        }
        List<ActionNode.ConditionalBranch> branches = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String branchPath = path + "[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> branch)) {
                diagnostics.reportError("Branch must be a mapping", branchPath);
                continue;
            }
            if (branch.containsKey("else")) {
                if (i != list.size() - 1) {
                    diagnostics.reportError("'else' must be the last branch", branchPath);
                }
                branches.add(new ActionNode.ConditionalBranch(null,
                        lowerActionList(branch.get("else"), branchPath + ".else", diagnostics)));
            } else if (branch.containsKey("when")) {
                branches.add(new ActionNode.ConditionalBranch(Values.format(branch.get("when")),
                        lowerActionList(branch.get("then"), branchPath + ".then", diagnostics)));
            } else {
                diagnostics.reportError("Branch needs 'when' or 'else'", branchPath);
            }
        }
        return branches;
    }

    private void validateTargets(Map<String, Flow> flows, String onErrorFlow, Set<String> aliases,
                                 DiagnosticsEngine diagnostics) {
        if (onErrorFlow != null && !flows.containsKey(onErrorFlow) && !isImported(onErrorFlow, aliases)) {
            diagnostics.reportError("Document on_error flow '" + onErrorFlow + "' not found", "on_error");
        }
        for (Flow flow : flows.values()) {
            validateActions(flow.actions(), flows, aliases, diagnostics);
            validateActions(flow.onError(), flows, aliases, diagnostics);
        }
    }

    private void validateActions(List<ActionNode> actions, Map<String, Flow> flows, Set<String> aliases,
                                 DiagnosticsEngine diagnostics) {
        for (ActionNode action : actions) {
            switch (action.kind()) {
                case GOTO, CALL -> checkFlowRef(action.param("flow"), flows, aliases, action, diagnostics);
                case CONTINUATION_POINT -> checkFlowRef(action.param("default_flow"), flows, aliases, action, diagnostics);
                default -> { }
            }
            validateActions(action.body(), flows, aliases, diagnostics);
            validateActions(action.onError(), flows, aliases, diagnostics);
            for (ActionNode.ConditionalBranch branch : action.branches()) {
                validateActions(branch.then(), flows, aliases, diagnostics);
            }
        }
    }

    private void checkFlowRef(Object ref, Map<String, Flow> flows, Set<String> aliases, ActionNode action,
                              DiagnosticsEngine diagnostics) {
        if (ref instanceof String name && !name.contains("${") && !flows.containsKey(name) && !isImported(name, aliases)) {
            diagnostics.reportError("Flow '" + name + "' not found", action.path());
        }
    }

    private static boolean isImported(String flowName, Set<String> aliases) {
        int dot = flowName.indexOf('.');
        return dot > 0 && aliases.contains(flowName.substring(0, dot));
    }

    private Map<String, Map<String, Object>> definitions(Object node, String path, DiagnosticsEngine diagnostics) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        asMap(node, path, diagnostics).forEach((name, definition) ->
                result.put(name, asMap(definition, path + "." + name, diagnostics)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String path, DiagnosticsEngine diagnostics) {
        if (node == null) {
            return new LinkedHashMap<>();
        }
        if (node instanceof Map<?, ?>) {
            return (Map<String, Object>) node;
        }
        diagnostics.reportError("Expected a mapping", path);
        return new LinkedHashMap<>();
    }

    private static Map<String, Object> requireMap(Object args, String path, DiagnosticsEngine diagnostics) {
        if (!(args instanceof Map<?, ?>)) {
            diagnostics.reportError("Expected a mapping of parameters", path);
            return new LinkedHashMap<>();
        }
        return asMap(args, path, diagnostics);
    }

    private static void requireKey(Map<String, Object> map, String key, String path, DiagnosticsEngine diagnostics) {
        if (map.get(key) == null) {
            diagnostics.reportError("Missing required parameter '" + key + "'", path);
        }
    }

    private static Object scalarOr(Object args, String key, String path, DiagnosticsEngine diagnostics) {
        if (args instanceof Map<?, ?> map) {
            Object value = map.get(key);
            if (value == null) {
                diagnostics.reportError("Missing required parameter '" + key + "'", path);
            }
            return value;
        }
        if (args == null) {
            diagnostics.reportError("Missing required parameter '" + key + "'", path);
        }
        return args;
    }
}
