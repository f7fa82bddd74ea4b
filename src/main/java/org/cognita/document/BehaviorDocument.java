package org.cognita.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, parsed behavior document: named flows plus the planning metadata
 * ({@code goals}, {@code actions}), the optional document-level error flow and the documents
 * it imports. A document with imports is flattened by
 * {@link org.cognita.document.merge.DocumentMerger} before it is executed.
 */
public final class BehaviorDocument {

    /** The flow run when no start flow is given. */
    public static final String DEFAULT_ENTRY_FLOW = "main";

    private final String id;
    private final String version;
    private final Map<String, Object> metadata;
    private final Map<String, Flow> flows;
    private final Map<String, Map<String, Object>> goals;
    private final Map<String, Map<String, Object>> actions;
    private final String onErrorFlow;
    private final List<DocumentImport> imports;

    public BehaviorDocument(String id, String version, Map<String, Object> metadata, Map<String, Flow> flows,
                            Map<String, Map<String, Object>> goals, Map<String, Map<String, Object>> actions,
                            String onErrorFlow) {
        this(id, version, metadata, flows, goals, actions, onErrorFlow, List.of());
    }

    public BehaviorDocument(String id, String version, Map<String, Object> metadata, Map<String, Flow> flows,
                            Map<String, Map<String, Object>> goals, Map<String, Map<String, Object>> actions,
                            String onErrorFlow, List<DocumentImport> imports) {
        this.id = id;
        this.version = version;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.flows = Collections.unmodifiableMap(new LinkedHashMap<>(flows));
        this.goals = Collections.unmodifiableMap(new LinkedHashMap<>(goals));
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        this.onErrorFlow = onErrorFlow;
        this.imports = List.copyOf(imports);
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Flow> getFlows() {
        return flows;
    }

    public Optional<Flow> getFlow(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    public boolean hasFlow(String name) {
        return flows.containsKey(name);
    }

    /**
     * @return The GOAP goal definitions keyed by goal id, in document order.
     */
    public Map<String, Map<String, Object>> getGoals() {
        return goals;
    }

    /**
     * @return The GOAP action definitions keyed by action id, in document order.
     */
    public Map<String, Map<String, Object>> getActions() {
        return actions;
    }

    /**
     * @return The document-level error flow, or null.
     */
    public String getOnErrorFlow() {
        return onErrorFlow;
    }

    public List<DocumentImport> getImports() {
        return imports;
    }

    public boolean hasImports() {
        return !imports.isEmpty();
    }

    /**
     * @return {@code main} if present, otherwise the first declared flow.
     */
    public String getEntryFlow() {
        if (flows.containsKey(DEFAULT_ENTRY_FLOW)) {
            return DEFAULT_ENTRY_FLOW;
        }
        return flows.keySet().iterator().next();
    }

    @Override
    public String toString() {
        return "BehaviorDocument{id=" + id + ", version=" + version + ", flows=" + flows.keySet() + "}";
    }
}
