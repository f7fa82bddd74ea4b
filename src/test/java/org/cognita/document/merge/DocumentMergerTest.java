package org.cognita.document.merge;

import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentParseException;
import org.cognita.document.Flow;
import org.cognita.document.execution.DocumentExecutor;
import org.cognita.document.execution.ExecutionResult;
import org.cognita.document.execution.VariableScope;
import org.cognita.document.parser.DocumentParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Flattening of imported documents into one: name prefixes, target rewriting and import errors.
 */
@Tag("unit")
class DocumentMergerTest {

    private final DocumentParser parser = new DocumentParser();
    private final Map<String, String> files = new HashMap<>();

    private final IDocumentResolver resolver = reference -> {
        String yaml = files.get(reference);
        return yaml == null ? Optional.empty() : Optional.of(parser.parse(yaml, reference));
    };

    private BehaviorDocument merge(String yaml) throws Exception {
        return DocumentMerger.merge("root.yml", parser.parse(yaml, "root.yml"), resolver);
    }

    private static Object target(BehaviorDocument document, String flow, int index, String param) {
        return document.getFlow(flow).orElseThrow().actions().get(index).param(param);
    }

    @Test
    void documentWithoutImportsIsReturnedAsIs() throws Exception {
        BehaviorDocument document = parser.parse("flows: {main: [{log: hi}]}");

        assertThat(DocumentMerger.merge("root.yml", document, resolver)).isSameAs(document);
    }

    @Test
    void importedFlowsLiveUnderTheirAlias() throws Exception {
        files.put("common.yml", """
                flows:
                  greet: [{log: hello}, {call: helper}]
                  helper: [{return: 1}]
                """);

        BehaviorDocument merged = merge("""
                metadata: {id: wolf}
                imports: [{file: common.yml, as: common}]
                flows:
                  main: [{call: common.greet}]
                """);

        assertThat(merged.getId()).isEqualTo("wolf");
        assertThat(merged.getFlows()).containsOnlyKeys("main", "common.greet", "common.helper");
        assertThat(merged.hasImports()).isFalse();
        assertThat(target(merged, "common.greet", 1, "flow")).isEqualTo("common.helper");
        assertThat(merged.getFlow("common.greet").map(Flow::name)).contains("common.greet");
    }

    @Test
    void nestedImportsStackPrefixes() throws Exception {
        files.put("b.yml", """
                imports: [{file: c.yml, as: c}]
                flows:
                  entry: [{goto: c.deep}]
                """);
        files.put("c.yml", "flows: {deep: [{return: bottom}]}");

        BehaviorDocument merged = merge("""
                imports: [{file: b.yml, as: b}]
                flows:
                  main: [{call: b.entry}]
                """);

        assertThat(merged.getFlows()).containsOnlyKeys("main", "b.entry", "b.c.deep");
        assertThat(target(merged, "b.entry", 0, "flow")).isEqualTo("b.c.deep");
    }

    @Test
    void rewritesTargetsInsideNestedBlocksAndErrorHandlers() throws Exception {
        files.put("lib.yml", """
                flows:
                  run:
                    actions:
                      - cond:
                          - when: "${ready}"
                            then: [{call: go}]
                      - for_each:
                          variable: item
                          collection: "${items}"
                          do: [{call: go}]
                      - continuation_point: {name: decide, default_flow: go}
                      - goto: {flow: go, args: {speed: 2}}
                      - goto: "${dynamic}"
                    on_error: [{goto: recover}]
                  go: []
                  recover: []
                """);

        BehaviorDocument merged = merge("""
                imports: [{file: lib.yml, as: lib}]
                flows: {main: [{call: lib.run}]}
                """);

        Flow run = merged.getFlow("lib.run").orElseThrow();
        ActionNode cond = run.actions().get(0);
        assertThat(cond.branches().get(0).then().get(0).param("flow")).isEqualTo("lib.go");
        assertThat(run.actions().get(1).body().get(0).param("flow")).isEqualTo("lib.go");
        assertThat(run.actions().get(2).param("default_flow")).isEqualTo("lib.go");
        assertThat(run.actions().get(3).param("flow")).isEqualTo("lib.go");
        assertThat(run.actions().get(3).param("args")).isEqualTo(Map.of("speed", 2.0));
        assertThat(run.actions().get(4).param("flow")).isEqualTo("${dynamic}");
        assertThat(run.onError().get(0).param("flow")).isEqualTo("lib.recover");
    }

    @Test
    void prefixesGoalsAndActions() throws Exception {
        files.put("ai.yml", """
                flows: {idle: []}
                goals:
                  eat: {priority: 10, conditions: {hunger: "<= 0.3"}}
                actions:
                  find_food: {effects: {has_food: "true"}, cost: 1}
                """);

        BehaviorDocument merged = merge("""
                imports: [{file: ai.yml, as: ai}]
                goals:
                  rest: {priority: 1, conditions: {energy: ">= 0.5"}}
                flows: {main: []}
                """);

        assertThat(merged.getGoals()).containsOnlyKeys("rest", "ai.eat");
        assertThat(merged.getActions()).containsOnlyKeys("ai.find_food");
    }

    @Test
    void mergedDocumentRunsLikeTheOriginal() throws Exception {
        files.put("math.yml", """
                flows:
                  double: [{return: "${n * 2}"}]
                """);
        BehaviorDocument merged = merge("""
                imports: [{file: math.yml, as: math}]
                flows:
                  main:
                    - call: {flow: math.double, args: {n: 21}}
                    - return: "${_result}"
                """);

        ExecutionResult result = new DocumentExecutor().execute(merged, null, new VariableScope());

        assertThat(result).isEqualTo(new ExecutionResult.Completed(42.0, List.of()));
    }

    @Test
    void detectsImportCycles() {
        files.put("a.yml", "imports: [{file: b.yml, as: b}]\nflows: {a: []}");
        files.put("b.yml", "imports: [{file: a.yml, as: a}]\nflows: {b: []}");

        assertThatThrownBy(() -> merge("imports: [{file: a.yml, as: a}]\nflows: {main: []}"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("Import cycle: root.yml -> a.yml -> b.yml -> a.yml");
    }

    @Test
    void reportsMissingImportsAndUnknownImportedFlows() {
        files.put("lib.yml", "flows: {greet: []}");

        assertThatThrownBy(() -> merge("""
                imports:
                  - {file: lib.yml, as: lib}
                  - {file: gone.yml, as: gone}
                flows:
                  main: [{call: lib.wave}]
                """))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("Imported document 'gone.yml' not found")
                .hasMessageContaining("Flow 'lib.wave' not found");
    }
}
