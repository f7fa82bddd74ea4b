package org.cognita.document.parser;

import org.cognita.document.ActionKind;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentImport;
import org.cognita.document.DocumentParseException;
import org.cognita.document.Flow;
import org.cognita.document.diagnostics.Diagnostic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Loading of YAML behavior documents into the document tree, and the diagnostics reported for
 * malformed documents.
 */
@Tag("unit")
class DocumentParserTest {

    private DocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new DocumentParser();
    }

    @Test
    void parsesFlowsInBothForms() throws Exception {
        BehaviorDocument document = parser.parse("""
                version: 2
                metadata:
                  id: wolf
                flows:
                  main:
                    - set: {variable: hunger, value: 3}
                    - increment: hunger
                    - call: {flow: helper, args: {x: 1}}
                  helper:
                    actions:
                      - return: "${x + 1}"
                    on_error:
                      - log: helper failed
                """);

        assertThat(document.getId()).isEqualTo("wolf");
        assertThat(document.getVersion()).isEqualTo("2");
        assertThat(document.getEntryFlow()).isEqualTo("main");
        Flow main = document.getFlow("main").orElseThrow();
        assertThat(main.actions()).extracting(ActionNode::kind)
                .containsExactly(ActionKind.SET, ActionKind.INCREMENT, ActionKind.CALL);
        assertThat(main.actions().get(0).param("value")).isEqualTo(3.0);
        assertThat(main.actions().get(1).param("by")).isEqualTo(1.0);
        assertThat(main.actions().get(0).path()).isEqualTo("flows.main[0]");
        assertThat(document.getFlow("helper").orElseThrow().onError()).hasSize(1);
    }

    @Test
    void parsesConditionalBranchesAndModifiers() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  tick:
                    - cond:
                        - when: "${hunger > 0.7}"
                          then:
                            - emit: {intent: eat}
                        - else:
                            - wait: 100
                      severity: fatal
                      on_error:
                        - log: cond failed
                    - self_terminate
                """);

        assertThat(document.getEntryFlow()).isEqualTo("tick");
        ActionNode cond = document.getFlow("tick").orElseThrow().actions().get(0);
        assertThat(cond.fatal()).isTrue();
        assertThat(cond.onError()).hasSize(1);
        assertThat(cond.branches()).hasSize(2);
        assertThat(cond.branches().get(0).when()).isEqualTo("${hunger > 0.7}");
        assertThat(cond.branches().get(1).isElse()).isTrue();
        assertThat(cond.branches().get(1).then().get(0).param("ms")).isEqualTo(100.0);
        assertThat(document.getFlow("tick").orElseThrow().actions().get(1).kind()).isEqualTo(ActionKind.SELF_TERMINATE);
    }

    @Test
    void keepsUnknownActionsAsExtensions() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  main:
                    - play_sound: {clip: howl}
                """);

        ActionNode action = document.getFlow("main").orElseThrow().actions().get(0);
        assertThat(action.kind()).isEqualTo(ActionKind.EXTENSION);
        assertThat(action.name()).isEqualTo("play_sound");
        assertThat(action.param("clip")).isEqualTo("howl");
    }

    @Test
    void readsGoalAndActionDefinitions() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  main: []
                goals:
                  fed:
                    conditions: {hungry: false}
                actions:
                  eat:
                    cost: 1
                    preconditions: {has_food: true}
                    effects: {hungry: false}
                on_error: main
                """.getBytes(StandardCharsets.UTF_8), "wolf.yaml");

        assertThat(document.getGoals()).containsOnlyKeys("fed");
        assertThat(document.getActions().get("eat")).containsEntry("cost", 1.0);
        assertThat(document.getOnErrorFlow()).isEqualTo("main");
    }

    @Test
    void rejectsInvalidYaml() {
        assertThatThrownBy(() -> parser.parse("flows: [unclosed", "broken.yaml"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("Invalid YAML in broken.yaml");
    }

    @Test
    void collectsAllErrorsOfADocument() {
        assertThatThrownBy(() -> parser.parse("""
                flows:
                  main:
                    - goto: nowhere
                    - {set: {variable: a, value: 1}, log: two keys}
                    - set: {value: 1}
                    - cond:
                        - else: []
                        - when: "${true}"
                          then: []
                """, "bad.yaml"))
                .hasMessageContaining("bad.yaml")
                .isInstanceOfSatisfying(DocumentParseException.class, e -> {
                    assertThat(e.getDiagnostics()).extracting(Diagnostic::type).containsOnly(Diagnostic.Type.ERROR);
                    assertThat(e.getDiagnostics()).extracting(Diagnostic::message)
                            .anyMatch(m -> m.contains("exactly one action key"))
                            .anyMatch(m -> m.contains("Missing required parameter 'variable'"))
                            .anyMatch(m -> m.contains("'else' must be the last branch"));
                });
    }

    @Test
    void reportsUnknownFlowTargets() {
        assertThatThrownBy(() -> parser.parse("""
                flows:
                  main:
                    - goto: nowhere
                    - continuation_point: {name: decide, default_flow: missing}
                on_error: handler
                """))
                .isInstanceOfSatisfying(DocumentParseException.class, e ->
                        assertThat(e.getDiagnostics()).extracting(Diagnostic::message)
                                .contains("Flow 'nowhere' not found", "Flow 'missing' not found",
                                        "Document on_error flow 'handler' not found"));
    }

    @Test
    void templatedTargetsAreCheckedAtRuntime() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  main:
                    - goto: "${next}"
                """);

        assertThat(document.getFlows()).containsOnlyKeys("main");
    }

    @Test
    void requiresAtLeastOneFlow() {
        assertThatThrownBy(() -> parser.parse("metadata: {id: empty}"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("at least one flow");
        assertThatThrownBy(() -> parser.parse("- just a list"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("root must be a mapping");
    }

    @Test
    void unknownSeverityIsOnlyAWarning() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  main:
                    - log: hello
                      severity: loud
                """);

        assertThat(document.getFlow("main").orElseThrow().actions().get(0).fatal()).isFalse();
    }

    @Test
    void readsImportsAndLeavesAliasedTargetsToTheMerge() throws Exception {
        BehaviorDocument document = parser.parse("""
                imports:
                  - {file: common.yml, as: common}
                flows:
                  main:
                    - call: common.greet
                    - goto: {flow: common.idle}
                """);

        assertThat(document.getImports()).containsExactly(new DocumentImport("common.yml", "common"));
        assertThat(document.hasImports()).isTrue();
    }

    @Test
    void rejectsMalformedImports() {
        assertThatThrownBy(() -> parser.parse("""
                imports:
                  - {file: a.yml, as: lib}
                  - {file: b.yml, as: lib}
                  - {file: c.yml, as: "x.y"}
                  - {file: d.yml}
                flows:
                  main:
                    - log: hi
                """))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("'lib' declared twice")
                .hasMessageContaining("'x.y' must be a plain identifier")
                .hasMessageContaining("needs 'file' and 'as'");
    }

    @Test
    void parsesChannelActions() throws Exception {
        BehaviorDocument document = parser.parse("""
                flows:
                  main:
                    - emit: {signal: ready, payload: 1}
                    - wait_for: go
                    - wait_for: {signal: done, timeout_ms: 50}
                    - sync: barrier
                """);

        List<ActionNode> actions = document.getFlow("main").orElseThrow().actions();
        assertThat(actions).extracting(ActionNode::kind)
                .containsExactly(ActionKind.EMIT, ActionKind.WAIT_FOR, ActionKind.WAIT_FOR, ActionKind.SYNC);
        assertThat(actions.get(1).param("signal")).isEqualTo("go");
        assertThat(actions.get(2).param("timeout_ms")).isEqualTo(50.0);
        assertThat(actions.get(3).param("point")).isEqualTo("barrier");
    }

    @Test
    void emitNeedsIntentOrSignal() {
        assertThatThrownBy(() -> parser.parse("""
                flows:
                  main:
                    - emit: {payload: 1}
                """))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("'emit' requires 'intent' or 'signal'");
    }
}
