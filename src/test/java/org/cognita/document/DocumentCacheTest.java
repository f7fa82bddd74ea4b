package org.cognita.document;

import org.cognita.store.InMemoryModelStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DocumentCacheTest {

    private final InMemoryModelStore store = new InMemoryModelStore();
    private final DocumentCache cache = new DocumentCache(store);

    private void save(String reference, String yaml) {
        store.save(reference, yaml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parsesOnceUntilStoreReportsUpdate() throws Exception {
        save("wolf", "flows: {main: []}");
        BehaviorDocument first = cache.get("wolf").orElseThrow();

        assertThat(cache.get("wolf")).containsSame(first);

        save("wolf", "flows: {main: [], hunt: []}");

        assertThat(cache.get("wolf").orElseThrow().hasFlow("hunt")).isTrue();
        assertThat(cache.get("bear")).isEmpty();
    }

    @Test
    void invalidDocumentIsNotCached() {
        save("broken", "flows: [");

        assertThatThrownBy(() -> cache.get("broken")).isInstanceOf(DocumentParseException.class);
    }

    @Test
    void handleVersionsCountReplacements() throws Exception {
        save("wolf", "flows: {main: []}");
        DocumentHandle handle = DocumentHandle.initial("wolf", cache.get("wolf").orElseThrow());

        DocumentHandle next = handle.next(handle.document());

        assertThat(handle.version()).isEqualTo(1);
        assertThat(next.version()).isEqualTo(2);
        assertThat(next.reference()).isEqualTo("wolf");
    }

    @Test
    void mergesImportsAndInvalidatesImporters() throws Exception {
        save("common.yml", "flows: {greet: [{log: hello}]}");
        save("wolf", """
                imports: [{file: common.yml, as: common}]
                flows: {main: [{call: common.greet}]}
                """);
        BehaviorDocument first = cache.get("wolf").orElseThrow();

        assertThat(first.getFlows()).containsOnlyKeys("main", "common.greet");
        assertThat(cache.affectedBy("common.yml")).containsExactly("common.yml", "wolf");

        save("common.yml", "flows: {greet: [{log: hi}], wave: []}");

        assertThat(cache.get("wolf").orElseThrow().getFlows()).containsOnlyKeys("main", "common.greet", "common.wave");
    }

    @Test
    void missingImportFailsTheLookup() {
        save("wolf", """
                imports: [{file: missing.yml, as: lib}]
                flows: {main: [{call: lib.greet}]}
                """);

        assertThatThrownBy(() -> cache.get("wolf"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("Imported document 'missing.yml' not found");
    }
}
