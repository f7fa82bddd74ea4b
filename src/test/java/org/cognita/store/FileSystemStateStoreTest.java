package org.cognita.store;

import com.typesafe.config.ConfigFactory;
import org.cognita.actor.ActorStatus;
import org.cognita.actor.state.ActorStateSnapshot;
import org.cognita.actor.state.ExecutionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class FileSystemStateStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemStateStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemStateStore(ConfigFactory.parseMap(Map.of("rootDirectory", tempDir.resolve("state").toString())));
    }

    private static ActorStateSnapshot snapshot(String actorId, long iteration) {
        return new ActorStateSnapshot(actorId, "wolf", ActorStatus.RUNNING, iteration, Map.of("fear", 0.5),
                Map.of(), Map.of("den", "north"), ExecutionState.empty(), null, 1L);
    }

    @Test
    void savesLoadsAndOverwrites() throws IOException {
        store.save(snapshot("wolf-1", 1));
        store.save(snapshot("wolf-1", 2));

        ActorStateSnapshot loaded = store.load("wolf-1").orElseThrow();

        assertThat(loaded.iteration()).isEqualTo(2);
        assertThat(loaded.memories()).containsEntry("den", "north");
        assertThat(new File(store.getRootDirectory(), "wolf-1.json")).exists();
        assertThat(store.getRootDirectory().list()).containsExactly("wolf-1.json");
    }

    @Test
    void missingActorLoadsEmptyAndDeleteIsIdempotent() throws IOException {
        assertThat(store.load("nobody")).isEmpty();

        store.save(snapshot("wolf-1", 1));
        store.delete("wolf-1");
        store.delete("wolf-1");

        assertThat(store.load("wolf-1")).isEmpty();
    }

    @Test
    void rejectsUnsafeActorIds() {
        assertThatThrownBy(() -> store.load("../escape")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.load(".hidden")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.save(snapshot("a/b", 1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requiresRootDirectory() {
        assertThatThrownBy(() -> new FileSystemStateStore(ConfigFactory.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rootDirectory");
    }
}
