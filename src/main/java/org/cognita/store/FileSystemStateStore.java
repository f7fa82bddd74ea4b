package org.cognita.store;

import com.typesafe.config.Config;
import org.cognita.actor.state.ActorStateSnapshot;
import org.cognita.actor.state.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link IStateStore} keeping one JSON file per actor under a root directory. Writes go to a
 * temporary file that is then moved over the target atomically.
 */
public class FileSystemStateStore implements IStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStateStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final File rootDirectory;
    private final SnapshotCodec codec = new SnapshotCodec();

    /**
     * @param options Must contain {@code rootDirectory}.
     */
    public FileSystemStateStore(Config options) {
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemStateStore");
        }
        this.rootDirectory = new File(options.getString("rootDirectory")).getAbsoluteFile();
        if (!this.rootDirectory.exists() && !this.rootDirectory.mkdirs()) {
            throw new IllegalArgumentException("Failed to create rootDirectory: " + rootDirectory);
        }
    }

    @Override
    public void save(ActorStateSnapshot snapshot) throws IOException {
        File file = fileFor(snapshot.actorId());
        byte[] data = codec.encode(snapshot);

        // .UUID.tmp suffix so concurrent writers never share a temp file
        File tempFile = new File(rootDirectory, file.getName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile.toPath(), data);

        try {
            Files.move(tempFile.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile.toPath());
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }
    }

    @Override
    public Optional<ActorStateSnapshot> load(String actorId) throws IOException {
        File file = fileFor(actorId);
        if (!file.exists()) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(Files.readAllBytes(file.toPath())));
    }

    @Override
    public void delete(String actorId) throws IOException {
        Files.deleteIfExists(fileFor(actorId).toPath());
    }

    public File getRootDirectory() {
        return rootDirectory;
    }

    private File fileFor(String actorId) {
        if (actorId == null || !SAFE_ID.matcher(actorId).matches() || actorId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid actor id for file storage: " + actorId);
        }
        return new File(rootDirectory, actorId + ".json");
    }
}
