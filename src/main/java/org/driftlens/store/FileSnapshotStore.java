package org.driftlens.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.driftlens.error.CorruptSnapshotException;
import org.driftlens.error.NotFoundException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotCodec;

/**
 * One {@code <id>.json} file per snapshot in a single directory. Each file is written to a temporary sibling
 * and moved into place; there is no atomicity across files.
 */
public final class FileSnapshotStore implements SnapshotStore {
    static final String EXTENSION = ".json";
    private static final Pattern SNAPSHOT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

    private final Path directory;
    private final JsonLinesLogger logger;
    private final LogContext logContext;

    public FileSnapshotStore(final Path directory) {
        this(directory, JsonLinesLogger.noop());
    }

    public FileSnapshotStore(final Path directory, final JsonLinesLogger logger) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.logger = Objects.requireNonNull(logger, "logger");
        this.logContext = LogContext.of("store");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(final Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        final Path target = pathOf(snapshot.id());
        final String json = SnapshotCodec.toJson(snapshot);
        try {
            Files.createDirectories(directory);
            final Path temp = Files.createTempFile(directory, "." + snapshot.id(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException atomicMoveNotSupported) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + target, e);
        }
        logger.debug("store.snapshot.saved", logContext, Map.of("snapshotId", snapshot.id(), "path", target.toString()));
    }

    @Override
    public Snapshot load(final String snapshotId) {
        final Path file = pathOf(snapshotId);
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("snapshot", snapshotId);
        }
        return read(file);
    }

    @Override
    public boolean contains(final String snapshotId) {
        return Files.isRegularFile(pathOf(snapshotId));
    }

    @Override
    public List<String> ids() {
        final List<String> ids = new ArrayList<>();
        for (final Path file : files()) {
            final String name = file.getFileName().toString();
            ids.add(name.substring(0, name.length() - EXTENSION.length()));
        }
        return ids;
    }

    /**
     * Decodes every stored file in file-name order.
     *
     * @throws CorruptSnapshotException naming the file when any of them cannot be decoded
     */
    @Override
    public List<Snapshot> loadAll() {
        final List<Snapshot> snapshots = new ArrayList<>();
        for (final Path file : files()) {
            snapshots.add(read(file));
        }
        return snapshots;
    }

    List<Path> files() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to list snapshot directory " + directory, e);
        }
    }

    Snapshot read(final Path file) {
        final String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + file, e);
        }
        try {
            return SnapshotCodec.fromJson(json);
        } catch (final CorruptSnapshotException e) {
            final String name = file.getFileName().toString();
            throw new CorruptSnapshotException(e.problems().stream().map(problem -> name + ": " + problem).toList());
        }
    }

    private Path pathOf(final String snapshotId) {
        final String id = Objects.requireNonNull(snapshotId, "snapshotId").trim();
        if (!SNAPSHOT_ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException(
                    "snapshot id may contain only letters, numbers, dot, underscore, and hyphen: " + snapshotId);
        }
        return directory.resolve(id + EXTENSION);
    }
}
