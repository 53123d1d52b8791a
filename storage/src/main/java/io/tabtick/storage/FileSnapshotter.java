package io.tabtick.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshots, one file per snapshot ("snapshot-&lt;millis&gt;.json").
 * <p>
 * Atomicity: the image is written to "&lt;name&gt;.tmp" and then moved into place
 * with ATOMIC_MOVE. Older snapshots are deleted once the new one is in place.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper mapper;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        this.mapper = RecordJson.mapper();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String writeSnapshot(StoreImage image) {
        List<Path> previous = snapshots();
        String name = PREFIX + String.format("%020d", System.currentTimeMillis()) + SUFFIX;
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try {
            mapper.writeValue(tmp.toFile(), image);
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : previous) {
                if (!old.equals(dst)) {
                    Files.deleteIfExists(old);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot write failed: " + dst, e);
        }
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) {
            return null;
        }
        Path latest = all.get(all.size() - 1);
        try {
            StoreImage image = mapper.readValue(latest.toFile(), StoreImage.class);
            return new LoadedSnapshot(latest.getFileName().toString(), image);
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot read failed: " + latest, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
