package fleet.replay;

import fleet.model.Recording;
import fleet.model.RecordingNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds recording files by path, file name or run id, and lists the
 * recordings kept in one directory.
 */
public class RecordingLocator {

    private static final Logger log = LoggerFactory.getLogger(RecordingLocator.class);

    /** A recording file in the directory listing. */
    public record Entry(String fileName, Path path, long sizeBytes, Instant modified) {

        public double sizeKb() {
            return sizeBytes / 1024.0;
        }
    }

    private final Path directory;

    public RecordingLocator(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() { return directory; }

    /**
     * Resolves {@code ref} to an existing recording file. Tried in order:
     * <ol>
     *   <li>{@code ref} as a path</li>
     *   <li>{@code ref} inside the recordings directory</li>
     *   <li>{@code ref + ".json"} inside the recordings directory</li>
     *   <li>{@code browser_session_{ref}.json} inside the recordings directory</li>
     * </ol>
     *
     * @throws RecordingNotFoundException if none of the candidates exists
     */
    public Path resolve(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Recording reference must not be blank");
        }
        String trimmed = ref.trim();
        List<Path> candidates = List.of(
                Path.of(trimmed),
                directory.resolve(trimmed),
                directory.resolve(trimmed + Recording.FILE_EXTENSION),
                directory.resolve(Recording.fileNameFor(trimmed)));

        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Resolved recording '{}' to {}", ref, candidate);
                return candidate;
            }
        }
        throw new RecordingNotFoundException("No recording found for '" + ref + "' (looked in " + directory + ")");
    }

    /**
     * Lists {@code browser_session_*.json} files in the directory, newest first.
     * A missing directory yields an empty list.
     */
    public List<Entry> list() throws IOException {
        List<Entry> entries = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            log.info("Recordings directory {} does not exist", directory);
            return entries;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory,
                Recording.FILE_PREFIX + "*" + Recording.FILE_EXTENSION)) {
            for (Path p : stream) {
                BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                entries.add(new Entry(p.getFileName().toString(), p, attrs.size(),
                        attrs.lastModifiedTime().toInstant()));
            }
        }
        entries.sort(Comparator.comparing(Entry::modified).reversed()
                .thenComparing(Entry::fileName, Comparator.reverseOrder()));
        return entries;
    }
}
