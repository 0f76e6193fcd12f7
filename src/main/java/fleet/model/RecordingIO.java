package fleet.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import fleet.FleetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link Recording} objects to/from JSON files.
 *
 * <p>On read: validates the JSON against {@code recording-schema.json} before
 * binding, so a malformed file is rejected before anything acts on it.
 *
 * <p>On write: pretty-prints for human readability.
 */
public class RecordingIO {

    private static final Logger log = LoggerFactory.getLogger(RecordingIO.class);
    private static final String SCHEMA_RESOURCE = "/recording-schema.json";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private RecordingIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a {@link Recording} from a JSON file.
     *
     * @param path path to the recording file
     * @return the parsed recording; nothing is executed
     * @throws RecordingNotFoundException   if the file does not exist
     * @throws MalformedRecordingException  if the content is not a valid recording
     * @throws IOException                  if the file exists but cannot be read
     */
    public static Recording read(Path path) throws IOException {
        log.debug("Reading recording from: {}", path);
        String json;
        try {
            json = Files.readString(path);
        } catch (NoSuchFileException e) {
            throw new RecordingNotFoundException("Recording file not found: " + path.toAbsolutePath());
        }
        Recording recording = parse(json, path.toString());
        log.info("Loaded recording '{}' with {} session(s) and {} task(s) from {}",
                recording.getRunId(), recording.getSessionCount(), recording.getTaskCount(), path);
        return recording;
    }

    /**
     * Writes a {@link Recording} to a JSON file (pretty-printed).
     *
     * @param recording the recording to serialize
     * @param path      the destination file path (parent directories are created)
     * @throws IOException if the file cannot be written
     */
    public static void write(Recording recording, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), recording);
        log.info("Wrote recording '{}' ({} task(s)) to {}", recording.getRunId(),
                recording.getTaskCount(), path);
    }

    /** Serializes a {@link Recording} to a JSON string. */
    public static String toJson(Recording recording) throws IOException {
        return MAPPER.writeValueAsString(recording);
    }

    /**
     * Parses and validates a {@link Recording} from a JSON string.
     *
     * @param json   the document
     * @param source name used in error messages
     * @throws MalformedRecordingException if the document is not a valid recording
     */
    public static Recording parse(String json, String source) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordingException("Not valid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedRecordingException("Recording " + source + " is not a JSON object");
        }
        validateSchema(tree, source);
        try {
            return MAPPER.treeToValue(tree, Recording.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedRecordingException("Cannot bind recording " + source + ": " + e.getMessage(), e);
        }
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode tree, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("recording-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new MalformedRecordingException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (RecordingIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = RecordingIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    /** The document is not JSON, violates the schema, or cannot be bound. */
    public static class MalformedRecordingException extends FleetException {
        public MalformedRecordingException(String msg) { super(msg); }
        public MalformedRecordingException(String msg, Throwable cause) { super(msg, cause); }
    }
}
