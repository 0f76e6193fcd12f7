package fleet.model;

import fleet.session.SessionHandle;
import fleet.task.BrowserTask;
import fleet.task.StandardActions;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Serialization tests for {@link RecordingIO}: save/load round trips, the
 * file format's field names, and rejection of malformed documents.
 */
public class RecordingIOTest {

    private Path dir;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("fleet-recording-io-");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    // ── Round-trip ────────────────────────────────────────────────────────

    @Test
    public void roundTrip_preservesSessionsAndTasks() throws IOException {
        Recording original = buildRecording();
        Path file = dir.resolve(original.getFileName());

        RecordingIO.write(original, file);
        Recording loaded = RecordingIO.read(file);

        assertThat(loaded.getRunId()).isEqualTo("20240101_120000");
        assertThat(loaded.getSessionCount()).isEqualTo(2);
        assertThat(loaded.getSessions()).hasSize(2);
        assertThat(loaded.getTaskCount()).isEqualTo(3);

        SessionRecord second = loaded.session(1).orElseThrow();
        assertThat(second.getInitialLocation()).isEqualTo("https://www.wikipedia.org");
        assertThat(second.isFrozen()).isTrue();
        TaskSnapshot click = second.getTasks().get(1);
        assertThat(click.getName()).isEqualTo("click_en_wiki");
        assertThat(click.getActionKind()).isEqualTo("click");
        assertThat(click.getArgs()).containsExactly("a#js-link-box-en");
        assertThat(click.getKwargs()).containsEntry("timeout", 5);
        assertThat(click.getSessionIndex()).isEqualTo(1);
    }

    @Test
    public void toJson_usesSnakeCaseFieldsAndIsoTimestamps() throws IOException {
        String json = RecordingIO.toJson(buildRecording());

        assertThat(json).contains("\"run_id\"", "\"session_count\"", "\"sessions\"",
                "\"session_index\"", "\"initial_location\"", "\"action_kind\"",
                "\"execution_time_seconds\"", "\"kwargs\"");
        assertThat(json).contains("\"created_at\" : \"2024-01-01T12:00:00Z\"");
        assertThat(json).doesNotContain("frozen", "taskCount", "fileName");
    }

    @Test
    public void write_createsParentDirectories() throws IOException {
        Path nested = dir.resolve("a/b/recording.json");
        RecordingIO.write(buildRecording(), nested);
        assertThat(nested).exists();
    }

    @Test
    public void parse_acceptsUnknownActionKind() {
        String json = """
                {
                  "run_id": "r1",
                  "session_count": 1,
                  "sessions": [
                    { "session_index": 0, "initial_location": "about:blank",
                      "tasks": [ { "name": "t", "action_kind": "hover", "args": [], "kwargs": {} } ] }
                  ]
                }
                """;

        Recording r = RecordingIO.parse(json, "inline");

        TaskSnapshot t = r.getSessions().get(0).getTasks().get(0);
        assertThat(t.getActionKind()).isEqualTo("hover");
        assertThat(t.kind()).isEmpty();
    }

    // ── Error cases ───────────────────────────────────────────────────────

    @Test
    public void read_missingFile_throwsRecordingNotFound() {
        assertThatThrownBy(() -> RecordingIO.read(dir.resolve("nope.json")))
                .isInstanceOf(RecordingNotFoundException.class);
    }

    @Test
    public void parse_invalidJson_throwsMalformed() {
        assertThatThrownBy(() -> RecordingIO.parse("{ not json", "broken.json"))
                .isInstanceOf(RecordingIO.MalformedRecordingException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    public void parse_missingRequiredField_throwsMalformed() {
        String json = """
                { "run_id": "r1", "sessions": [] }
                """;
        assertThatThrownBy(() -> RecordingIO.parse(json, "no-count.json"))
                .isInstanceOf(RecordingIO.MalformedRecordingException.class);
    }

    @Test
    public void parse_taskWithoutArgs_throwsMalformed() {
        String json = """
                { "run_id": "r1", "session_count": 1,
                  "sessions": [ { "session_index": 0,
                                  "tasks": [ { "name": "t", "action_kind": "click", "kwargs": {} } ] } ] }
                """;
        assertThatThrownBy(() -> RecordingIO.parse(json, "no-args.json"))
                .isInstanceOf(RecordingIO.MalformedRecordingException.class);
    }

    @Test
    public void parse_arrayRoot_throwsMalformed() {
        assertThatThrownBy(() -> RecordingIO.parse("[]", "array.json"))
                .isInstanceOf(RecordingIO.MalformedRecordingException.class);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static Recording buildRecording() {
        SessionHandle handle = mock(SessionHandle.class);
        SessionRecord first = new SessionRecord(0, "https://www.example.com");
        SessionRecord second = new SessionRecord(1, "https://www.wikipedia.org");

        first.capture(run(StandardActions.scroll("scroll_down", 500), handle));
        second.capture(run(StandardActions.navigate("navigation_task", "https://www.wikipedia.org"), handle));
        second.capture(run(StandardActions.click("click_en_wiki", "a#js-link-box-en", 5), handle));

        return new Recording("20240101_120000", Instant.parse("2024-01-01T12:00:00Z"), 2,
                List.of(first, second));
    }

    private static BrowserTask run(BrowserTask task, SessionHandle handle) {
        task.execute(handle);
        return task;
    }
}
