package fleet.model;

import org.testng.annotations.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RecordingTest {

    @Test(description = "Run ids are yyyyMMdd_HHmmss in the local zone")
    public void testNewRunId() {
        Instant at = ZonedDateTime.of(2024, 3, 9, 7, 5, 1, 0, ZoneId.systemDefault()).toInstant();
        assertThat(Recording.newRunId(at)).isEqualTo("20240309_070501");
    }

    @Test(description = "File names follow browser_session_{runId}.json")
    public void testFileName() {
        assertThat(Recording.fileNameFor("20240309_070501")).isEqualTo("browser_session_20240309_070501.json");
    }

    @Test(description = "capture freezes live records so later captures do not leak in")
    public void testCaptureFreezesRecords() {
        SessionRecord live = new SessionRecord(0, null);
        Recording recording = Recording.capture("r", 1, List.of(live));

        assertThat(recording.getSessions().get(0).isFrozen()).isTrue();
        assertThat(live.isFrozen()).isFalse();
        assertThat(recording.getCreatedAt()).isNotNull();
    }

    @Test(description = "session lookup is by recorded index")
    public void testSessionLookup() {
        Recording recording = Recording.capture("r", 6,
                List.of(new SessionRecord(0, null), new SessionRecord(5, null)));

        assertThat(recording.session(5)).isPresent();
        assertThat(recording.session(3)).isEmpty();
    }
}
