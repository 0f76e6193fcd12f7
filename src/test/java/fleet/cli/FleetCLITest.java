package fleet.cli;

import fleet.model.Recording;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line parsing and the commands that need no browser.
 */
public class FleetCLITest {

    private Path dir;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeMethod
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("fleet-cli");
        originalOut = System.out;
        originalErr = System.err;
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        System.setOut(originalOut);
        System.setErr(originalErr);
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    @Test(description = "list reports an empty directory")
    public void testListEmpty() {
        int exit = new CommandLine(new FleetCLI()).execute("list", "-d", dir.toString());

        assertThat(exit).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("No recordings found");
    }

    @Test(description = "list shows saved recordings and ignores other files")
    public void testListRecordings() throws Exception {
        Files.writeString(dir.resolve(Recording.fileNameFor("20260101_120000")), "{}");
        Files.writeString(dir.resolve("notes.txt"), "not a recording");

        int exit = new CommandLine(new FleetCLI()).execute("list", "-d", dir.toString());

        String printed = out.toString(StandardCharsets.UTF_8);
        assertThat(exit).isZero();
        assertThat(printed).contains("browser_session_20260101_120000.json").doesNotContain("notes.txt");
    }

    @Test(description = "replay of an unknown recording exits 1 without opening a browser")
    public void testReplayMissing() {
        int exit = new CommandLine(new FleetCLI()).execute("replay", "nope", "-d", dir.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("nope");
    }

    @Test(description = "pick requires --url")
    public void testPickRequiresUrl() {
        int exit = new CommandLine(new FleetCLI()).execute("pick");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--url");
    }

    @Test(description = "run options parse with their defaults")
    public void testRunDefaults() {
        FleetCLI.RunCommand run = new FleetCLI.RunCommand();
        new CommandLine(run).parseArgs("--headless");

        assertThat(run.browsers).isEqualTo(3);
        assertThat(run.browser).isEqualTo("chrome");
        assertThat(run.headless).isTrue();
        assertThat(run.noRecord).isFalse();
    }
}
