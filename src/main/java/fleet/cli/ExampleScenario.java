package fleet.cli;

import fleet.orchestrator.Submission;
import fleet.session.LocatorKind;
import fleet.task.BrowserTask;
import fleet.task.StandardActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The scripted demo run by {@code fleet run}: a custom search in one session,
 * a navigate-and-click in the next, and a navigate/fill/submit/scroll sequence
 * in the third. With fewer sessions the groups wrap around; with more, the
 * extra sessions only open their start page.
 */
public final class ExampleScenario {

    private static final Logger log = LoggerFactory.getLogger(ExampleScenario.class);

    static final List<String> START_PAGES = List.of(
            "https://www.example.com",
            "https://www.wikipedia.org",
            "https://www.github.com");

    private ExampleScenario() { }

    /** Start page for each of {@code sessionCount} sessions, cycling through the demo sites. */
    public static List<String> startPages(int sessionCount) {
        List<String> pages = new ArrayList<>(sessionCount);
        for (int i = 0; i < sessionCount; i++) {
            pages.add(START_PAGES.get(i % START_PAGES.size()));
        }
        return pages;
    }

    /**
     * Builds the demo tasks for {@code sessionCount} sessions.
     *
     * @throws IllegalArgumentException if {@code sessionCount < 1}
     */
    public static List<Submission> tasks(int sessionCount) {
        if (sessionCount < 1) {
            throw new IllegalArgumentException("At least one session is required");
        }
        int search = 0;
        int wiki   = 1 % sessionCount;
        int github = 2 % sessionCount;

        List<Submission> out = new ArrayList<>();
        out.add(new Submission(searchTask("automation tutorial"), search));

        out.add(new Submission(StandardActions.navigate("navigation_task", "https://www.wikipedia.org"), wiki));
        out.add(new Submission(StandardActions.click("click_en_wiki", "a#js-link-box-en", 5), wiki));

        out.add(new Submission(StandardActions.navigate("github_navigate", "https://github.com"), github));
        out.add(new Submission(StandardActions.fill("github_search", "input[name='q']", "python automation"), github));
        out.add(new Submission(StandardActions.fill("github_submit", "input[name='q']", "\n"), github));
        out.add(new Submission(StandardActions.scroll("github_scroll", 500), github));
        return out;
    }

    /** A custom (non-replayable) task that runs a search on Google. */
    static BrowserTask searchTask(String term) {
        return new BrowserTask("search_task", "Search for '" + term + "' on Google", (session, args, kwargs) -> {
            session.navigate("https://www.google.com");
            try {
                session.click("button[id='L2AGLb']", LocatorKind.CSS, Duration.ofSeconds(2));
            } catch (RuntimeException e) {
                log.info("No cookie consent needed or already accepted");
            }
            Duration timeout = Duration.ofSeconds(StandardActions.DEFAULT_TIMEOUT_SEC);
            session.fill("textarea[name='q'], input[name='q']", term, LocatorKind.CSS, timeout);
            session.fill("textarea[name='q'], input[name='q']", "\n", LocatorKind.CSS, timeout);
            Thread.sleep(2000);
            log.info("Completed search for '{}'", term);
            return null;
        });
    }
}
