package fleet.cli;

import fleet.orchestrator.Submission;
import fleet.task.ActionKind;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExampleScenarioTest {

    @Test(description = "Start pages cycle through the demo sites")
    public void testStartPagesCycle() {
        List<String> pages = ExampleScenario.startPages(5);

        assertThat(pages).hasSize(5);
        assertThat(pages.get(0)).isEqualTo(pages.get(3));
        assertThat(pages.get(1)).isEqualTo(pages.get(4));
        assertThat(pages.subList(0, 3)).containsExactlyElementsOf(ExampleScenario.START_PAGES);
    }

    @Test(description = "Three sessions each get their own task group")
    public void testThreeSessions() {
        List<Submission> tasks = ExampleScenario.tasks(3);

        assertThat(tasks).extracting(s -> s.task().getName())
                .containsExactly("search_task", "navigation_task", "click_en_wiki",
                        "github_navigate", "github_search", "github_submit", "github_scroll");
        assertThat(tasks).extracting(Submission::sessionIndex)
                .containsExactly(0, 1, 1, 2, 2, 2, 2);
        assertThat(tasks.get(0).task().getActionKind()).isEqualTo(ActionKind.CUSTOM);
        assertThat(tasks.get(6).task().getActionKind()).isEqualTo(ActionKind.SCROLL);
    }

    @Test(description = "With one session every group runs in session 0")
    public void testSingleSession() {
        assertThat(ExampleScenario.tasks(1)).extracting(Submission::sessionIndex).containsOnly(0);
    }

    @Test(description = "Two sessions wrap the third group onto session 0")
    public void testTwoSessionsWrap() {
        assertThat(ExampleScenario.tasks(2)).extracting(Submission::sessionIndex)
                .containsExactly(0, 1, 1, 0, 0, 0, 0);
    }

    @Test(description = "Zero sessions is rejected")
    public void testZeroSessions() {
        assertThatThrownBy(() -> ExampleScenario.tasks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
