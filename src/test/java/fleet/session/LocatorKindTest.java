package fleet.session;

import org.openqa.selenium.By;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LocatorKindTest {

    @Test(description = "Each locator kind maps to the matching Selenium By")
    public void testToBy() {
        assertThat(LocatorKind.CSS.toBy("#a")).isEqualTo(By.cssSelector("#a"));
        assertThat(LocatorKind.XPATH.toBy("//a")).isEqualTo(By.xpath("//a"));
        assertThat(LocatorKind.ID.toBy("a")).isEqualTo(By.id("a"));
        assertThat(LocatorKind.NAME.toBy("q")).isEqualTo(By.name("q"));
    }

    @Test(description = "Browser kinds parse case-insensitively and default to chrome")
    public void testBrowserKindParse() {
        assertThat(BrowserKind.parse("firefox")).isEqualTo(BrowserKind.FIREFOX);
        assertThat(BrowserKind.parse(" Edge ")).isEqualTo(BrowserKind.EDGE);
        assertThat(BrowserKind.parse("safari")).isEqualTo(BrowserKind.CHROME);
        assertThat(BrowserKind.parse(null)).isEqualTo(BrowserKind.CHROME);
    }
}
