package fleet.session;

import fleet.FleetException;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.NoSuchWindowException;
import org.openqa.selenium.Point;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link SessionHandle} backed by a Selenium {@link WebDriver}.
 *
 * <p>Implicit waits are never set; every wait is an explicit
 * {@link WebDriverWait} so timeouts are deterministic and logged uniformly.
 * Driver errors that mean the browser or window is gone are translated to
 * {@link SessionUnreachableException}.
 */
public class SeleniumSessionHandle implements SessionHandle {

    private static final Logger log = LoggerFactory.getLogger(SeleniumSessionHandle.class);

    private final WebDriver driver;
    private final String label;
    private final Duration pageLoadTimeout;

    /**
     * @param driver          a configured, ready-to-use WebDriver session
     * @param label           name used in log lines, e.g. {@code "session-0"}
     * @param pageLoadTimeout how long {@link #navigate} waits for {@code document.readyState}
     */
    public SeleniumSessionHandle(WebDriver driver, String label, Duration pageLoadTimeout) {
        this.driver          = driver;
        this.label           = label;
        this.pageLoadTimeout = pageLoadTimeout;
    }

    @Override
    public void navigate(String url) {
        log.debug("[{}] Navigating to: {}", label, url);
        guard(() -> {
            driver.get(url);
            return null;
        });
        waitForPageLoad();
    }

    @Override
    public void click(String selector, LocatorKind by, Duration timeout) {
        WebElement element = waitForClickable(by.toBy(selector), timeout);
        log.debug("[{}] Clicking element: {}", label, selector);
        guard(() -> {
            element.click();
            return null;
        });
    }

    @Override
    public void fill(String selector, String text, LocatorKind by, Duration timeout) {
        WebElement element = waitForClickable(by.toBy(selector), timeout);
        log.debug("[{}] Filling element {} ({} chars)", label, selector, text.length());
        guard(() -> {
            element.clear();
            element.sendKeys(text);
            return null;
        });
    }

    @Override
    public Object runScript(String script, Object... args) {
        if (!(driver instanceof JavascriptExecutor js)) {
            throw new FleetException("[" + label + "] driver does not support JavaScript execution");
        }
        return guard(() -> js.executeScript(script, args));
    }

    @Override
    public void pointerClick(long x, long y) {
        log.debug("[{}] Pointer click at ({}, {})", label, x, y);
        guard(() -> {
            new Actions(driver).moveToLocation((int) x, (int) y).click().perform();
            return null;
        });
    }

    @Override
    public String currentLocation() {
        return guard(driver::getCurrentUrl);
    }

    @Override
    public Set<String> windowTokens() {
        return guard(driver::getWindowHandles);
    }

    @Override
    public String currentWindowToken() {
        return guard(driver::getWindowHandle);
    }

    @Override
    public void focus(String windowToken) {
        log.debug("[{}] Switching to window '{}'", label, windowToken);
        guard(() -> driver.switchTo().window(windowToken));
    }

    @Override
    public void position(int x, int y) {
        try {
            driver.manage().window().setPosition(new Point(x, y));
        } catch (Exception e) {
            // headless drivers reject window positioning
            log.debug("[{}] Could not position window: {}", label, e.getMessage());
        }
    }

    @Override
    public void close() {
        log.debug("[{}] Quitting driver", label);
        driver.quit();
    }

    @Override
    public String toString() {
        return "SeleniumSessionHandle{" + label + "}";
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private WebElement waitForClickable(By locator, Duration timeout) {
        log.debug("[{}] Waiting up to {}s for element CLICKABLE: {}", label, timeout.toSeconds(), locator);
        try {
            return new WebDriverWait(driver, timeout).until(ExpectedConditions.elementToBeClickable(locator));
        } catch (TimeoutException e) {
            throw new FleetException("[" + label + "] Timed out after " + timeout.toSeconds()
                    + "s waiting for element to be clickable: " + locator, e);
        } catch (NoSuchWindowException | NoSuchSessionException | UnreachableBrowserException e) {
            throw unreachable(e);
        }
    }

    private void waitForPageLoad() {
        try {
            new WebDriverWait(driver, pageLoadTimeout).until(d -> {
                Object state = ((JavascriptExecutor) d).executeScript("return document.readyState");
                return "complete".equals(state);
            });
        } catch (TimeoutException e) {
            throw new FleetException("[" + label + "] Timed out after " + pageLoadTimeout.toSeconds()
                    + "s waiting for page to finish loading", e);
        } catch (NoSuchWindowException | NoSuchSessionException | UnreachableBrowserException e) {
            throw unreachable(e);
        }
    }

    private <T> T guard(Supplier<T> call) {
        try {
            return call.get();
        } catch (NoSuchWindowException | NoSuchSessionException | UnreachableBrowserException e) {
            throw unreachable(e);
        }
    }

    private SessionUnreachableException unreachable(Exception e) {
        return new SessionUnreachableException("[" + label + "] session is no longer reachable: "
                + e.getMessage(), e);
    }
}
