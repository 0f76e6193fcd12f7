package fleet.session;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts local browsers through Selenium. Selenium Manager (built into
 * Selenium 4.11+) downloads the matching driver binary, so no manual
 * chromedriver/geckodriver setup is needed.
 */
public class SeleniumSessionFactory implements SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SeleniumSessionFactory.class);

    private final int windowWidth;
    private final int windowHeight;
    private final Duration pageLoadTimeout;

    public SeleniumSessionFactory(int windowWidth, int windowHeight, Duration pageLoadTimeout) {
        this.windowWidth     = windowWidth;
        this.windowHeight    = windowHeight;
        this.pageLoadTimeout = pageLoadTimeout;
    }

    @Override
    public SessionHandle create(int index, BrowserKind kind, boolean headless) {
        log.info("Starting {} session {} (headless={})", kind, index, headless);
        try {
            WebDriver driver = createDriver(kind, headless);
            return new SeleniumSessionHandle(driver, "session-" + index, pageLoadTimeout);
        } catch (Exception e) {
            throw new SessionCreationException(index, "could not start " + kind + ": " + e.getMessage(), e);
        }
    }

    private WebDriver createDriver(BrowserKind kind, boolean headless) {
        String size = "--window-size=" + windowWidth + "," + windowHeight;
        return switch (kind) {
            case FIREFOX -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (headless) opts.addArguments("-headless");
                opts.addArguments("--width=" + windowWidth, "--height=" + windowHeight);
                yield new FirefoxDriver(opts);
            }
            case EDGE -> {
                EdgeOptions opts = new EdgeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--disable-extensions", "--disable-gpu", size);
                yield new EdgeDriver(opts);
            }
            default -> {
                ChromeOptions opts = new ChromeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--no-sandbox", "--disable-dev-shm-usage",
                        "--disable-extensions", "--disable-gpu", size);
                yield new ChromeDriver(opts);
            }
        };
    }
}
