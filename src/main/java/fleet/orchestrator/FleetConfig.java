package fleet.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed fleet
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS). CLI flags
 * override both through the setters.
 */
public class FleetConfig {

    private static final Logger log = LoggerFactory.getLogger(FleetConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_RECORDING_ENABLED   = "fleet.recording.enabled";
    static final String KEY_RECORDING_DIR       = "fleet.recording.dir";
    static final String KEY_MAX_WORKERS         = "fleet.scheduler.max.workers";
    static final String KEY_ERROR_POLICY        = "fleet.scheduler.error.policy";
    static final String KEY_TILE_OFFSET         = "fleet.session.tile.offset.px";
    static final String KEY_WINDOW_WIDTH        = "fleet.session.window.width";
    static final String KEY_WINDOW_HEIGHT       = "fleet.session.window.height";
    static final String KEY_PAGE_LOAD_TIMEOUT   = "fleet.session.page.load.timeout.sec";
    static final String KEY_POLL_INTERVAL       = "fleet.bridge.poll.interval.ms";
    static final String KEY_POLL_MAX_ATTEMPTS   = "fleet.bridge.poll.max.attempts";
    static final String KEY_CLICK_INTERVAL      = "fleet.clicker.interval.ms";
    static final String KEY_CLICK_MAX_ERRORS    = "fleet.clicker.max.errors";
    static final String KEY_CLOSE_GRACE         = "fleet.close.grace.ms";

    // Defaults
    private static final boolean DEFAULT_RECORDING_ENABLED = true;
    private static final String  DEFAULT_RECORDING_DIR     = "browser_recordings";
    private static final int     DEFAULT_MAX_WORKERS       = 8;
    private static final int     DEFAULT_TILE_OFFSET       = 50;
    private static final int     DEFAULT_WINDOW_WIDTH      = 1920;
    private static final int     DEFAULT_WINDOW_HEIGHT     = 1080;
    private static final int     DEFAULT_PAGE_LOAD_TIMEOUT = 30;
    private static final long    DEFAULT_POLL_INTERVAL     = 100L;
    private static final int     DEFAULT_POLL_MAX_ATTEMPTS = 100;
    private static final long    DEFAULT_CLICK_INTERVAL    = 1000L;
    private static final int     DEFAULT_CLICK_MAX_ERRORS  = 5;
    private static final long    DEFAULT_CLOSE_GRACE       = 2000L;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public FleetConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests: accepts an already-populated
     * {@link Properties} instance.
     */
    FleetConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Whether {@code executeAll()} saves a recording when it finishes (default: true). */
    public boolean isRecordingEnabled() {
        return getBool(KEY_RECORDING_ENABLED, DEFAULT_RECORDING_ENABLED);
    }

    /** Directory recordings are written to and looked up in (default: "browser_recordings"). */
    public Path getRecordingDir() {
        return Path.of(props.getProperty(KEY_RECORDING_DIR, DEFAULT_RECORDING_DIR).trim());
    }

    /** Upper bound on concurrently running session workers (default: 8). */
    public int getMaxWorkers() {
        return Math.max(1, getInt(KEY_MAX_WORKERS, DEFAULT_MAX_WORKERS));
    }

    /** What a worker does with the rest of its chain after a task fails (default: CONTINUE). */
    public ErrorPolicy getErrorPolicy() {
        String raw = props.getProperty(KEY_ERROR_POLICY);
        if (raw == null || raw.isBlank()) return ErrorPolicy.CONTINUE;
        try {
            return ErrorPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid error policy '{}', using CONTINUE", raw);
            return ErrorPolicy.CONTINUE;
        }
    }

    /** Cascade offset between consecutive session windows in pixels (default: 50). */
    public int getTileOffsetPx() {
        return getInt(KEY_TILE_OFFSET, DEFAULT_TILE_OFFSET);
    }

    public int getWindowWidth() {
        return getInt(KEY_WINDOW_WIDTH, DEFAULT_WINDOW_WIDTH);
    }

    public int getWindowHeight() {
        return getInt(KEY_WINDOW_HEIGHT, DEFAULT_WINDOW_HEIGHT);
    }

    /** Page-load wait used by navigation (default: 30s). */
    public Duration getPageLoadTimeout() {
        return Duration.ofSeconds(getInt(KEY_PAGE_LOAD_TIMEOUT, DEFAULT_PAGE_LOAD_TIMEOUT));
    }

    /** Period between coordinate-bridge polls (default: 100ms). */
    public Duration getPollInterval() {
        return Duration.ofMillis(getLong(KEY_POLL_INTERVAL, DEFAULT_POLL_INTERVAL));
    }

    /** Number of coordinate-bridge polls before an armed session gives up (default: 100). */
    public int getPollMaxAttempts() {
        return getInt(KEY_POLL_MAX_ATTEMPTS, DEFAULT_POLL_MAX_ATTEMPTS);
    }

    /** Default tick interval of the periodic clicker (default: 1000ms). */
    public Duration getClickInterval() {
        return Duration.ofMillis(getLong(KEY_CLICK_INTERVAL, DEFAULT_CLICK_INTERVAL));
    }

    /** Click errors after which the periodic clicker stops itself (default: 5). */
    public int getClickMaxErrors() {
        return getInt(KEY_CLICK_MAX_ERRORS, DEFAULT_CLICK_MAX_ERRORS);
    }

    /** How long {@code closeAll()} waits for loops to observe their stop flag (default: 2000ms). */
    public Duration getCloseGrace() {
        return Duration.ofMillis(getLong(KEY_CLOSE_GRACE, DEFAULT_CLOSE_GRACE));
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    public void setRecordingEnabled(boolean enabled) {
        props.setProperty(KEY_RECORDING_ENABLED, String.valueOf(enabled));
    }

    public void setRecordingDir(String dir) {
        props.setProperty(KEY_RECORDING_DIR, dir);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
