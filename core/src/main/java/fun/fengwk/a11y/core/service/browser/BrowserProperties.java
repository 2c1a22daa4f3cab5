package fun.fengwk.a11y.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Shared browser process and per-session context configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "a11y.browser")
public class BrowserProperties {

    /**
     * Whether the shared browser runs headless.
     */
    private boolean headless = true;

    /**
     * Launch args for the shared browser process.
     */
    private List<String> launchArgs = List.of(
        "--no-sandbox",
        "--disable-setuid-sandbox",
        "--disable-dev-shm-usage",
        "--disable-extensions",
        "--disable-default-apps",
        "--disable-sync",
        "--disable-background-timer-throttling",
        "--disable-backgrounding-occluded-windows",
        "--disable-renderer-backgrounding",
        "--disable-background-networking",
        "--disable-component-update",
        "--disable-hang-monitor",
        "--no-first-run"
    );

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Default viewport width for new contexts.
     */
    private int viewportWidth = 1920;

    /**
     * Default viewport height for new contexts.
     */
    private int viewportHeight = 1080;

    /**
     * Default user agent for new contexts.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * Default locale for new contexts.
     */
    private String locale = "en-US";

    /**
     * Default timezone id for new contexts.
     */
    private String timezoneId = "America/New_York";

    /**
     * Extra headers for new contexts.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Default navigation timeout applied to newly created pages.
     */
    private long defaultNavigationTimeoutMs = 45000;

    /**
     * Default action timeout applied to newly created pages.
     */
    private long defaultTimeoutMs = 30000;

    /**
     * Load state awaited by {@code navigateToUrl}: load, domcontentloaded or networkidle.
     */
    private String navigationWaitUntil = "domcontentloaded";

    /**
     * Timeout for {@code navigateToUrl}.
     */
    private long navigationTimeoutMs = 30000;

    /**
     * Pause after navigation so late rendering can settle.
     */
    private long settleDelayMs = 1000;

}
