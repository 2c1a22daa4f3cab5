package fun.fengwk.a11y.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import fun.fengwk.a11y.core.service.browser.BrowserProperties;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;

/**
 * Launches the shared browser process.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserLauncher {

    BrowserSession launch();

    static BrowserLauncher chromium(BrowserProperties browserProperties) {
        return () -> {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(browserProperties.isHeadless());
            if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
                options.setArgs(browserProperties.getLaunchArgs());
            }
            if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
                options.setChannel(browserProperties.getBrowserChannel());
            }
            if (StringUtils.hasText(browserProperties.getExecutablePath())) {
                options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
            }

            Playwright playwright = Playwright.create();
            try {
                Browser browser = playwright.chromium().launch(options);
                return new BrowserSession(playwright, browser);
            } catch (RuntimeException ex) {
                // Launch failure must not leak the driver process.
                playwright.close();
                throw ex;
            }
        };
    }

}
