package fun.fengwk.a11y.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Playwright;

/**
 * Playwright driver plus the browser process it launched.
 *
 * @author fengwk
 */
public class BrowserSession implements AutoCloseable {

    private final Playwright playwright;
    private final Browser browser;

    public BrowserSession(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    public Browser browser() {
        return browser;
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }

}
