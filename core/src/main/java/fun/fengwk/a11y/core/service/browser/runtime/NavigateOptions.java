package fun.fengwk.a11y.core.service.browser.runtime;

import com.microsoft.playwright.options.WaitUntilState;
import lombok.Builder;
import lombok.Data;

/**
 * Options for {@link BrowserResourceManager#navigateToUrl}. Unset fields fall back to {@code a11y.browser} defaults.
 *
 * @author fengwk
 */
@Data
@Builder
public class NavigateOptions {

    private WaitUntilState waitUntil;
    private Long timeoutMs;
    private String pageId;

    /**
     * Pause after navigation, 0 disables it.
     */
    private Long settleDelayMs;

    public static NavigateOptions defaults() {
        return NavigateOptions.builder().build();
    }

}
