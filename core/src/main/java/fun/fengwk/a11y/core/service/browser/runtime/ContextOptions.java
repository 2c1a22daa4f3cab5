package fun.fengwk.a11y.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Per-session browser context profile. Unset fields fall back to {@code a11y.browser} defaults.
 *
 * @author fengwk
 */
@Data
@Builder
public class ContextOptions {

    private Integer viewportWidth;
    private Integer viewportHeight;
    private String userAgent;
    private String locale;
    private String timezoneId;
    private List<String> permissions;
    private Map<String, String> extraHttpHeaders;

    public static ContextOptions defaults() {
        return ContextOptions.builder().build();
    }

}
