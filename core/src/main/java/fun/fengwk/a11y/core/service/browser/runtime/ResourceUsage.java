package fun.fengwk.a11y.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Live resource counts of the browser resource manager.
 *
 * @author fengwk
 */
@Data
@Builder
public class ResourceUsage {

    private int contexts;
    private int pages;
    private boolean initialized;

}
