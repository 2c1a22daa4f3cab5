package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

/**
 * A page whose analysis failed for good.
 *
 * @author fengwk
 */
@Data
@Builder
public class PageFailure {

    private PageInfo page;
    private String error;

}
