package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized accessibility finding.
 *
 * @author fengwk
 */
@Data
@Builder
public class Violation {

    private String id;
    private ViolationImpact impact;
    private String description;
    private String help;
    private String helpUrl;
    private WcagLevel wcagLevel;
    private int occurrences;

    /**
     * Selectors of offending elements, capped by the rule script.
     */
    private List<String> selectors;

    /**
     * Engines that reported this finding.
     */
    private List<String> tools;

}
