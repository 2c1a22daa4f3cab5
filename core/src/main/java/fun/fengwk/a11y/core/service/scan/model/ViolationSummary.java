package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Violation counts per impact.
 *
 * @author fengwk
 */
@Data
@Builder
public class ViolationSummary {

    private int totalViolations;
    private int criticalViolations;
    private int seriousViolations;
    private int moderateViolations;
    private int minorViolations;

    public static ViolationSummary of(List<Violation> violations) {
        int critical = 0;
        int serious = 0;
        int moderate = 0;
        int minor = 0;
        for (Violation violation : violations) {
            if (violation.getImpact() == null) {
                continue;
            }
            switch (violation.getImpact()) {
                case CRITICAL:
                    critical++;
                    break;
                case SERIOUS:
                    serious++;
                    break;
                case MODERATE:
                    moderate++;
                    break;
                case MINOR:
                    minor++;
                    break;
                default:
                    break;
            }
        }
        return ViolationSummary.builder()
            .totalViolations(violations.size())
            .criticalViolations(critical)
            .seriousViolations(serious)
            .moderateViolations(moderate)
            .minorViolations(minor)
            .build();
    }

}
