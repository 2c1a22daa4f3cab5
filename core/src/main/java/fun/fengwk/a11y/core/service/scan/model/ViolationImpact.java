package fun.fengwk.a11y.core.service.scan.model;

import org.springframework.util.StringUtils;

/**
 * Severity of an accessibility violation.
 *
 * @author fengwk
 */
public enum ViolationImpact {

    MINOR("minor"),
    MODERATE("moderate"),
    SERIOUS("serious"),
    CRITICAL("critical");

    private final String value;

    ViolationImpact(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve impact, unknown or blank values degrade to {@link #MODERATE}.
     */
    public static ViolationImpact fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return MODERATE;
        }
        for (ViolationImpact impact : values()) {
            if (impact.value.equalsIgnoreCase(value.trim())) {
                return impact;
            }
        }
        return MODERATE;
    }

}
