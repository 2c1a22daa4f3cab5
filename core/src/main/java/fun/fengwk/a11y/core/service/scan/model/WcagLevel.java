package fun.fengwk.a11y.core.service.scan.model;

import org.springframework.util.StringUtils;

/**
 * WCAG conformance level a rule maps to.
 *
 * @author fengwk
 */
public enum WcagLevel {

    A,
    AA,
    AAA,
    UNKNOWN;

    public static WcagLevel fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return UNKNOWN;
        }
        for (WcagLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return UNKNOWN;
    }

}
