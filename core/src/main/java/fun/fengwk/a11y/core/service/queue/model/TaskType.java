package fun.fengwk.a11y.core.service.queue.model;

import org.springframework.util.StringUtils;

/**
 * Execution strategy of an analysis task.
 *
 * @author fengwk
 */
public enum TaskType {

    /**
     * Analyze the task url alone.
     */
    SINGLE_PAGE("single-page"),

    /**
     * Analyze a fixed url list sequentially.
     */
    BATCH("batch"),

    /**
     * Crawl from the task url and analyze every discovered page.
     */
    FULL_SITE("full-site");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TaskType fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return SINGLE_PAGE;
        }
        for (TaskType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported task type: " + value);
    }

}
