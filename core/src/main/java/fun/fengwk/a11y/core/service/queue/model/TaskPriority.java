package fun.fengwk.a11y.core.service.queue.model;

import org.springframework.util.StringUtils;

/**
 * Dispatch priority, higher weight runs first.
 *
 * @author fengwk
 */
public enum TaskPriority {

    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String value;
    private final int weight;

    TaskPriority(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    public static TaskPriority fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return MEDIUM;
        }
        for (TaskPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("unsupported task priority: " + value);
    }

}
