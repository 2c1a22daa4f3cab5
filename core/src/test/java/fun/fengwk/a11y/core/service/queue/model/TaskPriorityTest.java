package fun.fengwk.a11y.core.service.queue.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class TaskPriorityTest {

    @Test
    public void shouldOrderByWeight() {
        assertThat(TaskPriority.HIGH.getWeight()).isGreaterThan(TaskPriority.MEDIUM.getWeight());
        assertThat(TaskPriority.MEDIUM.getWeight()).isGreaterThan(TaskPriority.LOW.getWeight());
    }

    @Test
    public void shouldResolveFromValue() {
        assertThat(TaskPriority.fromValue("high")).isEqualTo(TaskPriority.HIGH);
        assertThat(TaskPriority.fromValue("Low")).isEqualTo(TaskPriority.LOW);
        assertThat(TaskPriority.fromValue(" ")).isEqualTo(TaskPriority.MEDIUM);
        assertThatThrownBy(() -> TaskPriority.fromValue("urgent")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldDefaultTaskToMediumPriority() {
        AnalysisTask task = AnalysisTask.builder().type(TaskType.SINGLE_PAGE).url("https://example.com").build();

        assertThat(task.getPriority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(task.getRetryCount()).isZero();
        assertThat(task.getId()).isNotBlank();
    }

}
