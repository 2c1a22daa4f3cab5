package fun.fengwk.a11y.core.service.queue;

import fun.fengwk.a11y.core.service.queue.model.AnalysisTask;
import fun.fengwk.a11y.core.service.queue.model.TaskResult;

/**
 * Receives the outcome of every attempt a worker runs.
 *
 * @author fengwk
 */
public interface WorkerListener {

    void onTaskCompleted(AnalysisWorker worker, AnalysisTask task, TaskResult result);

    void onTaskFailed(AnalysisWorker worker, AnalysisTask task, TaskResult result);

}
