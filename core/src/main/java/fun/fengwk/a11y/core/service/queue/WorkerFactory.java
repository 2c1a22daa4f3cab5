package fun.fengwk.a11y.core.service.queue;

import java.util.concurrent.Executor;

/**
 * Creates pool workers bound to the queue listener and executor.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface WorkerFactory {

    AnalysisWorker create(String workerId, Executor executor, WorkerListener listener);

}
