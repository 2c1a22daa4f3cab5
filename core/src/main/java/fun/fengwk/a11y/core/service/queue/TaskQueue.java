package fun.fengwk.a11y.core.service.queue;

import fun.fengwk.a11y.core.service.queue.model.AnalysisTask;
import fun.fengwk.a11y.core.service.queue.model.QueueStatus;
import fun.fengwk.a11y.core.service.queue.model.TaskPriority;
import fun.fengwk.a11y.core.service.queue.model.TaskResult;
import fun.fengwk.a11y.core.service.queue.model.WorkerHealth;
import fun.fengwk.a11y.core.service.queue.model.WorkerStatus;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Priority task queue backed by a resizable pool of {@link AnalysisWorker}s.
 *
 * <p>Each task moves {@code pending -> processing -> completed | failed}, failed attempts going back to the
 * front of {@code pending} while retries remain. A fixed-delay poller hands the head of {@code pending} to
 * available workers. All bookkeeping happens under one lock; listener callbacks run outside it.
 *
 * <p>Lifecycle is explicit: construct, {@link #start()}, {@link #shutdown()}.
 *
 * @author fengwk
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final TaskQueueProperties properties;
    private final WorkerFactory workerFactory;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedList<AnalysisTask> pending = new LinkedList<>();
    private final Map<String, AnalysisTask> processing = new LinkedHashMap<>();
    private final List<AnalysisTask> completed = new ArrayList<>();
    private final List<AnalysisTask> failed = new ArrayList<>();
    private final Map<String, CompletableFuture<TaskResult>> results = new HashMap<>();
    private final Map<String, Instant> retryNotBefore = new HashMap<>();
    private final Map<String, AnalysisWorker> workers = new LinkedHashMap<>();
    private final List<TaskQueueListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicInteger workerIdGen = new AtomicInteger(1);
    private final AtomicInteger threadIdGen = new AtomicInteger(1);
    private final ExecutorService workerExecutor;
    private final WorkerListener workerListener = new QueueWorkerListener();

    private ScheduledExecutorService scheduler;
    private volatile boolean started = false;
    private volatile boolean shuttingDown = false;

    public TaskQueue(TaskQueueProperties properties, WorkerFactory workerFactory) {
        this(properties, workerFactory, Clock.systemUTC());
    }

    TaskQueue(TaskQueueProperties properties, WorkerFactory workerFactory, Clock clock) {
        validateWorkerCount(properties.getMaxConcurrentTasks());
        this.properties = properties;
        this.workerFactory = workerFactory;
        this.clock = clock;
        this.workerExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("a11y-task-worker-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < properties.getMaxConcurrentTasks(); i++) {
            AnalysisWorker worker = createWorker();
            workers.put(worker.getId(), worker);
        }
    }

    /**
     * Start the dispatch poller. Tasks added before start wait in {@code pending}.
     */
    public void start() {
        lock.lock();
        try {
            if (shuttingDown) {
                throw new IllegalStateException("task queue is shut down");
            }
            if (started) {
                return;
            }
            started = true;
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("a11y-task-queue-poller");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(
                this::processQueueSafely, 0, Math.max(1, properties.getPollIntervalMs()), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        log.info("task queue started, workers={}, pollIntervalMs={}", workers.size(), properties.getPollIntervalMs());
    }

    public void addListener(TaskQueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TaskQueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Enqueue a task by priority, then FIFO among equal priorities.
     *
     * @return task id
     */
    public String addTask(AnalysisTask task) {
        if (shuttingDown) {
            throw new IllegalStateException("task queue is shut down");
        }
        AnalysisTask queued = normalizeTask(task);

        lock.lock();
        try {
            if (shuttingDown) {
                throw new IllegalStateException("task queue is shut down");
            }
            if (results.containsKey(queued.getId())) {
                throw new IllegalArgumentException("duplicate task id: " + queued.getId());
            }
            results.put(queued.getId(), new CompletableFuture<>());
            insertByPriority(queued);
        } finally {
            lock.unlock();
        }

        log.debug("task added, taskId={}, type={}, priority={}, url={}",
            queued.getId(), queued.getType(), queued.getPriority(), queued.getUrl());
        AnalysisTask snapshot = snapshot(queued);
        fire(listener -> listener.onTaskAdded(snapshot));
        return queued.getId();
    }

    public List<String> addBatch(List<AnalysisTask> tasks) {
        List<String> taskIds = new ArrayList<>(tasks.size());
        for (AnalysisTask task : tasks) {
            taskIds.add(addTask(task));
        }
        return taskIds;
    }

    /**
     * Move a pending or processing task to {@code failed}. An in-flight attempt keeps running and its report
     * is ignored.
     *
     * @return false when the task is unknown or already terminal
     */
    public boolean cancelTask(String taskId) {
        AnalysisTask cancelled;
        TaskResult result;
        CompletableFuture<TaskResult> future;
        lock.lock();
        try {
            cancelled = removePending(taskId);
            if (cancelled == null) {
                cancelled = processing.remove(taskId);
            }
            if (cancelled == null) {
                return false;
            }
            retryNotBefore.remove(taskId);
            Instant now = clock.instant();
            cancelled.setCompletedAt(now);
            cancelled.setLastError("task cancelled");
            failed.add(cancelled);
            result = TaskResult.builder()
                .taskId(taskId)
                .success(false)
                .error(new CancellationException("task cancelled"))
                .duration(cancelled.getStartedAt() == null ? 0 : Duration.between(cancelled.getStartedAt(), now).toMillis())
                .build();
            future = results.get(taskId);
        } finally {
            lock.unlock();
        }

        log.info("task cancelled, taskId={}", taskId);
        future.complete(result);
        AnalysisTask snapshot = snapshot(cancelled);
        fire(listener -> listener.onTaskFailed(snapshot, result));
        return true;
    }

    public QueueStatus getQueueStatus() {
        lock.lock();
        try {
            return QueueStatus.builder()
                .pending(snapshots(pending))
                .processing(snapshots(processing.values()))
                .completed(snapshots(completed))
                .failed(snapshots(failed))
                .build();
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerStatus> getWorkerStatus() {
        lock.lock();
        try {
            List<WorkerStatus> statuses = new ArrayList<>(workers.size());
            for (AnalysisWorker worker : workers.values()) {
                AnalysisTask task = worker.getCurrentTask();
                statuses.add(WorkerStatus.builder()
                    .workerId(worker.getId())
                    .available(worker.isAvailable())
                    .retiring(worker.isRetiring())
                    .currentTaskId(task == null ? null : task.getId())
                    .lastActivity(worker.getLastActivity())
                    .metrics(worker.getMetrics())
                    .build());
            }
            return statuses;
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerHealth> getWorkerHealth() {
        lock.lock();
        try {
            List<WorkerHealth> health = new ArrayList<>(workers.size());
            for (AnalysisWorker worker : workers.values()) {
                health.add(worker.getHealth());
            }
            return health;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal result of a task, empty while it is pending, processing or unknown.
     */
    public Optional<TaskResult> getTaskResult(String taskId) {
        CompletableFuture<TaskResult> future = futureOf(taskId);
        if (future == null || !future.isDone()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.getNow(null));
    }

    /**
     * Future completed with the terminal result of a task.
     */
    public CompletableFuture<TaskResult> resultOf(String taskId) {
        CompletableFuture<TaskResult> future = futureOf(taskId);
        if (future == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        return future.copy();
    }

    /**
     * Block until the task is terminal.
     *
     * @throws TaskTimeoutException if the task is not terminal within {@code timeout}
     */
    public TaskResult waitForCompletion(String taskId, Duration timeout) {
        CompletableFuture<TaskResult> future = futureOf(taskId);
        if (future == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new TaskTimeoutException("task " + taskId + " timed out after " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TaskTimeoutException("interrupted while waiting for task " + taskId, ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("task " + taskId + " result failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Resize the pool. Surplus idle workers are removed at once, busy ones after their running task.
     */
    public void scaleWorkers(int targetCount) {
        validateWorkerCount(targetCount);
        List<AnalysisWorker> removed = new ArrayList<>();
        lock.lock();
        try {
            if (shuttingDown) {
                throw new IllegalStateException("task queue is shut down");
            }
            List<AnalysisWorker> active = new ArrayList<>();
            for (AnalysisWorker worker : workers.values()) {
                if (!worker.isRetiring()) {
                    active.add(worker);
                }
            }

            if (targetCount > active.size()) {
                for (int i = active.size(); i < targetCount; i++) {
                    AnalysisWorker worker = createWorker();
                    workers.put(worker.getId(), worker);
                }
            } else if (targetCount < active.size()) {
                int surplus = active.size() - targetCount;
                for (AnalysisWorker worker : active) {
                    if (surplus == 0) {
                        break;
                    }
                    if (worker.isAvailable()) {
                        workers.remove(worker.getId());
                        removed.add(worker);
                        surplus--;
                    }
                }
                for (AnalysisWorker worker : active) {
                    if (surplus == 0) {
                        break;
                    }
                    if (workers.containsKey(worker.getId())) {
                        worker.retire();
                        surplus--;
                    }
                }
            }
            removed.addAll(sweepRetiredWorkers());
        } finally {
            lock.unlock();
        }

        for (AnalysisWorker worker : removed) {
            cleanupWorker(worker);
        }
        log.info("workers scaled, target={}", targetCount);
        fire(listener -> listener.onWorkersScaled(targetCount));
    }

    /**
     * Stop dispatching, wait for in-flight tasks and release every worker. Pending tasks stay pending.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
        } finally {
            lock.unlock();
        }
        log.info("task queue shutting down");

        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(Math.max(1000, properties.getPollIntervalMs()), TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }

        awaitProcessingDrained();

        List<AnalysisWorker> toCleanup;
        lock.lock();
        try {
            toCleanup = new ArrayList<>(workers.values());
            workers.clear();
        } finally {
            lock.unlock();
        }
        for (AnalysisWorker worker : toCleanup) {
            cleanupWorker(worker);
        }
        workerExecutor.shutdown();

        log.info("task queue shut down, pending={}", pendingCount());
        fire(TaskQueueListener::onShutdown);
    }

    public boolean isShutdown() {
        return shuttingDown;
    }

    void processQueue() {
        List<AnalysisWorker> assignedWorkers = new ArrayList<>();
        List<AnalysisTask> assignedTasks = new ArrayList<>();
        List<AnalysisWorker> swept;
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            swept = sweepRetiredWorkers();
            Instant now = clock.instant();
            for (AnalysisWorker worker : workers.values()) {
                if (!worker.isAvailable() || worker.isRetiring()) {
                    continue;
                }
                AnalysisTask next = pollEligible(now);
                if (next == null) {
                    break;
                }
                next.setStartedAt(now);
                processing.put(next.getId(), next);
                assignedWorkers.add(worker);
                assignedTasks.add(next);
            }
        } finally {
            lock.unlock();
        }

        for (AnalysisWorker worker : swept) {
            cleanupWorker(worker);
        }
        for (int i = 0; i < assignedTasks.size(); i++) {
            dispatch(assignedWorkers.get(i), assignedTasks.get(i));
        }
    }

    private void processQueueSafely() {
        try {
            processQueue();
        } catch (RuntimeException ex) {
            log.warn("task queue tick failed, error={}", ex.getMessage(), ex);
        }
    }

    private void dispatch(AnalysisWorker worker, AnalysisTask task) {
        AnalysisTask snapshot = snapshot(task);
        log.debug("task started, taskId={}, workerId={}", task.getId(), worker.getId());
        fire(listener -> listener.onTaskStarted(snapshot, worker.getId()));
        try {
            worker.processTask(task);
        } catch (RuntimeException ex) {
            // The worker was taken or closed between the tick and the hand-off, the attempt never ran.
            log.warn("task hand-off rejected, requeueing, taskId={}, workerId={}, error={}",
                task.getId(), worker.getId(), ex.getMessage());
            lock.lock();
            try {
                if (processing.remove(task.getId()) != null) {
                    task.setStartedAt(null);
                    pending.addFirst(task);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void handleCompleted(AnalysisWorker worker, AnalysisTask task, TaskResult result) {
        AnalysisTask tracked;
        CompletableFuture<TaskResult> future = null;
        boolean retired;
        lock.lock();
        try {
            tracked = processing.remove(task.getId());
            retired = removeIfRetiring(worker);
            if (tracked != null) {
                tracked.setCompletedAt(clock.instant());
                completed.add(tracked);
                future = results.get(tracked.getId());
            }
        } finally {
            lock.unlock();
        }

        if (retired) {
            cleanupWorker(worker);
        }
        if (tracked == null) {
            log.debug("ignore report for task no longer processing, taskId={}", task.getId());
            return;
        }

        future.complete(result);
        AnalysisTask snapshot = snapshot(tracked);
        fire(listener -> listener.onTaskCompleted(snapshot, result));
    }

    private void handleFailed(AnalysisWorker worker, AnalysisTask task, TaskResult result) {
        AnalysisTask tracked;
        CompletableFuture<TaskResult> future = null;
        boolean retry = false;
        boolean retired;
        lock.lock();
        try {
            tracked = processing.remove(task.getId());
            retired = removeIfRetiring(worker);
            if (tracked == null) {
                return;
            }
            tracked.setLastError(result.getError() == null ? "unknown error" : result.getError().getMessage());
            int maxRetries = tracked.getMaxRetries() == null ? properties.getDefaultMaxRetries() : tracked.getMaxRetries();
            retry = tracked.getRetryCount() < maxRetries;
            if (retry) {
                tracked.setRetryCount(tracked.getRetryCount() + 1);
                tracked.setStartedAt(null);
                pending.addFirst(tracked);
                if (properties.getRetryBackoffMs() > 0) {
                    retryNotBefore.put(tracked.getId(),
                        clock.instant().plusMillis(properties.getRetryBackoffMs() * tracked.getRetryCount()));
                }
            } else {
                tracked.setCompletedAt(clock.instant());
                failed.add(tracked);
                future = results.get(tracked.getId());
            }
        } finally {
            lock.unlock();
        }

        if (retired) {
            cleanupWorker(worker);
        }

        if (tracked == null) {
            log.debug("ignore report for task no longer processing, taskId={}", task.getId());
            return;
        }
        AnalysisTask snapshot = snapshot(tracked);
        if (retry) {
            log.info("task retry scheduled, taskId={}, retryCount={}", tracked.getId(), snapshot.getRetryCount());
            fire(listener -> listener.onTaskRetry(snapshot, result));
        } else {
            log.warn("task failed permanently, taskId={}, attempts={}, error={}",
                tracked.getId(), snapshot.getRetryCount() + 1, snapshot.getLastError());
            future.complete(result);
            fire(listener -> listener.onTaskFailed(snapshot, result));
        }
    }

    private boolean removeIfRetiring(AnalysisWorker worker) {
        if (worker.isRetiring() && workers.remove(worker.getId()) != null) {
            log.debug("retired worker removed, workerId={}", worker.getId());
            return true;
        }
        return false;
    }

    /**
     * Remove idle retiring workers. Callers clean the returned workers up after releasing the lock.
     */
    private List<AnalysisWorker> sweepRetiredWorkers() {
        List<AnalysisWorker> swept = new ArrayList<>();
        Iterator<AnalysisWorker> iterator = workers.values().iterator();
        while (iterator.hasNext()) {
            AnalysisWorker worker = iterator.next();
            if (worker.isRetiring() && worker.isIdle()) {
                iterator.remove();
                swept.add(worker);
                log.debug("retired worker removed, workerId={}", worker.getId());
            }
        }
        return swept;
    }

    private void insertByPriority(AnalysisTask task) {
        // After the last pending task of equal or higher priority.
        int weight = task.getPriority().getWeight();
        int index = pending.size();
        while (index > 0 && pending.get(index - 1).getPriority().getWeight() < weight) {
            index--;
        }
        pending.add(index, task);
    }

    private AnalysisTask pollEligible(Instant now) {
        Iterator<AnalysisTask> iterator = pending.iterator();
        while (iterator.hasNext()) {
            AnalysisTask task = iterator.next();
            Instant notBefore = retryNotBefore.get(task.getId());
            if (notBefore == null || !now.isBefore(notBefore)) {
                iterator.remove();
                retryNotBefore.remove(task.getId());
                return task;
            }
        }
        return null;
    }

    private AnalysisTask removePending(String taskId) {
        Iterator<AnalysisTask> iterator = pending.iterator();
        while (iterator.hasNext()) {
            AnalysisTask task = iterator.next();
            if (task.getId().equals(taskId)) {
                iterator.remove();
                return task;
            }
        }
        return null;
    }

    private AnalysisTask normalizeTask(AnalysisTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (task.getType() == null) {
            throw new IllegalArgumentException("task type is required");
        }
        if (!StringUtils.hasText(task.getUrl())) {
            throw new IllegalArgumentException("task url is required");
        }
        AnalysisTask copy = task.toBuilder().build();
        if (!StringUtils.hasText(copy.getId())) {
            copy.setId(UUID.randomUUID().toString());
        }
        if (copy.getOptions() == null) {
            copy.setOptions(ScanOptions.defaults());
        }
        if (copy.getPriority() == null) {
            copy.setPriority(TaskPriority.MEDIUM);
        }
        if (copy.getMaxRetries() == null) {
            copy.setMaxRetries(properties.getDefaultMaxRetries());
        }
        if (copy.getCreatedAt() == null) {
            copy.setCreatedAt(clock.instant());
        }
        return copy;
    }

    private void awaitProcessingDrained() {
        long deadline = properties.getShutdownTimeoutMs() > 0
            ? System.currentTimeMillis() + properties.getShutdownTimeoutMs()
            : Long.MAX_VALUE;
        while (processingCount() > 0) {
            if (System.currentTimeMillis() >= deadline) {
                log.warn("shutdown timed out waiting for in-flight tasks, processing={}", processingCount());
                return;
            }
            try {
                Thread.sleep(Math.max(1, properties.getShutdownPollIntervalMs()));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("shutdown interrupted while waiting for in-flight tasks");
                return;
            }
        }
    }

    private int processingCount() {
        lock.lock();
        try {
            return processing.size();
        } finally {
            lock.unlock();
        }
    }

    private int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<TaskResult> futureOf(String taskId) {
        lock.lock();
        try {
            return results.get(taskId);
        } finally {
            lock.unlock();
        }
    }

    private AnalysisWorker createWorker() {
        return workerFactory.create("worker-" + workerIdGen.getAndIncrement(), workerExecutor, workerListener);
    }

    private void cleanupWorker(AnalysisWorker worker) {
        try {
            worker.cleanup();
        } catch (Exception ex) {
            log.warn("failed to cleanup worker, workerId={}", worker.getId(), ex);
        }
    }

    private void fire(Consumer<TaskQueueListener> event) {
        for (TaskQueueListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("task queue listener failed", ex);
            }
        }
    }

    private static void validateWorkerCount(int count) {
        if (count < TaskQueueProperties.MIN_WORKERS || count > TaskQueueProperties.MAX_WORKERS) {
            throw new IllegalArgumentException("worker count must be between " + TaskQueueProperties.MIN_WORKERS
                + " and " + TaskQueueProperties.MAX_WORKERS + ", got " + count);
        }
    }

    private static AnalysisTask snapshot(AnalysisTask task) {
        return task.toBuilder().build();
    }

    private static List<AnalysisTask> snapshots(Iterable<AnalysisTask> tasks) {
        List<AnalysisTask> copies = new ArrayList<>();
        for (AnalysisTask task : tasks) {
            copies.add(snapshot(task));
        }
        return copies;
    }

    private class QueueWorkerListener implements WorkerListener {

        @Override
        public void onTaskCompleted(AnalysisWorker worker, AnalysisTask task, TaskResult result) {
            handleCompleted(worker, task, result);
        }

        @Override
        public void onTaskFailed(AnalysisWorker worker, AnalysisTask task, TaskResult result) {
            handleFailed(worker, task, result);
        }

    }

}
