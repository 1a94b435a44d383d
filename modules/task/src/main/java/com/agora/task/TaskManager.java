package com.agora.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 즉시 작업과 주기 작업을 하나의 워커 풀로 실행하는 작업 관리자.
 * <p>
 * <b>구성:</b>
 * <ul>
 *   <li>생산자 1: {@link #enqueue(String, Object)} 직접 호출</li>
 *   <li>생산자 2: 스케줄러의 주기 작업 tick</li>
 *   <li>소비자: 고정 크기 워커 풀이 {@link TaskQueue}에서 작업을 꺼내 등록된 {@link TaskHandler}로 실행</li>
 * </ul>
 * </p>
 * <p>
 * <b>실패 처리:</b>
 * <ul>
 *   <li>핸들러 예외: 지수 백오프로 재시도, {@code maxAttempts}회 실패하면 데드 레터로 이동</li>
 *   <li>핸들러가 없는 작업: 재시도해도 소용없으므로 바로 데드 레터로 이동</li>
 * </ul>
 * </p>
 * <p>
 * <b>중지 절차:</b> 새 작업 등록을 거부하고, 워커는 더 이상 작업을 꺼내지 않으며,
 * 실행 중 작업을 {@code shutdownTimeout}까지 기다립니다. 그때까지 끝나지 않은 작업은
 * 대기열로 되돌려 다음 실행에서 처리되도록 합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class TaskManager implements SmartLifecycle {

    /**
     * 웹 서버의 graceful shutdown보다 늦게 멈추도록 낮은 단계에 둡니다.
     * 종료 중에도 처리 중인 요청이 남긴 후속 작업을 큐에 넣을 수 있어야 합니다.
     */
    static final int LIFECYCLE_PHASE = WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 1024;

    private final TaskQueue taskQueue;
    private final TaskProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskMetrics metrics;
    private final IntervalFunction backoff;
    private final Map<String, TaskHandler> handlers;
    private final List<RecurringTask> recurringTasks;
    private final Map<String, AtomicReference<Instant>> recurringLeases = new ConcurrentHashMap<>();
    private final Set<QueuedTask> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopped = false;
    private volatile boolean polling = false;
    private ExecutorService workerPool;
    private ScheduledExecutorService scheduler;

    public TaskManager(
        TaskQueue taskQueue,
        List<TaskHandler> taskHandlers,
        TaskProperties properties,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry
    ) {
        this.taskQueue = taskQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = new TaskMetrics(meterRegistry);
        this.backoff = IntervalFunction.ofExponentialBackoff(
            properties.backoffInitial(), properties.backoffMultiplier(), properties.backoffMax());

        Map<String, TaskHandler> byName = new HashMap<>();
        List<RecurringTask> recurring = new ArrayList<>();
        for (TaskHandler handler : taskHandlers) {
            TaskHandler previous = byName.putIfAbsent(handler.name(), handler);
            if (previous != null) {
                throw new IllegalStateException("같은 이름의 작업 핸들러가 중복 등록되었습니다: " + handler.name());
            }
            if (handler instanceof RecurringTask recurringTask) {
                recurring.add(recurringTask);
                recurringLeases.put(recurringTask.name(), new AtomicReference<>());
            }
        }
        this.handlers = Collections.unmodifiableMap(byName);
        this.recurringTasks = List.copyOf(recurring);
    }

    /**
     * 작업을 등록합니다.
     * <p>
     * 시작 전에도 등록할 수 있으며, 큐에 보관되었다가 워커가 뜨면 실행됩니다.
     * </p>
     *
     * @param name 작업 이름
     * @param payload JSON으로 직렬화될 페이로드
     * @return 작업 ID
     * @throws TaskRejectedException 중지된 뒤 호출한 경우
     * @throws IllegalArgumentException 등록되지 않은 작업 이름인 경우
     */
    public String enqueue(String name, Object payload) {
        if (stopped) {
            throw new TaskRejectedException(name);
        }
        if (!handlers.containsKey(name)) {
            throw new IllegalArgumentException("등록되지 않은 작업입니다: " + name);
        }
        TaskEnvelope envelope = TaskEnvelope.create(name, toJson(payload));
        taskQueue.push(envelope);
        metrics.enqueued(name);
        log.debug("작업 등록: name={}, id={}", name, envelope.id());
        return envelope.id();
    }

    public long pendingCount() {
        return taskQueue.pendingCount();
    }

    public List<TaskEnvelope> deadLetters(int limit) {
        return taskQueue.deadLetters(limit);
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        stopped = false;
        polling = true;

        workerPool = Executors.newFixedThreadPool(properties.workers(), namedThreadFactory("task-worker-"));
        for (int i = 0; i < properties.workers(); i++) {
            workerPool.submit(this::pollLoop);
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("task-scheduler-"));
        long pollMillis = properties.pollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::promoteDueTasks, 0L, pollMillis, TimeUnit.MILLISECONDS);
        for (RecurringTask recurringTask : recurringTasks) {
            long intervalMillis = recurringTask.interval().toMillis();
            long initialDelay = recurringTask.runOnStart() ? 0L : intervalMillis;
            scheduler.scheduleAtFixedRate(() -> tick(recurringTask), initialDelay, intervalMillis, TimeUnit.MILLISECONDS);
        }

        log.info("작업 관리자 시작: workers={}, handlers={}, recurring={}",
            properties.workers(), handlers.keySet(), recurringTasks.stream().map(TaskHandler::name).toList());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopped = true;
        scheduler.shutdownNow();
        polling = false;
        workerPool.shutdown();

        boolean drained = false;
        try {
            drained = workerPool.awaitTermination(properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!drained) {
            workerPool.shutdownNow();
            int requeued = requeueInFlight();
            log.warn("작업 관리자 중지 대기 시간 초과, 실행 중 작업을 대기열로 되돌림: count={}", requeued);
        }
        log.info("작업 관리자 중지 완료: pending={}", safePendingCount());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.enabled();
    }

    @Override
    public int getPhase() {
        return LIFECYCLE_PHASE;
    }

    private void pollLoop() {
        while (polling) {
            QueuedTask task;
            try {
                task = taskQueue.poll(properties.visibilityTimeout()).orElse(null);
            } catch (Exception e) {
                log.warn("작업 큐 조회 실패", e);
                task = null;
            }
            if (task == null) {
                if (!sleepQuietly(properties.pollInterval())) {
                    return;
                }
                continue;
            }
            try {
                process(task);
            } catch (Throwable t) {
                // 작업은 processing에 남아 가시성 만료 후 다시 전달된다
                log.error("작업 실행 중 복구할 수 없는 오류, 워커는 계속 동작: name={}, id={}",
                    task.envelope().name(), task.envelope().id(), t);
            }
        }
    }

    void process(QueuedTask task) {
        TaskEnvelope envelope = task.envelope();
        inFlight.add(task);
        try {
            TaskHandler handler = handlers.get(envelope.name());
            if (handler == null) {
                log.error("등록된 핸들러가 없는 작업, 데드 레터로 이동: name={}, id={}", envelope.name(), envelope.id());
                taskQueue.deadLetter(task, envelope.failed("no handler registered"));
                metrics.deadLettered(envelope.name());
                return;
            }

            try {
                handler.handle(envelope);
            } catch (Exception e) {
                onFailure(task, e);
                return;
            }

            taskQueue.ack(task);
            metrics.succeeded(envelope.name());
            releaseLease(envelope.name());
            log.debug("작업 완료: name={}, id={}", envelope.name(), envelope.id());
        } catch (Exception e) {
            // 큐 갱신 실패는 가시성 만료 후 재전달로 복구된다
            log.error("작업 상태 갱신 실패: name={}, id={}", envelope.name(), envelope.id(), e);
        } finally {
            inFlight.remove(task);
        }
    }

    private void onFailure(QueuedTask task, Exception cause) {
        TaskEnvelope failed = task.envelope().failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        if (failed.attempts() >= properties.maxAttempts()) {
            taskQueue.deadLetter(task, failed);
            metrics.deadLettered(failed.name());
            releaseLease(failed.name());
            log.error("작업 최대 시도 횟수 초과, 데드 레터로 이동: name={}, id={}, attempts={}",
                failed.name(), failed.id(), failed.attempts(), cause);
            return;
        }
        Duration delay = Duration.ofMillis(backoff.apply(failed.attempts()));
        taskQueue.retry(task, failed, delay);
        metrics.retried(failed.name());
        log.warn("작업 실패, 재시도 예약: name={}, id={}, attempts={}, delay={}ms",
            failed.name(), failed.id(), failed.attempts(), delay.toMillis(), cause);
    }

    void tick(RecurringTask recurringTask) {
        if (stopped) {
            return;
        }
        String name = recurringTask.name();
        if (!tryAcquireLease(recurringTask)) {
            metrics.skipped(name);
            log.debug("이전 실행이 끝나지 않아 주기 작업을 건너뜀: name={}", name);
            return;
        }
        try {
            enqueue(name, Map.of());
        } catch (Exception e) {
            releaseLease(name);
            log.warn("주기 작업 등록 실패, 다음 주기에 다시 시도: name={}", name, e);
        }
    }

    /**
     * 주기 작업의 실행 중 표시를 얻습니다.
     * <p>
     * 다른 프로세스가 작업을 처리하면 이 프로세스의 표시는 해제되지 않으므로,
     * 표시는 {@code interval + visibilityTimeout}이 지나면 만료된 것으로 봅니다.
     * </p>
     */
    private boolean tryAcquireLease(RecurringTask recurringTask) {
        AtomicReference<Instant> lease = recurringLeases.get(recurringTask.name());
        Instant now = Instant.now();
        Instant current = lease.get();
        if (current != null && current.isAfter(now)) {
            return false;
        }
        Instant expiresAt = now.plus(recurringTask.interval()).plus(properties.visibilityTimeout());
        return lease.compareAndSet(current, expiresAt);
    }

    private void releaseLease(String name) {
        AtomicReference<Instant> lease = recurringLeases.get(name);
        if (lease != null) {
            lease.set(null);
        }
    }

    private void promoteDueTasks() {
        try {
            int promoted = taskQueue.promoteDue(Instant.now());
            if (promoted > 0) {
                log.debug("재시도 예정 작업을 대기열로 이동: count={}", promoted);
            }
        } catch (Exception e) {
            log.warn("재시도 작업 이동 실패", e);
        }
    }

    private int requeueInFlight() {
        int requeued = 0;
        for (QueuedTask task : List.copyOf(inFlight)) {
            try {
                if (taskQueue.requeue(task)) {
                    requeued++;
                }
            } catch (Exception e) {
                log.warn("작업을 대기열로 되돌리지 못함, 가시성 만료 후 복구됨: id={}", task.envelope().id(), e);
            }
        }
        return requeued;
    }

    private long safePendingCount() {
        try {
            return taskQueue.pendingCount();
        } catch (Exception e) {
            return -1L;
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("작업 페이로드 직렬화 실패", e);
        }
    }

    private boolean sleepQuietly(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
