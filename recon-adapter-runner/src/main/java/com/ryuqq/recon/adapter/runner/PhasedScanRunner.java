package com.ryuqq.recon.adapter.runner;

import com.ryuqq.recon.core.orchestrator.ScanOrchestrator;
import com.ryuqq.recon.core.phase.ScanPhase;
import com.ryuqq.recon.core.schedule.ModuleSchedule;
import com.ryuqq.recon.core.schedule.ModuleStatus;
import com.ryuqq.recon.core.statemachine.InvalidTransitionException;
import com.ryuqq.recon.core.statemachine.ScanState;
import com.ryuqq.recon.core.statemachine.ScanStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 단계 기반 스캔 실행기.
 *
 * <p>{@link ScanOrchestrator}를 폴링하여 실행 가능한 모듈을 워커 풀에 디스패치하고,
 * 결과를 보고하며, 단계를 전진시키고, {@link ScanStateMachine}을 종료 상태까지 구동합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run() 호출
 *   ↓
 * CREATED → QUEUED → STARTING → RUNNING
 *   ↓
 * For each phase (INIT ~ REPORTING):
 *   1. getRunnableModules(phase) → moduleStarted → 워커 풀 제출
 *   2. 워커: task.execute() → moduleCompleted / moduleFailed
 *   3. 모듈 타임아웃 (워커 실행 시작 기준) → 인터럽트 + moduleFailed
 *   4. 더 이상 진행할 수 없으면 남은 PENDING 모듈 실패 처리 ("Unsatisfied dependencies")
 *   5. advancePhase()
 *   ↓
 * RUNNING → COMPLETED  (또는 STOPPING → CANCELLED, 타임아웃 → FAILED)
 * </pre>
 *
 * <p><strong>외부 제어:</strong></p>
 * <ul>
 *   <li>PAUSED: 새 모듈을 디스패치하지 않음 (실행 중인 모듈은 계속)</li>
 *   <li>STOPPING: 실행 중인 모듈이 끝나기를 기다린 뒤 CANCELLED로 종료</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>디스패치, 타임아웃 판정, 단계 전진은 run()을 호출한 스레드에서만 수행</li>
 *   <li>모듈 결과 보고는 워커와 타임아웃 판정 중 먼저 선점한 쪽만 수행</li>
 *   <li>타임아웃 처리된 모듈도 워커 스레드가 끝날 때까지 동시 실행 슬롯을 점유</li>
 *   <li>결과 보고 없이 끝난 모듈(예: Error)은 실패 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhasedScanRunner {

    private static final Logger log = LoggerFactory.getLogger(PhasedScanRunner.class);

    static final String STOPPED_REASON = "Scan stopped by request";
    static final String UNSATISFIED_DEPENDENCIES = "Unsatisfied dependencies";
    static final String NO_TASK = "No task registered for module";
    static final String NO_OUTCOME = "Module ended without reporting an outcome";

    private final ScanStateMachine machine;
    private final ScanOrchestrator orchestrator;
    private final Map<String, ModuleTask> tasks;
    private final ModuleRunnerConfig config;
    private final ExecutorService workerExecutor;
    private final AtomicBoolean used = new AtomicBoolean();

    // 타임아웃 처리되었지만 워커 스레드가 아직 끝나지 않은 모듈 (run() 스레드 전용)
    private final List<InFlight> abandoned = new ArrayList<>();

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param machine 스캔 상태 머신
     * @param orchestrator 모듈 오케스트레이터
     * @param tasks 모듈 이름별 실행 로직
     * @throws IllegalArgumentException 의존성이 null이거나 Scan ID가 다른 경우
     */
    public PhasedScanRunner(ScanStateMachine machine, ScanOrchestrator orchestrator, Map<String, ModuleTask> tasks) {
        this(machine, orchestrator, tasks, new ModuleRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param machine 스캔 상태 머신
     * @param orchestrator 모듈 오케스트레이터
     * @param tasks 모듈 이름별 실행 로직
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null이거나 Scan ID가 다른 경우
     */
    public PhasedScanRunner(ScanStateMachine machine, ScanOrchestrator orchestrator,
                            Map<String, ModuleTask> tasks, ModuleRunnerConfig config) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (!machine.getScanId().equals(orchestrator.getScanId())) {
            throw new IllegalArgumentException(
                "machine and orchestrator must belong to the same scan (machine: " + machine.getScanId()
                    + ", orchestrator: " + orchestrator.getScanId() + ")"
            );
        }

        this.machine = machine;
        this.orchestrator = orchestrator;
        this.tasks = Map.copyOf(tasks);
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 스캔을 끝까지 실행 (호출 스레드를 블로킹).
     *
     * @return 최종 상태 (COMPLETED, FAILED 또는 CANCELLED)
     * @throws IllegalStateException 이미 실행했거나 실행할 수 없는 상태인 경우
     * @throws RuntimeException 실행 중 인터럽트 발생 시 (스캔은 FAILED로 종료)
     */
    public ScanState run() {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("PhasedScanRunner can only run once");
        }

        long scanStartNanos = System.nanoTime();
        String scanId = machine.getScanId().getValue();

        try {
            if (!prepare()) {
                orchestrator.fail("Scan " + machine.getState() + " before start");
                return machine.getState();
            }
            orchestrator.start();

            while (!orchestrator.isComplete()) {
                ScanPhase phase = orchestrator.getCurrentPhase();
                PhaseOutcome outcome = drivePhase(phase, scanStartNanos);

                if (outcome == PhaseOutcome.STOPPED) {
                    orchestrator.fail(STOPPED_REASON);
                    return finish(ScanState.CANCELLED, STOPPED_REASON);
                }
                if (outcome == PhaseOutcome.TIMED_OUT) {
                    String reason = "Scan timed out after " + config.maxScanTimeMs() + "ms";
                    orchestrator.fail(reason);
                    return finish(ScanState.FAILED, reason);
                }
                orchestrator.advancePhase();
            }

            if (orchestrator.getCurrentPhase() == ScanPhase.COMPLETE) {
                log.info("Scan {} completed: {}", scanId, orchestrator.summary());
                return finish(ScanState.COMPLETED, "All phases complete");
            }
            return finish(ScanState.FAILED, orchestrator.getFailureReason().orElse("Orchestration failed"));

        } catch (RuntimeException e) {
            log.error("Scan {} runner aborted", scanId, e);
            orchestrator.fail(describe(e));
            finishQuietly(ScanState.FAILED, describe(e));
            throw e;
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>워커 풀을 graceful shutdown하여 진행 중인 모듈이 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * CREATED/QUEUED/STARTING → RUNNING.
     *
     * @return RUNNING에 도달했으면 true, 준비 중 외부에서 취소된 경우 false
     */
    private boolean prepare() {
        ScanState state = machine.getState();
        if (state == ScanState.RUNNING) {
            return true;
        }
        if (state != ScanState.CREATED && state != ScanState.QUEUED && state != ScanState.STARTING) {
            throw new IllegalStateException("Scan cannot be run from state " + state);
        }

        try {
            if (machine.getState() == ScanState.CREATED) {
                machine.transition(ScanState.QUEUED, "Queued for execution");
            }
            if (machine.getState() == ScanState.QUEUED) {
                machine.transition(ScanState.STARTING, "Runner started");
            }
            machine.transition(ScanState.RUNNING, tasks.size() + " module tasks loaded");
            return true;
        } catch (InvalidTransitionException e) {
            if (machine.isTerminal()) {
                log.info("Scan {} left the start path before running: {}", machine.getScanId().getValue(), e.getMessage());
                return false;
            }
            throw e;
        }
    }

    /**
     * 한 단계를 더 이상 진행할 수 없을 때까지 구동.
     */
    private PhaseOutcome drivePhase(ScanPhase phase, long scanStartNanos) {
        Map<String, InFlight> inFlight = new LinkedHashMap<>();

        while (true) {
            enforceModuleTimeouts(inFlight);
            reap(inFlight);

            if (orchestrator.isComplete()) {
                return PhaseOutcome.DONE;
            }
            if (elapsedMs(scanStartNanos) > config.maxScanTimeMs()) {
                abandon(inFlight, "Scan time budget exhausted");
                return PhaseOutcome.TIMED_OUT;
            }

            ScanState state = machine.getState();
            if (state == ScanState.STOPPING || state.isTerminal()) {
                if (inFlight.isEmpty()) {
                    return PhaseOutcome.STOPPED;
                }
            } else if (state == ScanState.RUNNING) {
                dispatch(phase, inFlight);
                if (inFlight.isEmpty() && !waitingForWorker(phase)) {
                    failUnschedulable(phase);
                    return PhaseOutcome.DONE;
                }
            }

            sleep(config.pollingIntervalMs());
        }
    }

    private void dispatch(ScanPhase phase, Map<String, InFlight> inFlight) {
        int capacity = config.concurrency() - inFlight.size() - abandoned.size();

        for (String name : orchestrator.getRunnableModules(phase)) {
            if (capacity <= 0) {
                return;
            }
            ModuleTask task = tasks.get(name);
            if (task == null) {
                orchestrator.moduleFailed(name, NO_TASK);
                continue;
            }
            if (!orchestrator.moduleStarted(name)) {
                return;
            }

            InFlight flight = new InFlight(name);
            ModuleContext context = new ModuleContext(machine.getScanId(), orchestrator.getTarget(), name, phase);
            flight.future = workerExecutor.submit(() -> execute(flight, task, context));
            inFlight.put(name, flight);
            capacity--;
        }
    }

    /**
     * 워커 스레드에서 모듈 실행 후 결과 보고.
     */
    private void execute(InFlight flight, ModuleTask task, ModuleContext context) {
        flight.startedNanos = System.nanoTime();
        flight.started = true;
        try {
            report(flight, task, context);
        } finally {
            flight.exited = true;
        }
    }

    private void report(InFlight flight, ModuleTask task, ModuleContext context) {
        long events;
        try {
            events = task.execute(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settle(flight, () -> orchestrator.moduleFailed(flight.name, "Interrupted"));
            return;
        } catch (Exception e) {
            log.warn("Module {} failed for scan {}", flight.name, context.scanId().getValue(), e);
            settle(flight, () -> orchestrator.moduleFailed(flight.name, describe(e)));
            return;
        } catch (Error e) {
            log.error("Module {} raised an error for scan {}", flight.name, context.scanId().getValue(), e);
            settle(flight, () -> orchestrator.moduleFailed(flight.name, describe(e)));
            throw e;
        }

        long produced = events;
        if (produced < 0) {
            settle(flight, () -> orchestrator.moduleFailed(flight.name, "Module reported negative event count: " + produced));
            return;
        }
        settle(flight, () -> orchestrator.moduleCompleted(flight.name, produced));
    }

    /**
     * 모듈 타임아웃 판정 (워커가 실행을 시작한 시점부터 측정).
     */
    private void enforceModuleTimeouts(Map<String, InFlight> inFlight) {
        for (InFlight flight : inFlight.values()) {
            if (!flight.started || flight.settled.get() || elapsedMs(flight.startedNanos) <= config.maxModuleTimeMs()) {
                continue;
            }
            String reason = "Module timed out after " + config.maxModuleTimeMs() + "ms";
            if (settle(flight, () -> orchestrator.moduleFailed(flight.name, reason))) {
                log.warn("Module {} timed out for scan {} after {}ms",
                    flight.name, machine.getScanId().getValue(), config.maxModuleTimeMs());
                flight.future.cancel(true);
            }
        }
    }

    /**
     * 끝난 모듈 정리.
     *
     * <p>결과를 보고하지 않고 끝난 모듈은 실패 처리하고, 결과는 확정되었지만 워커 스레드가
     * 아직 실행 중인 모듈은 {@link #abandoned}로 옮겨 스레드가 끝날 때까지 슬롯을 점유시킵니다.</p>
     */
    private void reap(Map<String, InFlight> inFlight) {
        Iterator<InFlight> iterator = inFlight.values().iterator();
        while (iterator.hasNext()) {
            InFlight flight = iterator.next();
            if (!flight.holdsWorker()) {
                if (settle(flight, () -> orchestrator.moduleFailed(flight.name, NO_OUTCOME))) {
                    log.warn("Module {} of scan {} ended without reporting an outcome",
                        flight.name, machine.getScanId().getValue());
                }
                iterator.remove();
            } else if (flight.settled.get()) {
                abandoned.add(flight);
                iterator.remove();
            }
        }
        abandoned.removeIf(flight -> !flight.holdsWorker());
    }

    /**
     * 실행 가능한 모듈이 있지만 모든 슬롯이 종료되지 않은 워커에 점유된 상태인지 확인.
     */
    private boolean waitingForWorker(ScanPhase phase) {
        return !abandoned.isEmpty() && !orchestrator.getRunnableModules(phase).isEmpty();
    }

    private void abandon(Map<String, InFlight> inFlight, String reason) {
        for (InFlight flight : inFlight.values()) {
            settle(flight, () -> orchestrator.moduleFailed(flight.name, reason));
            flight.future.cancel(true);
        }
        inFlight.clear();
    }

    /**
     * 더 이상 디스패치될 수 없는 PENDING 모듈 실패 처리.
     */
    private void failUnschedulable(ScanPhase phase) {
        for (String name : orchestrator.getPhaseModules(phase)) {
            ModuleSchedule schedule = orchestrator.getModule(name).orElse(null);
            if (schedule == null || schedule.status() != ModuleStatus.PENDING) {
                continue;
            }
            List<String> missing = new ArrayList<>();
            for (String dependency : schedule.dependsOn()) {
                if (!ModuleStatus.COMPLETED.value().equals(orchestrator.getModuleStatus(dependency))) {
                    missing.add(dependency);
                }
            }
            log.warn("Module {} of scan {} can never run, missing {}", name, machine.getScanId().getValue(), missing);
            orchestrator.moduleFailed(name, UNSATISFIED_DEPENDENCIES + ": " + missing);
        }
    }

    /**
     * 결과 보고 선점 (워커와 타임아웃 판정 중 한쪽만 보고).
     *
     * @return 이 호출이 보고를 수행했으면 true
     */
    private boolean settle(InFlight flight, Runnable report) {
        if (!flight.settled.compareAndSet(false, true)) {
            return false;
        }
        try {
            report.run();
        } catch (IllegalStateException e) {
            log.warn("Module {} outcome could not be recorded: {}", flight.name, e.getMessage());
        }
        return true;
    }

    /**
     * 상태 머신 종료 (PAUSED처럼 목표로 바로 갈 수 없으면 STOPPING 경유).
     */
    private ScanState finish(ScanState target, String reason) {
        for (int attempt = 0; attempt < 3; attempt++) {
            ScanState current = machine.getState();
            if (current.isTerminal()) {
                return current;
            }
            try {
                if (!machine.canTransition(target) && machine.canTransition(ScanState.STOPPING)) {
                    machine.transition(ScanState.STOPPING, reason);
                }
                return machine.transition(target, reason);
            } catch (InvalidTransitionException e) {
                log.debug("Scan {} state changed while finishing, retrying: {}",
                    machine.getScanId().getValue(), e.getMessage());
            }
        }
        throw new IllegalStateException(
            "Scan " + machine.getScanId().getValue() + " could not reach " + target + " from " + machine.getState()
        );
    }

    private void finishQuietly(ScanState target, String reason) {
        try {
            finish(target, reason);
        } catch (RuntimeException e) {
            log.warn("Scan {} could not be moved to {}: {}", machine.getScanId().getValue(), target, e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    /**
     * Sleep (폴링 간격 대기).
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @throws RuntimeException sleep 중 인터럽트 발생 시
     */
    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Scan runner interrupted", e);
        }
    }

    private enum PhaseOutcome {
        DONE,
        STOPPED,
        TIMED_OUT
    }

    private static final class InFlight {

        private final String name;
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile long startedNanos;
        private volatile boolean started;
        private volatile boolean exited;
        private Future<?> future;

        private InFlight(String name) {
            this.name = name;
        }

        /**
         * 워커 스레드를 점유 중인지 (대기 중이거나 실행 중).
         *
         * <p>취소된 Future는 스레드가 아직 실행 중이어도 isDone()이 true이므로
         * 실행을 시작한 모듈은 execute() 종료 여부로 판단합니다.</p>
         */
        private boolean holdsWorker() {
            return started ? !exited : !future.isDone();
        }
    }
}
