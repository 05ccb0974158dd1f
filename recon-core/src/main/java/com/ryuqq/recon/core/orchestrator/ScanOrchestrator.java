package com.ryuqq.recon.core.orchestrator;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.phase.PhaseResult;
import com.ryuqq.recon.core.phase.ScanPhase;
import com.ryuqq.recon.core.schedule.ModuleSchedule;
import com.ryuqq.recon.core.schedule.ModuleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 단일 Scan의 단계 기반 모듈 스케줄러.
 *
 * <p>현재 단계 커서, 모듈 스케줄 레지스트리, 단계별 완료 통계를 소유하며,
 * 외부 실행기가 폴링하는 스케줄링 질의를 제공합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>모듈 등록/해제 및 의존성 기반 실행 가능 여부 판단</li>
 *   <li>우선순위(내림차순) + 등록 순서 기반의 결정적 정렬</li>
 *   <li>모듈 시작/완료/실패 보고 반영 및 이벤트/오류 카운터 누적</li>
 *   <li>단계 전진과 {@link PhaseResult} 기록</li>
 *   <li>COMPLETE / FAILED 종료 처리 (관찰자 정확히 한 번 호출)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code isComplete() ⇔ currentPhase ∈ {COMPLETE, FAILED}}</li>
 *   <li>종료 후에는 모듈 상태나 단계 변경이 관찰되지 않음 (변경 호출은 false 반환)</li>
 *   <li>totalEvents, totalErrors는 단조 증가하며 보고된 값의 정확한 합</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 스레드를 생성하지 않는 수동 자료구조입니다.
 * 인스턴스당 하나의 락으로 모든 변경을 직렬화하며, 관찰자는 락 해제 후 호출됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScanOrchestrator orchestrator = new ScanOrchestrator(ScanId.of("scan-001"), "example.com")
 *     .registerModule("sfp_dns", ScanPhase.DISCOVERY, 10)
 *     .registerModule("sfp_whois", ScanPhase.DISCOVERY, 1)
 *     .registerModule("sfp_portscan", ScanPhase.ENUMERATION, 0, Set.of("sfp_dns"));
 *
 * orchestrator.start();
 * orchestrator.advancePhase();                          // INIT → DISCOVERY
 * orchestrator.getPhaseModules(ScanPhase.DISCOVERY);    // [sfp_dns, sfp_whois]
 * orchestrator.moduleStarted("sfp_dns");
 * orchestrator.moduleCompleted("sfp_dns", 42);
 * orchestrator.canRunModule("sfp_portscan");            // true
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private static final Comparator<ModuleSchedule> SCHEDULING_ORDER =
        Comparator.comparingInt(ModuleSchedule::priority).reversed()
            .thenComparingLong(ModuleSchedule::sequence);

    private static final Comparator<ModuleSchedule> REGISTRATION_ORDER =
        Comparator.comparingLong(ModuleSchedule::sequence);

    private final ScanId scanId;
    private final String target;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final Object lock = new Object();

    private final Map<String, ModuleSchedule> modules = new LinkedHashMap<>();
    private final List<PhaseResult> phaseResults = new ArrayList<>();
    private final List<PhaseChangeListener> phaseListeners = new CopyOnWriteArrayList<>();
    private final List<CompletionListener> completionListeners = new CopyOnWriteArrayList<>();

    private ScanPhase currentPhase = ScanPhase.INIT;
    private long nextSequence;
    private boolean started;
    private Instant startedAt;
    private Instant finishedAt;
    private String failureReason;
    private int phaseCompleted;
    private int phaseFailed;
    private long totalEvents;
    private long totalErrors;

    /**
     * 기본 설정으로 생성.
     *
     * @param scanId Scan ID
     * @param target 스캔 대상 (도메인, IP 등)
     * @throws IllegalArgumentException 인자가 null이거나 target이 빈 문자열인 경우
     */
    public ScanOrchestrator(ScanId scanId, String target) {
        this(scanId, target, new OrchestratorConfig());
    }

    /**
     * 설정을 지정하여 생성.
     *
     * @param scanId Scan ID
     * @param target 스캔 대상
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null이거나 target이 빈 문자열인 경우
     */
    public ScanOrchestrator(ScanId scanId, String target, OrchestratorConfig config) {
        this(scanId, target, config, Clock.systemUTC());
    }

    /**
     * 시계를 주입하여 생성 (테스트용).
     *
     * @param scanId Scan ID
     * @param target 스캔 대상
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null이거나 target이 빈 문자열인 경우
     */
    public ScanOrchestrator(ScanId scanId, String target, OrchestratorConfig config, Clock clock) {
        if (scanId == null) {
            throw new IllegalArgumentException("scanId cannot be null");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.scanId = scanId;
        this.target = target;
        this.config = config;
        this.clock = clock;
    }

    // ============================================================
    // 생명주기
    // ============================================================

    /**
     * 오케스트레이터 활성화 (단계는 변경하지 않음).
     *
     * @return 최초 호출이면 true, 이미 시작되었거나 종료된 경우 false
     */
    public boolean start() {
        synchronized (lock) {
            if (started || currentPhase.isTerminal()) {
                return false;
            }
            started = true;
            startedAt = clock.instant();
        }
        log.info("Scan {} orchestration started for target {} ({} modules)",
            scanId.getValue(), target, moduleCount());
        return true;
    }

    /**
     * 다음 단계로 전진.
     *
     * <p>떠나는 단계의 {@link PhaseResult}를 기록합니다. 다음 단계가 COMPLETE이면
     * {@link #complete()}와 동일하게 완료 관찰자가 호출됩니다.</p>
     *
     * @return 새 현재 단계 (이미 종료된 경우 변경 없이 현재 단계)
     */
    public ScanPhase advancePhase() {
        PhaseShift shift;
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return currentPhase;
            }
            shift = leavePhase(config.phaseSequence().next(currentPhase), null);
        }
        publish(shift);
        return shift.newPhase();
    }

    /**
     * 정상 종료 (→ COMPLETE).
     *
     * @return 이 호출로 종료되었으면 true, 이미 종료된 경우 false
     */
    public boolean complete() {
        PhaseShift shift;
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return false;
            }
            shift = leavePhase(ScanPhase.COMPLETE, null);
        }
        publish(shift);
        return true;
    }

    /**
     * 실패 종료 (→ FAILED).
     *
     * <p>PENDING 모듈이 남아 있어도 즉시 종료합니다.</p>
     *
     * @param reason 실패 사유
     * @return 이 호출로 종료되었으면 true, 이미 종료된 경우 false
     */
    public boolean fail(String reason) {
        PhaseShift shift;
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return false;
            }
            shift = leavePhase(ScanPhase.FAILED, reason == null ? "" : reason);
        }
        publish(shift);
        return true;
    }

    // ============================================================
    // 모듈 레지스트리
    // ============================================================

    /**
     * 우선순위 0, 의존성 없이 모듈 등록.
     *
     * @param name 모듈 이름
     * @param phase 배정 단계
     * @return this (체이닝)
     */
    public ScanOrchestrator registerModule(String name, ScanPhase phase) {
        return registerModule(name, phase, 0, Set.of());
    }

    /**
     * 의존성 없이 모듈 등록.
     *
     * @param name 모듈 이름
     * @param phase 배정 단계
     * @param priority 우선순위 (클수록 먼저)
     * @return this (체이닝)
     */
    public ScanOrchestrator registerModule(String name, ScanPhase phase, int priority) {
        return registerModule(name, phase, priority, Set.of());
    }

    /**
     * 모듈 등록.
     *
     * <p>같은 이름이 이미 있으면 {@link OrchestratorConfig#registrationPolicy()}에 따라
     * 덮어쓰거나 거부합니다. 종료된 오케스트레이터에 대한 등록은 무시됩니다.</p>
     *
     * @param name 모듈 이름
     * @param phase 배정 단계 (PhaseSequence에 포함된 비종료 단계)
     * @param priority 우선순위 (클수록 먼저)
     * @param dependsOn 먼저 완료되어야 하는 모듈 이름 집합 (null이면 빈 집합)
     * @return this (체이닝)
     * @throws IllegalArgumentException 단계가 유효하지 않거나 자기 자신에 의존하는 경우
     * @throws DuplicateModuleException REJECT 정책에서 이미 등록된 이름인 경우
     */
    public ScanOrchestrator registerModule(String name, ScanPhase phase, int priority, Set<String> dependsOn) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (phase.isTerminal() || !config.phaseSequence().contains(phase)) {
            throw new IllegalArgumentException(
                "Module phase must be a non-terminal phase of " + config.phaseSequence() + " (current: " + phase + ")"
            );
        }

        boolean overwritten;
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                log.warn("Scan {} already finished in {}; ignoring registration of {}",
                    scanId.getValue(), currentPhase, name);
                return this;
            }
            ModuleSchedule schedule = ModuleSchedule.pending(name, phase, priority, dependsOn, nextSequence);
            ModuleSchedule existing = modules.get(name);
            if (existing == null) {
                modules.put(name, schedule);
                nextSequence++;
                overwritten = false;
            } else if (config.registrationPolicy() == RegistrationPolicy.REJECT) {
                throw new DuplicateModuleException(name);
            } else {
                modules.put(name, existing.replacedBy(schedule));
                overwritten = true;
            }
        }

        log.debug("Scan {} registered module {} (phase={}, priority={}, dependsOn={}{})",
            scanId.getValue(), name, phase, priority, dependsOn, overwritten ? ", overwritten" : "");
        return this;
    }

    /**
     * 모듈 등록 해제.
     *
     * @param name 모듈 이름
     * @return 등록되어 있었으면 true, 오케스트레이터가 이미 종료된 경우 false (변경 없음)
     */
    public boolean unregisterModule(String name) {
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                log.warn("Scan {} already finished, ignoring unregistration of {}", scanId.getValue(), name);
                return false;
            }
            return name != null && modules.remove(name) != null;
        }
    }

    // ============================================================
    // 스케줄링 질의
    // ============================================================

    /**
     * 단계에 배정된 모듈 이름 (우선순위 내림차순, 동일 우선순위는 등록 순).
     *
     * @param phase 단계
     * @return 모듈 이름 목록 (없으면 빈 목록)
     */
    public List<String> getPhaseModules(ScanPhase phase) {
        synchronized (lock) {
            return names(modules.values().stream()
                .filter(schedule -> schedule.phase() == phase)
                .sorted(SCHEDULING_ORDER)
                .toList());
        }
    }

    /**
     * 모듈 실행 가능 여부.
     *
     * <p>의존성이 없는 모듈은 단계와 무관하게 항상 실행 가능합니다.
     * 등록되지 않은 의존 모듈은 완료되지 않은 것으로 취급합니다.</p>
     *
     * @param name 모듈 이름
     * @return 등록되어 있고 모든 의존 모듈이 COMPLETED이면 true
     */
    public boolean canRunModule(String name) {
        synchronized (lock) {
            ModuleSchedule schedule = name == null ? null : modules.get(name);
            return schedule != null && dependenciesCompleted(schedule);
        }
    }

    /**
     * 단계에서 지금 바로 디스패치할 수 있는 모듈.
     *
     * @param phase 단계
     * @return PENDING이면서 의존성이 충족된 모듈 이름 (스케줄링 순)
     */
    public List<String> getRunnableModules(ScanPhase phase) {
        synchronized (lock) {
            return names(modules.values().stream()
                .filter(schedule -> schedule.phase() == phase)
                .filter(schedule -> schedule.status() == ModuleStatus.PENDING)
                .filter(this::dependenciesCompleted)
                .sorted(SCHEDULING_ORDER)
                .toList());
        }
    }

    /**
     * 아직 끝나지 않은 모듈 (PENDING 또는 RUNNING).
     *
     * @return 모듈 이름 (등록 순)
     */
    public List<String> getPendingModules() {
        synchronized (lock) {
            return names(modules.values().stream()
                .filter(schedule -> !schedule.isTerminal())
                .sorted(REGISTRATION_ORDER)
                .toList());
        }
    }

    // ============================================================
    // 모듈 상태 보고
    // ============================================================

    /**
     * PENDING → RUNNING.
     *
     * @param name 모듈 이름
     * @return 반영되었으면 true, 오케스트레이터가 이미 종료된 경우 false
     * @throws UnknownModuleException 등록되지 않은 모듈인 경우
     * @throws IllegalStateException PENDING 상태가 아닌 경우
     */
    public boolean moduleStarted(String name) {
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return false;
            }
            modules.put(name, require(name).started());
        }
        log.debug("Scan {} module {} started", scanId.getValue(), name);
        return true;
    }

    /**
     * 이벤트 0건으로 완료 보고.
     *
     * @param name 모듈 이름
     * @return 반영되었으면 true, 오케스트레이터가 이미 종료된 경우 false
     */
    public boolean moduleCompleted(String name) {
        return moduleCompleted(name, 0);
    }

    /**
     * 완료 보고 (→ COMPLETED, totalEvents 누적).
     *
     * @param name 모듈 이름
     * @param eventsProduced 생성한 이벤트 수 (0 이상)
     * @return 반영되었으면 true, 오케스트레이터가 이미 종료된 경우 false
     * @throws UnknownModuleException 등록되지 않은 모듈인 경우
     * @throws IllegalStateException 이미 종료 상태인 모듈인 경우
     */
    public boolean moduleCompleted(String name, long eventsProduced) {
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return false;
            }
            modules.put(name, require(name).completed(eventsProduced));
            totalEvents += eventsProduced;
            phaseCompleted++;
        }
        log.debug("Scan {} module {} completed with {} events", scanId.getValue(), name, eventsProduced);
        return true;
    }

    /**
     * 실패 보고 (→ FAILED, totalErrors 증가).
     *
     * @param name 모듈 이름
     * @param error 오류 메시지
     * @return 반영되었으면 true, 오케스트레이터가 이미 종료된 경우 false
     * @throws UnknownModuleException 등록되지 않은 모듈인 경우
     * @throws IllegalStateException 이미 종료 상태인 모듈인 경우
     */
    public boolean moduleFailed(String name, String error) {
        synchronized (lock) {
            if (currentPhase.isTerminal()) {
                return false;
            }
            modules.put(name, require(name).failed(error));
            totalErrors++;
            phaseFailed++;
        }
        log.warn("Scan {} module {} failed: {}", scanId.getValue(), name, error);
        return true;
    }

    /**
     * 모듈 상태 조회.
     *
     * @param name 모듈 이름
     * @return pending, running, completed, failed 또는 등록되지 않은 경우 {@value ModuleStatus#UNKNOWN}
     */
    public String getModuleStatus(String name) {
        synchronized (lock) {
            ModuleSchedule schedule = name == null ? null : modules.get(name);
            return schedule == null ? ModuleStatus.UNKNOWN : schedule.status().value();
        }
    }

    /**
     * 모듈 스케줄 조회.
     *
     * @param name 모듈 이름
     * @return 스케줄 (등록되지 않았으면 empty)
     */
    public Optional<ModuleSchedule> getModule(String name) {
        synchronized (lock) {
            return Optional.ofNullable(name == null ? null : modules.get(name));
        }
    }

    /**
     * 전체 모듈 스케줄 (등록 순).
     *
     * @return 불변 목록
     */
    public List<ModuleSchedule> getModules() {
        synchronized (lock) {
            return modules.values().stream().sorted(REGISTRATION_ORDER).toList();
        }
    }

    // ============================================================
    // 관찰자
    // ============================================================

    /**
     * 단계 변경 관찰자 등록.
     *
     * <p>락 해제 후 호출되며, 관찰자 예외는 로그만 남깁니다.</p>
     *
     * @param listener 관찰자
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onPhaseChange(PhaseChangeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        phaseListeners.add(listener);
    }

    /**
     * 단계 변경 관찰자 해제.
     *
     * @param listener 관찰자
     * @return 등록되어 있었으면 true
     */
    public boolean removePhaseChangeListener(PhaseChangeListener listener) {
        return phaseListeners.remove(listener);
    }

    /**
     * 완료 관찰자 등록 (COMPLETE 또는 FAILED 진입 시 정확히 한 번 호출).
     *
     * @param listener 관찰자
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onCompletion(CompletionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        completionListeners.add(listener);
    }

    /**
     * 완료 관찰자 해제.
     *
     * @param listener 관찰자
     * @return 등록되어 있었으면 true
     */
    public boolean removeCompletionListener(CompletionListener listener) {
        return completionListeners.remove(listener);
    }

    // ============================================================
    // 조회
    // ============================================================

    public ScanId getScanId() {
        return scanId;
    }

    public String getTarget() {
        return target;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public ScanPhase getCurrentPhase() {
        synchronized (lock) {
            return currentPhase;
        }
    }

    public boolean isStarted() {
        synchronized (lock) {
            return started;
        }
    }

    public boolean isComplete() {
        return getCurrentPhase().isTerminal();
    }

    /**
     * 실패 사유 조회.
     *
     * @return FAILED로 종료된 경우 사유, 그 외 empty
     */
    public Optional<String> getFailureReason() {
        synchronized (lock) {
            return Optional.ofNullable(failureReason);
        }
    }

    public List<PhaseResult> getPhaseResults() {
        synchronized (lock) {
            return List.copyOf(phaseResults);
        }
    }

    public long getTotalEvents() {
        synchronized (lock) {
            return totalEvents;
        }
    }

    public long getTotalErrors() {
        synchronized (lock) {
            return totalErrors;
        }
    }

    /**
     * 상태 요약.
     *
     * @return OrchestratorSummary
     */
    public OrchestratorSummary summary() {
        synchronized (lock) {
            int pending = 0;
            int running = 0;
            int completed = 0;
            int failed = 0;
            for (ModuleSchedule schedule : modules.values()) {
                switch (schedule.status()) {
                    case PENDING -> pending++;
                    case RUNNING -> running++;
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                }
            }
            return new OrchestratorSummary(scanId, target, currentPhase, modules.size(),
                pending, running, completed, failed, totalEvents, totalErrors, elapsedSeconds());
        }
    }

    /**
     * 상태 API 응답용 전체 스냅샷.
     *
     * @return 직렬화 가능한 중첩 Map
     */
    public Map<String, Object> toMap() {
        synchronized (lock) {
            List<Map<String, Object>> results = new ArrayList<>(phaseResults.size());
            for (PhaseResult result : phaseResults) {
                results.add(result.toMap());
            }

            Map<String, Object> moduleMaps = new LinkedHashMap<>();
            for (ModuleSchedule schedule : modules.values().stream().sorted(REGISTRATION_ORDER).toList()) {
                moduleMaps.put(schedule.name(), schedule.toMap());
            }

            Map<String, Object> map = new LinkedHashMap<>();
            map.put("scan_id", scanId.getValue());
            map.put("target", target);
            map.put("current_phase", currentPhase.name());
            map.put("is_complete", currentPhase.isTerminal());
            map.put("started", started);
            map.put("failure_reason", failureReason);
            map.put("phase_sequence", config.phaseSequence().phases().stream().map(Enum::name).toList());
            map.put("phase_results", results);
            map.put("modules", moduleMaps);
            map.put("total_events", totalEvents);
            map.put("total_errors", totalErrors);
            map.put("elapsed_seconds", elapsedSeconds());
            return map;
        }
    }

    // ============================================================
    // 내부
    // ============================================================

    /**
     * 현재 단계를 떠나 다음 단계로 이동 (락 보유 상태에서 호출).
     */
    private PhaseShift leavePhase(ScanPhase next, String reason) {
        Instant now = clock.instant();
        ScanPhase previous = currentPhase;

        phaseResults.add(new PhaseResult(previous, phaseCompleted, phaseFailed, now));
        phaseCompleted = 0;
        phaseFailed = 0;
        currentPhase = next;

        if (next.isTerminal()) {
            finishedAt = now;
            failureReason = reason;
        }
        return new PhaseShift(previous, next);
    }

    /**
     * 단계 변경 통지 (락 해제 후 호출).
     */
    private void publish(PhaseShift shift) {
        if (shift.newPhase() == ScanPhase.FAILED) {
            log.warn("Scan {} failed during {}: {}", scanId.getValue(), shift.oldPhase(), failureReasonOrEmpty());
        } else {
            log.info("Scan {} phase {} → {}", scanId.getValue(), shift.oldPhase(), shift.newPhase());
        }

        for (PhaseChangeListener listener : phaseListeners) {
            try {
                listener.onPhaseChange(shift.oldPhase(), shift.newPhase());
            } catch (RuntimeException e) {
                log.warn("Phase change listener failed for scan {} ({} → {})",
                    scanId.getValue(), shift.oldPhase(), shift.newPhase(), e);
            }
        }

        if (!shift.newPhase().isTerminal()) {
            return;
        }
        for (CompletionListener listener : completionListeners) {
            try {
                listener.onCompletion(this);
            } catch (RuntimeException e) {
                log.warn("Completion listener failed for scan {}", scanId.getValue(), e);
            }
        }
    }

    private ModuleSchedule require(String name) {
        ModuleSchedule schedule = name == null ? null : modules.get(name);
        if (schedule == null) {
            throw new UnknownModuleException(name);
        }
        return schedule;
    }

    private boolean dependenciesCompleted(ModuleSchedule schedule) {
        for (String dependency : schedule.dependsOn()) {
            ModuleSchedule upstream = modules.get(dependency);
            if (upstream == null || upstream.status() != ModuleStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private double elapsedSeconds() {
        if (startedAt == null) {
            return 0.0;
        }
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    private String failureReasonOrEmpty() {
        synchronized (lock) {
            return failureReason == null ? "" : failureReason;
        }
    }

    private int moduleCount() {
        synchronized (lock) {
            return modules.size();
        }
    }

    private static List<String> names(List<ModuleSchedule> schedules) {
        return schedules.stream().map(ModuleSchedule::name).toList();
    }

    private record PhaseShift(ScanPhase oldPhase, ScanPhase newPhase) {
    }

    @Override
    public String toString() {
        return "ScanOrchestrator{" + scanId.getValue() + ", target=" + target + ", phase=" + getCurrentPhase() + '}';
    }
}
