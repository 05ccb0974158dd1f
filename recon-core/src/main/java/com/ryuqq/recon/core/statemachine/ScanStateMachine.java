package com.ryuqq.recon.core.statemachine;

import com.ryuqq.recon.core.model.ScanId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 단일 Scan의 생명주기 상태 머신.
 *
 * <p>현재 상태를 보관하고, {@link TransitionTable}에 따라 전이를 검증하며,
 * 성공한 전이를 이력에 추가하고 관찰자에게 통지합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>현재 상태 == 이력 마지막 항목의 toState (이력이 비어 있으면 초기 상태)</li>
 *   <li>실패한 {@link #transition(ScanState, String)} 호출은 상태와 이력을 변경하지 않음</li>
 *   <li>이력은 추가만 가능 (삽입 순서 = 시간 순서)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 인스턴스당 하나의 락으로 모든 변경을 직렬화합니다.
 * 관찰자는 락 해제 후 호출 스레드에서 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScanStateMachine machine = new ScanStateMachine(ScanId.of("scan-001"));
 * machine.onTransition((from, to, id) -&gt; log.info("{}: {} → {}", id, from, to));
 *
 * machine.transition(ScanState.QUEUED);
 * machine.transition(ScanState.STARTING);
 * machine.transition(ScanState.RUNNING, "All modules loaded");
 *
 * // InvalidTransitionException
 * machine.transition(ScanState.QUEUED);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ScanStateMachine.class);

    private final ScanId scanId;
    private final ScanState initialState;
    private final Clock clock;
    private final Instant createdAt;
    private final Object lock = new Object();
    private final List<StateTransition> history = new ArrayList<>();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    private ScanState state;

    /**
     * CREATED 상태로 생성.
     *
     * @param scanId Scan ID
     * @throws IllegalArgumentException scanId가 null인 경우
     */
    public ScanStateMachine(ScanId scanId) {
        this(scanId, ScanState.CREATED);
    }

    /**
     * 지정한 초기 상태로 생성.
     *
     * <p>저장소에서 복원하는 경우처럼 CREATED가 아닌 상태에서 시작할 때 사용합니다.</p>
     *
     * @param scanId Scan ID
     * @param initialState 초기 상태
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ScanStateMachine(ScanId scanId, ScanState initialState) {
        this(scanId, initialState, Clock.systemUTC());
    }

    /**
     * 시계를 주입하여 생성 (테스트용).
     *
     * @param scanId Scan ID
     * @param initialState 초기 상태
     * @param clock 전이 시각 및 경과 시간 계산에 사용할 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ScanStateMachine(ScanId scanId, ScanState initialState, Clock clock) {
        if (scanId == null) {
            throw new IllegalArgumentException("scanId cannot be null");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.scanId = scanId;
        this.initialState = initialState;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.state = initialState;
    }

    /**
     * 사유 없이 상태 전이.
     *
     * @param toState 전이할 상태
     * @return 새 상태
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public ScanState transition(ScanState toState) {
        return transition(toState, "");
    }

    /**
     * 상태 전이.
     *
     * <p>검증과 변경은 락 안에서 원자적으로 수행되고, 관찰자 통지는 락 해제 후 수행됩니다.</p>
     *
     * @param toState 전이할 상태
     * @param reason 전이 사유 (null이면 빈 문자열)
     * @return 새 상태
     * @throws IllegalArgumentException toState가 null인 경우
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우 (상태와 이력 변경 없음)
     */
    public ScanState transition(ScanState toState, String reason) {
        if (toState == null) {
            throw new IllegalArgumentException("toState cannot be null");
        }

        StateTransition record;
        synchronized (lock) {
            TransitionTable.validate(state, toState);
            record = new StateTransition(state, toState, clock.instant(), reason);
            history.add(record);
            state = toState;
        }

        log.debug("Scan {} transitioned {} → {} ({})",
            scanId.getValue(), record.fromState(), record.toState(), record.reason());
        notifyListeners(record.fromState(), record.toState());
        return record.toState();
    }

    /**
     * 현재 상태에서 전이 가능한지 확인 (부수 효과 없음).
     *
     * @param toState 전이할 상태
     * @return 허용된 전이면 true
     */
    public boolean canTransition(ScanState toState) {
        if (toState == null) {
            return false;
        }
        return TransitionTable.isAllowed(getState(), toState);
    }

    /**
     * 특정 상태에 머문 누적 시간.
     *
     * <p>이력을 순회하며 해당 상태에 진입한 시각부터 다음 전이 시각까지의 구간을 합산합니다.
     * 현재 머무르는 상태라면 마지막 구간의 끝은 현재 시각입니다.</p>
     *
     * @param target 조회할 상태
     * @return 누적 체류 시간 (머문 적이 없으면 {@link Duration#ZERO})
     */
    public Duration getTimeInState(ScanState target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }

        synchronized (lock) {
            Duration total = Duration.ZERO;
            ScanState occupied = initialState;
            Instant enteredAt = createdAt;

            for (StateTransition transition : history) {
                if (occupied == target) {
                    total = total.plus(Duration.between(enteredAt, transition.timestamp()));
                }
                occupied = transition.toState();
                enteredAt = transition.timestamp();
            }

            if (occupied == target) {
                total = total.plus(Duration.between(enteredAt, clock.instant()));
            }
            return total;
        }
    }

    /**
     * 생성 이후 경과 시간.
     *
     * @return 경과 시간
     */
    public Duration getDuration() {
        return Duration.between(createdAt, clock.instant());
    }

    /**
     * 전이 관찰자 등록.
     *
     * @param listener 관찰자
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onTransition(TransitionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * 전이 관찰자 해제.
     *
     * @param listener 관찰자
     * @return 등록되어 있었으면 true
     */
    public boolean removeTransitionListener(TransitionListener listener) {
        return listeners.remove(listener);
    }

    public ScanId getScanId() {
        return scanId;
    }

    public ScanState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isTerminal() {
        return getState().isTerminal();
    }

    public boolean isActive() {
        return getState().isActive();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * 전이 이력 조회.
     *
     * @return 시간 순 이력의 불변 복사본
     */
    public List<StateTransition> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    /**
     * 상태 API 응답용 스냅샷.
     *
     * @return scan_id, state, is_terminal, is_active, created_at, duration_ms, transitions, history 키를 가진 Map
     */
    public Map<String, Object> toMap() {
        ScanState current;
        List<StateTransition> snapshot;
        synchronized (lock) {
            current = state;
            snapshot = List.copyOf(history);
        }

        List<Map<String, Object>> entries = new ArrayList<>(snapshot.size());
        for (StateTransition transition : snapshot) {
            entries.add(transition.toMap());
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scan_id", scanId.getValue());
        map.put("state", current.name());
        map.put("is_terminal", current.isTerminal());
        map.put("is_active", current.isActive());
        map.put("created_at", createdAt.toEpochMilli());
        map.put("duration_ms", getDuration().toMillis());
        map.put("transitions", snapshot.size());
        map.put("history", entries);
        return map;
    }

    private void notifyListeners(ScanState oldState, ScanState newState) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(oldState, newState, scanId);
            } catch (RuntimeException e) {
                log.warn("Transition listener failed for scan {} ({} → {})",
                    scanId.getValue(), oldState, newState, e);
            }
        }
    }

    @Override
    public String toString() {
        return "ScanStateMachine{" + scanId.getValue() + ", state=" + getState() + '}';
    }
}
