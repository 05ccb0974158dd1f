package com.ryuqq.recon.core.schedule;

import com.ryuqq.recon.core.phase.ScanPhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 모듈 하나의 스케줄링 기록 (불변).
 *
 * <p>상태 변경은 새 인스턴스를 반환하므로, 오케스트레이터 밖으로 노출되어도
 * 내부 레지스트리가 외부에서 변경될 수 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>dependsOn에 자기 자신(name)이 포함될 수 없음</li>
 *   <li>eventsProduced는 음수가 될 수 없음</li>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 더 이상 상태 변경 불가</li>
 * </ul>
 *
 * @param name 모듈 이름 (오케스트레이터 내 고유 키)
 * @param phase 배정된 단계
 * @param priority 우선순위 (클수록 먼저 스케줄링)
 * @param dependsOn 먼저 완료되어야 하는 모듈 이름 집합
 * @param status 실행 상태
 * @param eventsProduced 완료 시 보고된 이벤트 수
 * @param lastError 마지막 오류 메시지 (null 가능)
 * @param sequence 등록 순서 (동일 우선순위 정렬 기준)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModuleSchedule(
    String name,
    ScanPhase phase,
    int priority,
    Set<String> dependsOn,
    ModuleStatus status,
    long eventsProduced,
    String lastError,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값 누락, 자기 의존, 음수 이벤트 수인 경우
     */
    public ModuleSchedule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (eventsProduced < 0) {
            throw new IllegalArgumentException("eventsProduced cannot be negative (current: " + eventsProduced + ")");
        }
        dependsOn = dependsOn == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        if (dependsOn.contains(name)) {
            throw new IllegalArgumentException("Module " + name + " cannot depend on itself");
        }
    }

    /**
     * 새로 등록된 PENDING 스케줄 생성.
     *
     * @param name 모듈 이름
     * @param phase 배정 단계
     * @param priority 우선순위
     * @param dependsOn 의존 모듈 이름 집합 (null이면 빈 집합)
     * @param sequence 등록 순서
     * @return PENDING 상태의 ModuleSchedule
     */
    public static ModuleSchedule pending(String name, ScanPhase phase, int priority,
                                         Set<String> dependsOn, long sequence) {
        return new ModuleSchedule(name, phase, priority, dependsOn, ModuleStatus.PENDING, 0, null, sequence);
    }

    /**
     * PENDING → RUNNING.
     *
     * @return RUNNING 상태의 새 인스턴스
     * @throws IllegalStateException PENDING이 아닌 경우
     */
    public ModuleSchedule started() {
        if (status != ModuleStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Module %s cannot start from status %s", name, status.value())
            );
        }
        return new ModuleSchedule(name, phase, priority, dependsOn, ModuleStatus.RUNNING, eventsProduced, lastError, sequence);
    }

    /**
     * → COMPLETED.
     *
     * @param events 생성한 이벤트 수
     * @return COMPLETED 상태의 새 인스턴스
     * @throws IllegalArgumentException events가 음수인 경우
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ModuleSchedule completed(long events) {
        if (events < 0) {
            throw new IllegalArgumentException("events cannot be negative (current: " + events + ")");
        }
        requireNotTerminal("complete");
        return new ModuleSchedule(name, phase, priority, dependsOn, ModuleStatus.COMPLETED, events, lastError, sequence);
    }

    /**
     * → FAILED.
     *
     * @param error 오류 메시지
     * @return FAILED 상태의 새 인스턴스
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ModuleSchedule failed(String error) {
        requireNotTerminal("fail");
        return new ModuleSchedule(name, phase, priority, dependsOn, ModuleStatus.FAILED, eventsProduced, error, sequence);
    }

    /**
     * 재등록 시 기존 등록 순서를 유지한 채 새 설정으로 교체.
     *
     * @param replacement 새 스케줄
     * @return sequence만 기존 값으로 유지한 새 인스턴스
     */
    public ModuleSchedule replacedBy(ModuleSchedule replacement) {
        return new ModuleSchedule(replacement.name, replacement.phase, replacement.priority,
            replacement.dependsOn, replacement.status, replacement.eventsProduced, replacement.lastError, sequence);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("phase", phase.name());
        map.put("priority", priority);
        map.put("depends_on", new ArrayList<>(dependsOn));
        map.put("status", status.value());
        map.put("events_produced", eventsProduced);
        map.put("last_error", lastError);
        return map;
    }

    private void requireNotTerminal(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("Module %s cannot %s from terminal status %s", name, action, status.value())
            );
        }
    }
}
