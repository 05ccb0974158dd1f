package com.ryuqq.recon.core.phase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 오케스트레이터가 순서대로 거치는 단계 목록 (불변).
 *
 * <p><strong>유효성 규칙:</strong></p>
 * <ul>
 *   <li>첫 단계는 INIT, 마지막 단계는 COMPLETE</li>
 *   <li>FAILED는 포함 불가 (어느 단계에서든 {@code fail()}로만 도달)</li>
 *   <li>중복 불가, {@link ScanPhase} 선언 순서를 따라야 함 (생략은 가능, 재배치는 불가)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PhaseSequence all = PhaseSequence.defaults();
 * PhaseSequence quick = PhaseSequence.of(INIT, DISCOVERY, REPORTING, COMPLETE);
 * quick.next(DISCOVERY); // REPORTING
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseSequence {

    private static final PhaseSequence DEFAULTS = of(
        ScanPhase.INIT,
        ScanPhase.DISCOVERY,
        ScanPhase.ENUMERATION,
        ScanPhase.ANALYSIS,
        ScanPhase.CORRELATION,
        ScanPhase.REPORTING,
        ScanPhase.COMPLETE
    );

    private final List<ScanPhase> phases;

    private PhaseSequence(List<ScanPhase> phases) {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("phases cannot be null or empty");
        }
        if (phases.get(0) != ScanPhase.INIT) {
            throw new IllegalArgumentException("PhaseSequence must start with INIT (current: " + phases + ")");
        }
        if (phases.get(phases.size() - 1) != ScanPhase.COMPLETE) {
            throw new IllegalArgumentException("PhaseSequence must end with COMPLETE (current: " + phases + ")");
        }

        ScanPhase previous = null;
        for (ScanPhase phase : phases) {
            if (phase == null) {
                throw new IllegalArgumentException("PhaseSequence cannot contain null (current: " + phases + ")");
            }
            if (phase == ScanPhase.FAILED) {
                throw new IllegalArgumentException("PhaseSequence cannot contain FAILED (current: " + phases + ")");
            }
            if (previous != null && phase.ordinal() <= previous.ordinal()) {
                throw new IllegalArgumentException(
                    "PhaseSequence must be strictly ordered without duplicates (current: " + phases + ")"
                );
            }
            previous = phase;
        }
        this.phases = List.copyOf(phases);
    }

    /**
     * 전체 단계 목록 (INIT ~ COMPLETE).
     *
     * @return 기본 PhaseSequence
     */
    public static PhaseSequence defaults() {
        return DEFAULTS;
    }

    /**
     * PhaseSequence 생성.
     *
     * @param phases 순서대로 나열한 단계
     * @return PhaseSequence 인스턴스
     * @throws IllegalArgumentException 유효성 규칙 위반 시
     */
    public static PhaseSequence of(ScanPhase... phases) {
        if (phases == null) {
            throw new IllegalArgumentException("phases cannot be null");
        }
        return new PhaseSequence(Arrays.asList(phases));
    }

    /**
     * PhaseSequence 생성.
     *
     * @param phases 순서대로 나열한 단계
     * @return PhaseSequence 인스턴스
     * @throws IllegalArgumentException 유효성 규칙 위반 시
     */
    public static PhaseSequence of(List<ScanPhase> phases) {
        if (phases == null) {
            throw new IllegalArgumentException("phases cannot be null");
        }
        return new PhaseSequence(new ArrayList<>(phases));
    }

    /**
     * 다음 단계 조회.
     *
     * <p>종료 단계(COMPLETE, FAILED)에서는 자기 자신을 반환합니다 (역행 없음).</p>
     *
     * @param current 현재 단계
     * @return 다음 단계
     * @throws IllegalArgumentException current가 이 목록에 없는 비종료 단계인 경우
     */
    public ScanPhase next(ScanPhase current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        if (current.isTerminal()) {
            return current;
        }
        int index = phases.indexOf(current);
        if (index < 0) {
            throw new IllegalArgumentException("Phase " + current + " is not part of " + phases);
        }
        return phases.get(index + 1);
    }

    /**
     * 단계 포함 여부.
     *
     * @param phase 단계
     * @return 포함되어 있으면 true
     */
    public boolean contains(ScanPhase phase) {
        return phase != null && phases.contains(phase);
    }

    /**
     * 단계 목록 조회.
     *
     * @return 불변 단계 목록
     */
    public List<ScanPhase> phases() {
        return phases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return phases.equals(((PhaseSequence) o).phases);
    }

    @Override
    public int hashCode() {
        return phases.hashCode();
    }

    @Override
    public String toString() {
        return "PhaseSequence" + phases;
    }
}
