package com.ryuqq.recon.core.model;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Scan의 고유 식별자.
 *
 * <p>ScanId는 하나의 스캔에 속한 {@code ScanStateMachine}과 {@code ScanOrchestrator}를
 * 묶는 키이며, 관찰자 콜백과 상태 스냅샷에 그대로 노출됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 마침표(.)만 허용 (대상 도메인을 포함한 ID 허용)</li>
 * </ul>
 *
 * <p><strong>발급:</strong> {@link #generate()}는 기존 스캔 저장소와 같은 형식인
 * 8자리 대문자 16진수 ID(예: {@code 3F2A9C01})를 발급합니다. 32비트 값이므로
 * 충돌 여부는 저장소 등록 시점에 확인해야 합니다 (예: {@code InMemoryScanRegistry.create}).</p>
 *
 * <p>정렬 가능하며({@link Comparable}), 스캔 목록은 ID 사전순으로 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScanId implements Comparable<ScanId> {

    private static final int MAX_LENGTH = 255;
    private static final int GENERATED_LENGTH = 8;
    private static final Pattern ALLOWED = Pattern.compile("[a-zA-Z0-9\\-_.]+");

    private final String value;

    private ScanId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ScanId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ScanId cannot exceed " + MAX_LENGTH + " characters (length: " + value.length() + ")");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException("ScanId has invalid characters (allowed: letters, digits, '-', '_', '.'): " + value);
        }
        this.value = value;
    }

    /**
     * ScanId 생성.
     *
     * @param value ScanId 값
     * @return ScanId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ScanId of(String value) {
        return new ScanId(value);
    }

    /**
     * 새 스캔 ID 발급 (8자리 대문자 16진수).
     *
     * @return 새 ScanId
     */
    public static ScanId generate() {
        String hex = UUID.randomUUID().toString().substring(0, GENERATED_LENGTH);
        return new ScanId(hex.toUpperCase(Locale.ROOT));
    }

    /**
     * ScanId 값 조회.
     *
     * @return ScanId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ScanId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScanId scanId = (ScanId) o;
        return value.equals(scanId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ScanId{" + value + '}';
    }
}
