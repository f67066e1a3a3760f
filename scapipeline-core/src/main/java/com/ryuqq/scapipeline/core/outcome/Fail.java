package com.ryuqq.scapipeline.core.outcome;

/**
 * 실패 결과.
 *
 * <p>해석/검증이 실패했을 때 예외 대신 반환됩니다. message는 운영자가 읽는 진단이며,
 * 여러 실패를 모아 한 번에 보고할 때 그대로 사용됩니다.</p>
 *
 * @param errorCode 오류 코드 (예: ENV-SERVICE-UNKNOWN)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param <T> 성공했을 경우의 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(
    String errorCode,
    String message,
    String cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(String errorCode, String message) {
        return new Fail<>(errorCode, message, null);
    }

    /**
     * cause 포함 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(String errorCode, String message, String cause) {
        return new Fail<>(errorCode, message, cause);
    }
}
