package com.ryuqq.scapipeline.core.contract;

/**
 * 모든 endpoint 메시지에 공통인 header.
 *
 * <p>traceId는 job request에서 대응하는 job result로 변경 없이 전파되어,
 * Orchestrator가 영속 상태를 조회하지 않고도 결과를 요청과 연결할 수 있게 합니다.</p>
 *
 * @param token 인증 토큰 (불투명 문자열, 빈 문자열 허용)
 * @param traceId trace ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MessageHeader(String token, String traceId) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException token이 null이거나 traceId가 null/빈 문자열인 경우
     */
    public MessageHeader {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "MessageHeader[traceId=" + traceId + "]";
    }
}
