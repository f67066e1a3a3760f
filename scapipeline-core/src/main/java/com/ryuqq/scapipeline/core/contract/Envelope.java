package com.ryuqq.scapipeline.core.contract;

/**
 * Endpoint 메시지 봉투 (header + typed payload).
 *
 * <p><strong>Wire 형태:</strong></p>
 * <pre>
 * { "header": { "token": "...", "traceId": "..." }, "payload": { ... } }
 * </pre>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Envelope&lt;JobRequest&gt; request = Envelope.of(header, new JobRequest.ScannerRequest(runId));
 *
 * // 결과는 요청 header를 그대로 사용
 * Envelope&lt;OrchestratorMessage&gt; result = request.reply(new JobResult.ScannerWorkerResult(runId, List.of()));
 * </pre>
 *
 * @param header 메시지 header
 * @param payload 메시지 payload
 * @param <T> payload 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Envelope<T extends MessagePayload>(
    MessageHeader header,
    T payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException header 또는 payload가 null인 경우
     */
    public Envelope {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * Envelope 생성.
     *
     * @param header header
     * @param payload payload
     * @param <T> payload 타입
     * @return Envelope
     */
    public static <T extends MessagePayload> Envelope<T> of(MessageHeader header, T payload) {
        return new Envelope<>(header, payload);
    }

    /**
     * 같은 header로 응답 Envelope 생성.
     *
     * @param replyPayload 응답 payload
     * @param <R> 응답 payload 타입
     * @return header를 공유하는 Envelope
     */
    public <R extends MessagePayload> Envelope<R> reply(R replyPayload) {
        return new Envelope<>(header, replyPayload);
    }
}
