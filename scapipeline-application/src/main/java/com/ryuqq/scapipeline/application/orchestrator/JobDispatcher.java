package com.ryuqq.scapipeline.application.orchestrator;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.TransportConfig;
import com.ryuqq.scapipeline.core.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 단계별 job request 전송기.
 *
 * <p>단계마다 해당 단계 endpoint에 바인딩된 {@link MessageSender}를 하나씩 보유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final Map<PipelineStage, MessageSender<JobRequest>> senders;

    /**
     * 생성자.
     *
     * @param senders 단계 → sender
     * @throws IllegalArgumentException senders가 null인 경우
     */
    public JobDispatcher(Map<PipelineStage, MessageSender<JobRequest>> senders) {
        if (senders == null) {
            throw new IllegalArgumentException("senders cannot be null");
        }
        this.senders = senders.isEmpty() ? Map.of() : new EnumMap<>(senders);
    }

    /**
     * 환경 변수에 전송 설정이 있는 모든 단계에 대해 sender 생성.
     *
     * <p>{@code {STAGE}_SENDER_TRANSPORT_TYPE}이 없는 단계는 건너뜁니다.
     * 그런 단계로 dispatch하면 {@link IllegalStateException}이 발생합니다.</p>
     *
     * @param registry transport registry
     * @param environment 환경 변수
     * @return JobDispatcher
     */
    public static JobDispatcher fromEnvironment(TransportRegistry registry, Map<String, String> environment) {
        Map<PipelineStage, MessageSender<JobRequest>> senders = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            Endpoint<JobRequest> endpoint = Endpoint.forStage(stage);
            if (environment.containsKey(endpoint.configPrefix() + "_SENDER_" + TransportConfig.TYPE)) {
                senders.put(stage, registry.createSender(endpoint, environment));
            }
        }
        log.info("Configured job senders for stages {}", senders.keySet());
        return new JobDispatcher(senders);
    }

    /**
     * Job request 전송.
     *
     * @param header 메시지 header (Run의 traceId 포함)
     * @param request 전송할 요청
     * @throws IllegalStateException 요청 단계에 sender가 없는 경우
     * @throws com.ryuqq.scapipeline.core.transport.TransportException 전송 실패 시
     */
    public void dispatch(MessageHeader header, JobRequest request) {
        MessageSender<JobRequest> sender = senders.get(request.stage());
        if (sender == null) {
            throw new IllegalStateException("No sender configured for stage " + request.stage());
        }
        sender.send(Envelope.of(header, request));
        log.info("Dispatched {} request for run {} (traceId={})", request.stage(), request.runId(), header.traceId());
    }

    @Override
    public void close() {
        senders.values().forEach(MessageSender::close);
    }
}
