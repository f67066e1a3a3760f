package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.PipelineStage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A logical, named message destination.
 *
 * <p>Each pipeline stage has one endpoint receiving {@link JobRequest} payloads; the orchestrator
 * has one endpoint receiving {@link OrchestratorMessage} payloads. The {@code configPrefix} is the
 * prefix of the environment variables configuring the transport for this endpoint
 * (see {@link TransportConfig#fromEnvironment}).</p>
 *
 * @param name logical endpoint name, also the default queue name
 * @param configPrefix environment variable prefix
 * @param payloadType payload type accepted by this endpoint
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Endpoint<T extends MessagePayload>(
    String name,
    String configPrefix,
    Class<T> payloadType
) {

    public static final Endpoint<OrchestratorMessage> ORCHESTRATOR =
        new Endpoint<>("orchestrator", "ORCHESTRATOR", OrchestratorMessage.class);

    public static final Endpoint<JobRequest> CONFIG = forStageInternal(PipelineStage.CONFIG);
    public static final Endpoint<JobRequest> ANALYZER = forStageInternal(PipelineStage.ANALYZER);
    public static final Endpoint<JobRequest> ADVISOR = forStageInternal(PipelineStage.ADVISOR);
    public static final Endpoint<JobRequest> SCANNER = forStageInternal(PipelineStage.SCANNER);
    public static final Endpoint<JobRequest> EVALUATOR = forStageInternal(PipelineStage.EVALUATOR);
    public static final Endpoint<JobRequest> REPORTER = forStageInternal(PipelineStage.REPORTER);
    public static final Endpoint<JobRequest> NOTIFIER = forStageInternal(PipelineStage.NOTIFIER);

    private static final Map<PipelineStage, Endpoint<JobRequest>> STAGE_ENDPOINTS = indexByStage();

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if any field is null or blank
     */
    public Endpoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (configPrefix == null || configPrefix.isBlank()) {
            throw new IllegalArgumentException("configPrefix cannot be null or blank");
        }
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType cannot be null");
        }
    }

    /**
     * Returns the endpoint receiving job requests for the given stage.
     *
     * @param stage the pipeline stage
     * @return the stage endpoint
     * @throws IllegalArgumentException if stage is null
     */
    public static Endpoint<JobRequest> forStage(PipelineStage stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return STAGE_ENDPOINTS.get(stage);
    }

    /**
     * Returns all stage endpoints in pipeline order.
     *
     * @return stage endpoints
     */
    public static List<Endpoint<JobRequest>> stageEndpoints() {
        return List.of(CONFIG, ANALYZER, ADVISOR, SCANNER, EVALUATOR, REPORTER, NOTIFIER);
    }

    private static Endpoint<JobRequest> forStageInternal(PipelineStage stage) {
        return new Endpoint<>(stage.endpointName(), stage.name(), JobRequest.class);
    }

    private static Map<PipelineStage, Endpoint<JobRequest>> indexByStage() {
        Map<PipelineStage, Endpoint<JobRequest>> map = new EnumMap<>(PipelineStage.class);
        for (Endpoint<JobRequest> endpoint : stageEndpoints()) {
            map.put(PipelineStage.valueOf(endpoint.configPrefix()), endpoint);
        }
        return map;
    }
}
