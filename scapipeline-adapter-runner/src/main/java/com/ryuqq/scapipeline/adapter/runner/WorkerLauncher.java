package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.TransportRegistry;
import com.ryuqq.scapipeline.worker.context.WorkerContextFactory;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds and runs a worker process for one stage from environment variables.
 *
 * <p>Reads {@code {STAGE}_RECEIVER_TRANSPORT_*}, {@code ORCHESTRATOR_SENDER_TRANSPORT_*} and the
 * {@link WorkerEndpointConfig} variables.</p>
 *
 * <pre>
 * WorkerLauncher.launch(PipelineStage.ANALYZER, analyzerWorker, contextFactory,
 *     TransportRegistry.load(), System.getenv());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(WorkerLauncher.class);

    private WorkerLauncher() {
    }

    /**
     * Build a runner bound to the stage endpoint.
     *
     * @param stage stage served by this worker
     * @param handler stage handler
     * @param contextFactory context factory
     * @param registry transport registry
     * @param environment environment variables
     * @param <T> request type
     * @return runner owning its receiver and sender
     * @throws IllegalArgumentException if the handler does not accept the stage's requests or the
     *     transport configuration is missing
     */
    public static <T extends JobRequest> WorkerEndpointRunner<T> create(
        PipelineStage stage,
        StageHandler<T> handler,
        WorkerContextFactory contextFactory,
        TransportRegistry registry,
        Map<String, String> environment
    ) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (!handler.requestType().isInstance(JobRequest.forStage(stage, 0L))) {
            throw new IllegalArgumentException(
                "Handler for " + handler.requestType().getSimpleName() + " cannot serve stage " + stage
            );
        }

        WorkerEndpointConfig config = WorkerEndpointConfig.fromEnvironment(environment);
        MessageReceiver<JobRequest> receiver = registry.createReceiver(Endpoint.forStage(stage), environment);
        MessageSender<OrchestratorMessage> sender;
        try {
            sender = registry.createSender(Endpoint.ORCHESTRATOR, environment);
        } catch (RuntimeException e) {
            receiver.close();
            throw e;
        }
        log.info("Worker for stage {} configured ({})", stage, config);
        return new WorkerEndpointRunner<>(receiver, sender, contextFactory, handler, config);
    }

    /**
     * Build a runner, run it in the configured mode and release its transports.
     *
     * @param stage stage served by this worker
     * @param handler stage handler
     * @param contextFactory context factory
     * @param registry transport registry
     * @param environment environment variables
     * @param <T> request type
     */
    public static <T extends JobRequest> void launch(
        PipelineStage stage,
        StageHandler<T> handler,
        WorkerContextFactory contextFactory,
        TransportRegistry registry,
        Map<String, String> environment
    ) {
        try (WorkerEndpointRunner<T> runner = create(stage, handler, contextFactory, registry, environment)) {
            Thread shutdownHook = new Thread(runner::stop, "worker-" + stage.endpointName() + "-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            runner.run();
        }
    }
}
