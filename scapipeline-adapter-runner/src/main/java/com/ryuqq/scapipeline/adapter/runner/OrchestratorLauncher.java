package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.application.orchestrator.JobDispatcher;
import com.ryuqq.scapipeline.application.orchestrator.Orchestrator;
import com.ryuqq.scapipeline.application.orchestrator.OrchestratorConfig;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.spi.RunRepository;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds and runs the orchestrator process from environment variables.
 *
 * <p>Reads {@code ORCHESTRATOR_RECEIVER_TRANSPORT_*}, {@code {STAGE}_SENDER_TRANSPORT_*} for every
 * dispatched stage and the {@link OrchestratorEndpointConfig} variables.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorLauncher {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLauncher.class);

    private OrchestratorLauncher() {
    }

    /**
     * Running orchestrator process: the endpoint runner and the dispatcher it sends through.
     *
     * @param orchestrator state machine
     * @param runner endpoint runner
     * @param dispatcher job dispatcher
     */
    public record OrchestratorProcess(
        Orchestrator orchestrator,
        OrchestratorEndpointRunner runner,
        JobDispatcher dispatcher
    ) implements AutoCloseable {

        @Override
        public void close() {
            try {
                runner.close();
            } finally {
                dispatcher.close();
            }
        }
    }

    /**
     * Build the orchestrator and its endpoint runner.
     *
     * @param runRepository run storage
     * @param orchestratorConfig state machine settings
     * @param registry transport registry
     * @param environment environment variables
     * @return process handle owning all transports
     */
    public static OrchestratorProcess create(
        RunRepository runRepository,
        OrchestratorConfig orchestratorConfig,
        TransportRegistry registry,
        Map<String, String> environment
    ) {
        JobDispatcher dispatcher = JobDispatcher.fromEnvironment(registry, environment);
        try {
            Orchestrator orchestrator = new Orchestrator(runRepository, dispatcher, orchestratorConfig);
            MessageReceiver<OrchestratorMessage> receiver = registry.createReceiver(Endpoint.ORCHESTRATOR, environment);
            OrchestratorEndpointConfig config = OrchestratorEndpointConfig.fromEnvironment(environment);
            log.info("Orchestrator configured ({})", config);
            return new OrchestratorProcess(orchestrator, new OrchestratorEndpointRunner(receiver, orchestrator, config), dispatcher);
        } catch (RuntimeException e) {
            dispatcher.close();
            throw e;
        }
    }

    /**
     * Build the orchestrator and process messages until the JVM shuts down.
     *
     * @param runRepository run storage
     * @param orchestratorConfig state machine settings
     * @param registry transport registry
     * @param environment environment variables
     */
    public static void launch(
        RunRepository runRepository,
        OrchestratorConfig orchestratorConfig,
        TransportRegistry registry,
        Map<String, String> environment
    ) {
        try (OrchestratorProcess process = create(runRepository, orchestratorConfig, registry, environment)) {
            Runtime.getRuntime().addShutdownHook(new Thread(process.runner()::stop, "orchestrator-shutdown"));
            process.runner().run();
        }
    }
}
