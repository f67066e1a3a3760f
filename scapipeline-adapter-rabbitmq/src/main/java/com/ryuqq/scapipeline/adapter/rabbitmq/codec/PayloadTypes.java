package com.ryuqq.scapipeline.adapter.rabbitmq.codec;

import com.ryuqq.scapipeline.core.contract.CancelRun;
import com.ryuqq.scapipeline.core.contract.CreateRun;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.MessagePayload;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of payload type discriminators used on the wire.
 *
 * <p>The discriminator is the simple name of the payload record, e.g. {@code ScannerRequest} or
 * {@code WorkerError}. The table is closed: a payload class missing here cannot be sent.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PayloadTypes {

    private static final Map<String, Class<? extends MessagePayload>> BY_NAME = buildTable();

    private PayloadTypes() {
    }

    /**
     * Payload class registered under a discriminator.
     *
     * @param type discriminator
     * @return payload class, or empty if unknown
     */
    public static Optional<Class<? extends MessagePayload>> forName(String type) {
        return Optional.ofNullable(BY_NAME.get(type));
    }

    /**
     * Discriminator of a payload.
     *
     * @param payload payload
     * @return discriminator
     * @throws IllegalArgumentException if the payload class is not registered
     */
    public static String nameOf(MessagePayload payload) {
        String name = payload.getClass().getSimpleName();
        if (BY_NAME.get(name) != payload.getClass()) {
            throw new IllegalArgumentException("Unregistered payload type: " + payload.getClass().getName());
        }
        return name;
    }

    public static Map<String, Class<? extends MessagePayload>> all() {
        return BY_NAME;
    }

    private static Map<String, Class<? extends MessagePayload>> buildTable() {
        Map<String, Class<? extends MessagePayload>> table = new LinkedHashMap<>();
        register(table, CreateRun.class);
        register(table, CancelRun.class);

        register(table, JobRequest.ConfigRequest.class);
        register(table, JobRequest.AnalyzerRequest.class);
        register(table, JobRequest.AdvisorRequest.class);
        register(table, JobRequest.ScannerRequest.class);
        register(table, JobRequest.EvaluatorRequest.class);
        register(table, JobRequest.ReporterRequest.class);
        register(table, JobRequest.NotifierRequest.class);

        register(table, JobResult.ConfigWorkerResult.class);
        register(table, JobResult.AnalyzerWorkerResult.class);
        register(table, JobResult.AdvisorWorkerResult.class);
        register(table, JobResult.ScannerWorkerResult.class);
        register(table, JobResult.EvaluatorWorkerResult.class);
        register(table, JobResult.ReporterWorkerResult.class);
        register(table, JobResult.NotifierWorkerResult.class);
        register(table, JobResult.WorkerError.class);
        return Map.copyOf(table);
    }

    private static void register(Map<String, Class<? extends MessagePayload>> table, Class<? extends MessagePayload> type) {
        if (table.putIfAbsent(type.getSimpleName(), type) != null) {
            throw new IllegalStateException("Duplicate payload type name: " + type.getSimpleName());
        }
    }
}
