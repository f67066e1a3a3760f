package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.Endpoint;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of in-memory queues, shared by the {@code testing} senders and receivers.
 *
 * <p>Tests use it to inject messages into an endpoint and to wait for messages sent to an endpoint.</p>
 *
 * <pre>
 * InMemoryBroker broker = InMemoryBroker.getInstance();
 * broker.reset();
 * broker.inject(Endpoint.SCANNER, Envelope.of(header, new ScannerRequest(runId)));
 * Optional&lt;Envelope&lt;?&gt;&gt; result = broker.awaitMessage(Endpoint.ORCHESTRATOR, 5_000);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryBroker {

    private static final InMemoryBroker INSTANCE = new InMemoryBroker();

    private final ConcurrentHashMap<String, InMemoryQueue> queues = new ConcurrentHashMap<>();
    private volatile InMemoryQueueConfig config = new InMemoryQueueConfig();

    private InMemoryBroker() {
    }

    public static InMemoryBroker getInstance() {
        return INSTANCE;
    }

    /**
     * Queue with the given name, created on first use.
     *
     * @param queueName queue name
     * @return queue
     */
    public InMemoryQueue queue(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be null or blank");
        }
        return queues.computeIfAbsent(queueName, name -> new InMemoryQueue(name, config));
    }

    /**
     * Drop all queues and apply the default settings.
     */
    public void reset() {
        reset(new InMemoryQueueConfig());
    }

    /**
     * Drop all queues and apply the given settings to queues created afterwards.
     *
     * @param newConfig queue settings
     */
    public void reset(InMemoryQueueConfig newConfig) {
        if (newConfig == null) {
            throw new IllegalArgumentException("newConfig cannot be null");
        }
        queues.values().forEach(InMemoryQueue::clear);
        queues.clear();
        this.config = newConfig;
    }

    /**
     * Enqueue a message on the endpoint's default queue.
     *
     * @param endpoint target endpoint
     * @param envelope message
     * @param <T> payload type
     */
    public <T extends MessagePayload> void inject(Endpoint<T> endpoint, Envelope<? extends T> envelope) {
        queue(endpoint.name()).send(envelope);
    }

    /**
     * Wait for a message on the endpoint's default queue and acknowledge it.
     *
     * @param endpoint endpoint to watch
     * @param timeoutMs maximum wait
     * @return message, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Envelope<? extends MessagePayload>> awaitMessage(Endpoint<?> endpoint, long timeoutMs)
        throws InterruptedException {
        InMemoryQueue queue = queue(endpoint.name());
        Optional<InMemoryQueue.Delivery> delivery = queue.receive(timeoutMs);
        delivery.ifPresent(received -> queue.ack(received.deliveryId()));
        return delivery.map(InMemoryQueue.Delivery::envelope);
    }
}
