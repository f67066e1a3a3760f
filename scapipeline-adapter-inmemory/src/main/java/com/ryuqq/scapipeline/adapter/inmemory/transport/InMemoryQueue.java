package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One named queue with competing consumers.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Ready:</strong> LinkedBlockingQueue&lt;QueuedMessage&gt; - messages visible to consumers</li>
 *   <li><strong>In-Flight:</strong> ConcurrentHashMap&lt;deliveryId, InFlight&gt; - received, not yet acknowledged</li>
 * </ul>
 *
 * <p>A received message is handed to exactly one consumer. It returns to the ready queue on
 * {@link #nack(String)} or when its visibility timeout expires, with the delivery count increased.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryQueue {

    private final String name;
    private final long visibilityTimeoutMs;
    private final LinkedBlockingQueue<QueuedMessage> ready = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong deliverySequence = new AtomicLong();

    InMemoryQueue(String name, InMemoryQueueConfig config) {
        this.name = name;
        this.visibilityTimeoutMs = config.visibilityTimeoutMs();
    }

    public String name() {
        return name;
    }

    /**
     * Enqueue a message.
     *
     * @param envelope message
     */
    public void send(Envelope<? extends MessagePayload> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        ready.add(new QueuedMessage(envelope, 0));
    }

    /**
     * Receive one message, waiting up to the timeout.
     *
     * <p>Expired in-flight messages are returned to the ready queue first.</p>
     *
     * @param timeoutMs maximum wait
     * @return delivery, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Delivery> receive(long timeoutMs) throws InterruptedException {
        processVisibilityTimeouts();

        QueuedMessage message = ready.poll(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
        if (message == null) {
            return Optional.empty();
        }

        String deliveryId = name + "-" + deliverySequence.incrementAndGet();
        inFlight.put(deliveryId, new InFlight(message, System.currentTimeMillis() + visibilityTimeoutMs));
        return Optional.of(new Delivery(deliveryId, message.envelope(), message.deliveryCount() > 0));
    }

    /**
     * Acknowledge a delivery. Idempotent.
     *
     * @param deliveryId delivery ID
     */
    public void ack(String deliveryId) {
        inFlight.remove(deliveryId);
    }

    /**
     * Return a delivery to the ready queue immediately.
     *
     * @param deliveryId delivery ID
     */
    public void nack(String deliveryId) {
        InFlight entry = inFlight.remove(deliveryId);
        if (entry != null) {
            ready.add(entry.message().redelivered());
        }
    }

    /**
     * Return all in-flight messages whose visibility timeout has passed.
     *
     * @return number of messages returned
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        List<String> expired = new ArrayList<>();
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAt() <= now) {
                expired.add(entry.getKey());
            }
        }

        int count = 0;
        for (String deliveryId : expired) {
            InFlight entry = inFlight.remove(deliveryId);
            if (entry != null) {
                ready.add(entry.message().redelivered());
                count++;
            }
        }
        return count;
    }

    /**
     * Expire the visibility timeout of every in-flight message. Used for testing redelivery.
     *
     * @return number of messages returned
     */
    public int expireVisibilityTimeouts() {
        int count = 0;
        for (String deliveryId : new ArrayList<>(inFlight.keySet())) {
            InFlight entry = inFlight.remove(deliveryId);
            if (entry != null) {
                ready.add(entry.message().redelivered());
                count++;
            }
        }
        return count;
    }

    public void clear() {
        ready.clear();
        inFlight.clear();
    }

    public int readySize() {
        return ready.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    /**
     * A received message.
     *
     * @param deliveryId ID to acknowledge with
     * @param envelope message
     * @param redelivered true if delivered before
     */
    public record Delivery(String deliveryId, Envelope<? extends MessagePayload> envelope, boolean redelivered) {
    }

    private record QueuedMessage(Envelope<? extends MessagePayload> envelope, int deliveryCount) {

        QueuedMessage redelivered() {
            return new QueuedMessage(envelope, deliveryCount + 1);
        }
    }

    private record InFlight(QueuedMessage message, long visibleAt) {
    }
}
