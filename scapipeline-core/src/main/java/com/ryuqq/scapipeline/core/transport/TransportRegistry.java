package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Immutable table of available transport implementations.
 *
 * <p>Built once at process start, usually from {@link ServiceLoader} registrations, and passed to the
 * components that open endpoints. Selecting a transport by type name swaps the broker technology
 * without code changes.</p>
 *
 * <pre>
 * TransportRegistry registry = TransportRegistry.load();
 * MessageReceiver&lt;JobRequest&gt; receiver = registry.createReceiver(Endpoint.SCANNER, System.getenv());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransportRegistry {

    private final Map<String, MessageSenderFactory> senderFactories;
    private final Map<String, MessageReceiverFactory> receiverFactories;

    private TransportRegistry(
        Map<String, MessageSenderFactory> senderFactories,
        Map<String, MessageReceiverFactory> receiverFactories
    ) {
        this.senderFactories = Map.copyOf(senderFactories);
        this.receiverFactories = Map.copyOf(receiverFactories);
    }

    /**
     * Builds a registry from all factories registered on the class path.
     *
     * @return the registry
     * @throws IllegalStateException if two factories share a type name
     */
    public static TransportRegistry load() {
        List<MessageSenderFactory> senders = new ArrayList<>();
        ServiceLoader.load(MessageSenderFactory.class).forEach(senders::add);
        List<MessageReceiverFactory> receivers = new ArrayList<>();
        ServiceLoader.load(MessageReceiverFactory.class).forEach(receivers::add);
        return of(senders, receivers);
    }

    /**
     * Builds a registry from explicit factories.
     *
     * @param senders sender factories
     * @param receivers receiver factories
     * @return the registry
     * @throws IllegalStateException if two factories of the same kind share a type name
     */
    public static TransportRegistry of(List<MessageSenderFactory> senders, List<MessageReceiverFactory> receivers) {
        Map<String, MessageSenderFactory> senderMap = new TreeMap<>();
        for (MessageSenderFactory factory : senders) {
            if (senderMap.putIfAbsent(factory.name(), factory) != null) {
                throw new IllegalStateException("Duplicate sender transport: " + factory.name());
            }
        }
        Map<String, MessageReceiverFactory> receiverMap = new TreeMap<>();
        for (MessageReceiverFactory factory : receivers) {
            if (receiverMap.putIfAbsent(factory.name(), factory) != null) {
                throw new IllegalStateException("Duplicate receiver transport: " + factory.name());
            }
        }
        return new TransportRegistry(senderMap, receiverMap);
    }

    /**
     * Creates a sender for an endpoint.
     *
     * @param endpoint the target endpoint
     * @param config transport configuration
     * @param <T> payload type
     * @return a new sender
     * @throws IllegalArgumentException if no transport with the configured type is registered
     */
    public <T extends MessagePayload> MessageSender<T> createSender(Endpoint<T> endpoint, TransportConfig config) {
        MessageSenderFactory factory = senderFactories.get(config.type());
        if (factory == null) {
            throw new IllegalArgumentException(
                "Unknown sender transport '" + config.type() + "'. Available: " + senderFactories.keySet()
            );
        }
        return factory.createSender(endpoint, config);
    }

    /**
     * Creates a sender for an endpoint configured through environment variables.
     *
     * @param endpoint the target endpoint
     * @param environment variable map
     * @param <T> payload type
     * @return a new sender
     */
    public <T extends MessagePayload> MessageSender<T> createSender(Endpoint<T> endpoint, Map<String, String> environment) {
        return createSender(endpoint, TransportConfig.fromEnvironment(endpoint, TransportDirection.SENDER, environment));
    }

    /**
     * Creates a receiver for an endpoint.
     *
     * @param endpoint the source endpoint
     * @param config transport configuration
     * @param <T> payload type
     * @return a new receiver
     * @throws IllegalArgumentException if no transport with the configured type is registered
     */
    public <T extends MessagePayload> MessageReceiver<T> createReceiver(Endpoint<T> endpoint, TransportConfig config) {
        MessageReceiverFactory factory = receiverFactories.get(config.type());
        if (factory == null) {
            throw new IllegalArgumentException(
                "Unknown receiver transport '" + config.type() + "'. Available: " + receiverFactories.keySet()
            );
        }
        return factory.createReceiver(endpoint, config);
    }

    /**
     * Creates a receiver for an endpoint configured through environment variables.
     *
     * @param endpoint the source endpoint
     * @param environment variable map
     * @param <T> payload type
     * @return a new receiver
     */
    public <T extends MessagePayload> MessageReceiver<T> createReceiver(Endpoint<T> endpoint, Map<String, String> environment) {
        return createReceiver(endpoint, TransportConfig.fromEnvironment(endpoint, TransportDirection.RECEIVER, environment));
    }

    /**
     * Returns the registered sender transport type names.
     *
     * @return type names, sorted
     */
    public List<String> senderTypes() {
        return List.copyOf(new TreeMap<>(senderFactories).keySet());
    }

    /**
     * Returns the registered receiver transport type names.
     *
     * @return type names, sorted
     */
    public List<String> receiverTypes() {
        return List.copyOf(new TreeMap<>(receiverFactories).keySet());
    }
}
