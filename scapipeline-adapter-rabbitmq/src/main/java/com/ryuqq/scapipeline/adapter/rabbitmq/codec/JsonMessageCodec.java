package com.ryuqq.scapipeline.adapter.rabbitmq.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.MessagePayload;

import java.io.IOException;

/**
 * JSON wire codec for envelopes.
 *
 * <p><strong>Wire shape:</strong></p>
 * <pre>
 * {
 *   "header":  { "token": "...", "traceId": "..." },
 *   "payload": { "type": "ScannerRequest", "runId": 42 }
 * }
 * </pre>
 *
 * <p>The {@code type} discriminator comes from {@link PayloadTypes}. Unknown properties are rejected.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonMessageCodec {

    static final String HEADER = "header";
    static final String PAYLOAD = "payload";
    static final String TYPE = "type";

    private final ObjectMapper objectMapper;

    public JsonMessageCodec() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Encode an envelope.
     *
     * @param envelope envelope
     * @return UTF-8 JSON
     * @throws MessageCodecException if the payload type is unregistered or serialization fails
     */
    public byte[] encode(Envelope<? extends MessagePayload> envelope) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode header = root.putObject(HEADER);
            header.put("token", envelope.header().token());
            header.put("traceId", envelope.header().traceId());

            ObjectNode payload = root.putObject(PAYLOAD);
            payload.put(TYPE, PayloadTypes.nameOf(envelope.payload()));
            payload.setAll((ObjectNode) objectMapper.valueToTree(envelope.payload()));
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageCodecException("Cannot encode " + envelope.payload().getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode an envelope.
     *
     * @param body UTF-8 JSON
     * @return envelope with the payload type named by the discriminator
     * @throws MessageCodecException if the body is malformed or the discriminator is unknown
     */
    public Envelope<MessagePayload> decode(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.hasNonNull(HEADER) || !root.hasNonNull(PAYLOAD)) {
                throw new MessageCodecException("Message must contain 'header' and 'payload'");
            }

            JsonNode headerNode = root.get(HEADER);
            MessageHeader header = new MessageHeader(
                headerNode.path("token").asText(""),
                headerNode.path("traceId").asText(null)
            );

            JsonNode payloadNode = root.get(PAYLOAD);
            if (!payloadNode.isObject()) {
                throw new MessageCodecException("'payload' must be an object");
            }
            String type = payloadNode.path(TYPE).asText(null);
            Class<? extends MessagePayload> payloadType = PayloadTypes.forName(type)
                .orElseThrow(() -> new MessageCodecException("Unknown payload type: '" + type + "'"));

            ObjectNode fields = ((ObjectNode) payloadNode).deepCopy();
            fields.remove(TYPE);
            MessagePayload payload = objectMapper.treeToValue(fields, payloadType);
            return Envelope.of(header, payload);
        } catch (IOException | IllegalArgumentException e) {
            throw new MessageCodecException("Cannot decode message: " + e.getMessage(), e);
        }
    }
}
