package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.GetResponse;
import com.ryuqq.scapipeline.adapter.rabbitmq.codec.JsonMessageCodec;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.transport.ReceivedMessage;
import com.ryuqq.scapipeline.core.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RabbitMQ sender/receiver 테스트 (Channel mock).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RabbitMqTransportTest {

    private static final String QUEUE = "scanner";
    private static final MessageHeader HEADER = new MessageHeader("", "trace-7");

    @Mock
    private Channel channel;

    @Mock
    private Connection connection;

    private final JsonMessageCodec codec = new JsonMessageCodec();
    private RabbitMqChannel rabbitChannel;

    @BeforeEach
    void setUp() {
        rabbitChannel = new RabbitMqChannel(null, channel, QUEUE);
    }

    // ============================================================
    // Sender
    // ============================================================

    @Test
    void send_persistent_메시지로_queue에_발행함() throws Exception {
        // given
        RabbitMqMessageSender<JobRequest> sender = new RabbitMqMessageSender<>(rabbitChannel, codec);

        // when
        sender.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(9L)));

        // then
        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).basicPublish(eq(""), eq(QUEUE), properties.capture(), body.capture());
        assertThat(properties.getValue().getDeliveryMode()).isEqualTo(2);
        assertThat(properties.getValue().getCorrelationId()).isEqualTo("trace-7");
        assertThat(codec.decode(body.getValue()).payload()).isEqualTo(new JobRequest.ScannerRequest(9L));
    }

    @Test
    void send_발행_실패는_TransportException() throws Exception {
        // given
        RabbitMqMessageSender<JobRequest> sender = new RabbitMqMessageSender<>(rabbitChannel, codec);
        doThrow(new IOException("closed")).when(channel)
            .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

        // when & then
        assertThatThrownBy(() -> sender.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(9L))))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining(QUEUE);
    }

    @Test
    void declareQueue_durable_queue를_선언함() throws Exception {
        // when
        rabbitChannel.declareQueue();

        // then
        verify(channel).queueDeclare(QUEUE, true, false, false, null);
    }

    // ============================================================
    // Receiver
    // ============================================================

    @Test
    void receive_basicGet_응답을_ReceivedMessage로_변환함() throws Exception {
        // given
        RabbitMqMessageReceiver<JobRequest> receiver = new RabbitMqMessageReceiver<>(rabbitChannel, codec, JobRequest.class);
        when(channel.basicGet(QUEUE, false)).thenReturn(response(11L, true, codec.encode(
            Envelope.of(HEADER, new JobRequest.ScannerRequest(9L))
        )));

        // when
        Optional<ReceivedMessage<JobRequest>> message = receiver.receive(0);

        // then
        assertThat(message).isPresent();
        assertThat(message.get().deliveryId()).isEqualTo("11");
        assertThat(message.get().redelivered()).isTrue();
        assertThat(message.get().envelope().header().traceId()).isEqualTo("trace-7");
    }

    @Test
    void receive_메시지가_없으면_timeout_후_empty() throws Exception {
        // given
        RabbitMqMessageReceiver<JobRequest> receiver = new RabbitMqMessageReceiver<>(rabbitChannel, codec, JobRequest.class);
        when(channel.basicGet(QUEUE, false)).thenReturn(null);

        // when
        Optional<ReceivedMessage<JobRequest>> message = receiver.receive(150);

        // then
        assertThat(message).isEmpty();
    }

    @Test
    void ack_nack_delivery_tag로_응답함() throws Exception {
        // given
        RabbitMqMessageReceiver<JobRequest> receiver = new RabbitMqMessageReceiver<>(rabbitChannel, codec, JobRequest.class);
        ReceivedMessage<JobRequest> message = new ReceivedMessage<>(
            "5", Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)), false
        );

        // when
        receiver.ack(message);
        receiver.nack(message);

        // then
        verify(channel).basicAck(5L, false);
        verify(channel).basicNack(5L, false, true);
    }

    @Test
    void receive_잘못된_메시지는_reject하고_예외() throws Exception {
        // given
        RabbitMqMessageReceiver<JobRequest> receiver = new RabbitMqMessageReceiver<>(rabbitChannel, codec, JobRequest.class);
        when(channel.basicGet(QUEUE, false)).thenReturn(response(3L, false, "not json".getBytes(StandardCharsets.UTF_8)));

        // when & then
        assertThatThrownBy(() -> receiver.receive(0))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("malformed");
        verify(channel).basicReject(3L, false);
    }

    @Test
    void receive_payload_타입이_다르면_reject하고_예외() throws Exception {
        // given
        RabbitMqMessageReceiver<OrchestratorMessage> receiver =
            new RabbitMqMessageReceiver<>(rabbitChannel, codec, OrchestratorMessage.class);
        when(channel.basicGet(QUEUE, false)).thenReturn(response(4L, false, codec.encode(
            Envelope.of(HEADER, new JobRequest.ScannerRequest(9L))
        )));

        // when & then
        assertThatThrownBy(() -> receiver.receive(0))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("ScannerRequest");
        verify(channel).basicReject(4L, false);
    }

    @Test
    void close_채널을_한_번만_닫음() throws Exception {
        // given
        when(channel.isOpen()).thenReturn(true);
        RabbitMqMessageReceiver<JobRequest> receiver = new RabbitMqMessageReceiver<>(rabbitChannel, codec, JobRequest.class);

        // when
        receiver.close();
        receiver.close();

        // then
        verify(channel).close();
    }

    @Test
    void close_채널_close가_실패해도_connection을_닫음() throws Exception {
        // given
        RabbitMqChannel owned = new RabbitMqChannel(connection, channel, QUEUE);
        when(channel.isOpen()).thenReturn(true);
        doThrow(new IOException("channel gone")).when(channel).close();
        when(connection.isOpen()).thenReturn(true);

        // when & then
        assertThatThrownBy(owned::close)
            .isInstanceOf(TransportException.class)
            .hasMessageContaining(QUEUE)
            .hasRootCauseMessage("channel gone");
        verify(connection).close();
    }

    @Test
    void close_connection_close_실패는_suppressed로_추가함() throws Exception {
        // given
        RabbitMqChannel owned = new RabbitMqChannel(connection, channel, QUEUE);
        IOException connectionFailure = new IOException("connection gone");
        when(channel.isOpen()).thenReturn(true);
        doThrow(new IOException("channel gone")).when(channel).close();
        when(connection.isOpen()).thenReturn(true);
        doThrow(connectionFailure).when(connection).close();

        // when & then
        assertThatThrownBy(owned::close)
            .isInstanceOf(TransportException.class)
            .hasRootCauseMessage("channel gone")
            .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(connectionFailure));
    }

    private static GetResponse response(long tag, boolean redelivered, byte[] body) {
        com.rabbitmq.client.Envelope envelope = new com.rabbitmq.client.Envelope(tag, redelivered, "", QUEUE);
        return new GetResponse(envelope, new AMQP.BasicProperties(), body, 0);
    }
}
