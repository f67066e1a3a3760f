package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryQueue 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryQueueTest {

    private static final MessageHeader HEADER = new MessageHeader("", "trace-1");

    private final InMemoryQueue queue = new InMemoryQueue("scanner", new InMemoryQueueConfig());

    @Test
    void receive_메시지는_한_소비자에게만_전달됨() throws Exception {
        // given
        queue.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        Optional<InMemoryQueue.Delivery> first = queue.receive(100);
        Optional<InMemoryQueue.Delivery> second = queue.receive(0);

        // then
        assertThat(first).isPresent();
        assertThat(first.get().redelivered()).isFalse();
        assertThat(second).isEmpty();
        assertThat(queue.inFlightSize()).isEqualTo(1);
    }

    @Test
    void ack_메시지를_영구_제거함() throws Exception {
        // given
        queue.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        InMemoryQueue.Delivery delivery = queue.receive(100).orElseThrow();

        // when
        queue.ack(delivery.deliveryId());
        queue.ack(delivery.deliveryId());

        // then
        assertThat(queue.inFlightSize()).isZero();
        assertThat(queue.expireVisibilityTimeouts()).isZero();
        assertThat(queue.receive(0)).isEmpty();
    }

    @Test
    void nack_메시지를_즉시_재전달함() throws Exception {
        // given
        queue.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        InMemoryQueue.Delivery delivery = queue.receive(100).orElseThrow();

        // when
        queue.nack(delivery.deliveryId());
        Optional<InMemoryQueue.Delivery> redelivery = queue.receive(100);

        // then
        assertThat(redelivery).isPresent();
        assertThat(redelivery.get().redelivered()).isTrue();
        assertThat(redelivery.get().deliveryId()).isNotEqualTo(delivery.deliveryId());
        assertThat(redelivery.get().envelope()).isEqualTo(delivery.envelope());
    }

    @Test
    void receive_visibility_timeout이_지나면_재전달함() throws Exception {
        // given
        InMemoryQueue shortQueue = new InMemoryQueue("analyzer", new InMemoryQueueConfig(1));
        shortQueue.send(Envelope.of(HEADER, new JobRequest.AnalyzerRequest(2L)));
        shortQueue.receive(100).orElseThrow();
        Thread.sleep(20);

        // when
        Optional<InMemoryQueue.Delivery> redelivery = shortQueue.receive(100);

        // then
        assertThat(redelivery).isPresent();
        assertThat(redelivery.get().redelivered()).isTrue();
    }

    @Test
    void clear_모든_메시지를_제거함() throws Exception {
        // given
        queue.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        queue.send(Envelope.of(HEADER, new JobRequest.ScannerRequest(2L)));
        queue.receive(100);

        // when
        queue.clear();

        // then
        assertThat(queue.readySize()).isZero();
        assertThat(queue.inFlightSize()).isZero();
    }
}
