package com.ryuqq.scapipeline.adapter.rabbitmq.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.scapipeline.core.contract.CreateRun;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.model.StageConfiguration;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonMessageCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonMessageCodecTest {

    private static final MessageHeader HEADER = new MessageHeader("token-1", "trace-1");

    private final JsonMessageCodec codec = new JsonMessageCodec();

    @Test
    void encode_header와_type_구분자를_포함함() throws Exception {
        // when
        byte[] body = codec.encode(Envelope.of(HEADER, new JobRequest.ScannerRequest(42L)));

        // then
        JsonNode root = new ObjectMapper().readTree(body);
        assertThat(root.path("header").path("token").asText()).isEqualTo("token-1");
        assertThat(root.path("header").path("traceId").asText()).isEqualTo("trace-1");
        assertThat(root.path("payload").path("type").asText()).isEqualTo("ScannerRequest");
        assertThat(root.path("payload").path("runId").asLong()).isEqualTo(42L);
    }

    @Test
    void decode_ConfigWorkerResult의_중첩_구조를_복원함() {
        // given
        JobConfigurations configs = JobConfigurations.none().with(
            PipelineStage.REPORTER,
            new StageConfiguration(
                Map.of("formats", "RunSummary"),
                List.of("RunSummary"),
                Map.of("RunSummary", new PluginConfiguration(Map.of("fileName", "out.json"), Map.of("token", "ref")))
            )
        );
        Issue issue = new Issue(Instant.parse("2024-05-01T10:15:30Z"), "config", "note", Severity.HINT);
        JobResult.ConfigWorkerResult result = new JobResult.ConfigWorkerResult(7L, configs, "main", List.of(issue));

        // when
        Envelope<MessagePayload> decoded = codec.decode(codec.encode(Envelope.of(HEADER, result)));

        // then
        assertThat(decoded.header()).isEqualTo(HEADER);
        assertThat(decoded.payload()).isEqualTo(result);
    }

    @Test
    void decode_WorkerError를_복원함() {
        // given
        JobResult.WorkerError error = new JobResult.WorkerError(PipelineStage.ANALYZER, 3L, "boom");

        // when
        Envelope<MessagePayload> decoded = codec.decode(codec.encode(Envelope.of(HEADER, error)));

        // then
        assertThat(decoded.payload()).isEqualTo(error);
    }

    @Test
    void decode_알_수_없는_type은_예외() {
        // given
        byte[] body = "{\"header\":{\"token\":\"\",\"traceId\":\"t\"},\"payload\":{\"type\":\"Nope\",\"runId\":1}}"
            .getBytes(StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> codec.decode(body))
            .isInstanceOf(MessageCodecException.class)
            .hasMessageContaining("Nope");
    }

    @Test
    void decode_header가_없으면_예외() {
        // given
        byte[] body = "{\"payload\":{\"type\":\"CreateRun\",\"runId\":1}}".getBytes(StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> codec.decode(body))
            .isInstanceOf(MessageCodecException.class)
            .hasMessageContaining("header");
    }

    @Test
    void decode_traceId가_없으면_예외() {
        // given
        byte[] body = "{\"header\":{\"token\":\"\"},\"payload\":{\"type\":\"CreateRun\",\"runId\":1}}"
            .getBytes(StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> codec.decode(body))
            .isInstanceOf(MessageCodecException.class);
    }

    @Test
    void decode_알_수_없는_속성은_거부함() {
        // given
        byte[] body = "{\"header\":{\"token\":\"\",\"traceId\":\"t\"},\"payload\":{\"type\":\"CreateRun\",\"runId\":1,\"extra\":true}}"
            .getBytes(StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> codec.decode(body))
            .isInstanceOf(MessageCodecException.class);
    }

    @Test
    void nameOf_모든_payload_타입이_등록되어_있음() {
        assertThat(PayloadTypes.all()).hasSize(17);
        assertThat(PayloadTypes.nameOf(new CreateRun(1L))).isEqualTo("CreateRun");
        assertThat(PayloadTypes.forName("NotifierWorkerResult")).contains(JobResult.NotifierWorkerResult.class);
    }
}
