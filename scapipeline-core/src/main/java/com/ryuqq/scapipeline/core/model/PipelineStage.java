package com.ryuqq.scapipeline.core.model;

import java.util.Optional;

/**
 * 파이프라인 단계.
 *
 * <p>단계 순서는 고정되어 있으며 선언 순서를 따릅니다:</p>
 * <pre>
 * CONFIG → ANALYZER → ADVISOR → SCANNER → EVALUATOR → REPORTER → NOTIFIER
 * </pre>
 *
 * <p>CONFIG는 항상 첫 단계로 실행되고, 나머지 단계는 Run의 job configuration에
 * 포함된 경우에만 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PipelineStage {

    CONFIG("config"),
    ANALYZER("analyzer"),
    ADVISOR("advisor"),
    SCANNER("scanner"),
    EVALUATOR("evaluator"),
    REPORTER("reporter"),
    NOTIFIER("notifier");

    private final String endpointName;

    PipelineStage(String endpointName) {
        this.endpointName = endpointName;
    }

    /**
     * 이 단계의 요청을 받는 논리 endpoint 이름.
     *
     * @return endpoint 이름 (소문자)
     */
    public String endpointName() {
        return endpointName;
    }

    /**
     * 바로 다음 단계.
     *
     * @return 다음 단계, 마지막 단계이면 빈 Optional
     */
    public Optional<PipelineStage> next() {
        PipelineStage[] stages = values();
        int index = ordinal() + 1;
        return index < stages.length ? Optional.of(stages[index]) : Optional.empty();
    }
}
