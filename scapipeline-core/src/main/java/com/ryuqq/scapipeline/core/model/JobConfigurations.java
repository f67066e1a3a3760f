package com.ryuqq.scapipeline.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Run에 요청된 단계별 job configuration 모음.
 *
 * <p>맵에 포함된 단계만 실행이 요청된 것으로 간주합니다. CONFIG 단계는 포함 여부와 관계없이 항상 실행됩니다.</p>
 *
 * @param stages 단계 → 설정
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobConfigurations(Map<PipelineStage, StageConfiguration> stages) {

    public JobConfigurations {
        if (stages == null || stages.isEmpty()) {
            stages = Map.of();
        } else {
            stages = Map.copyOf(new EnumMap<>(stages));
        }
    }

    /**
     * 아무 단계도 요청하지 않은 configuration.
     *
     * @return 빈 JobConfigurations
     */
    public static JobConfigurations none() {
        return new JobConfigurations(Map.of());
    }

    /**
     * 주어진 단계들을 기본 설정으로 요청.
     *
     * @param stages 요청할 단계
     * @return JobConfigurations
     */
    public static JobConfigurations of(PipelineStage... stages) {
        Map<PipelineStage, StageConfiguration> map = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : stages) {
            map.put(stage, StageConfiguration.defaults());
        }
        return new JobConfigurations(map);
    }

    /**
     * 단계가 요청되었는지 확인.
     *
     * @param stage 단계
     * @return CONFIG이거나 맵에 포함되어 있으면 true
     */
    public boolean requests(PipelineStage stage) {
        return stage == PipelineStage.CONFIG || stages.containsKey(stage);
    }

    /**
     * 단계 설정 조회.
     *
     * @param stage 단계
     * @return 설정, 요청되지 않은 단계이면 빈 Optional
     */
    public Optional<StageConfiguration> forStage(PipelineStage stage) {
        return Optional.ofNullable(stages.get(stage));
    }

    /**
     * 단계 설정을 추가/교체한 새 인스턴스.
     *
     * @param stage 단계
     * @param configuration 설정
     * @return 새 JobConfigurations
     */
    public JobConfigurations with(PipelineStage stage, StageConfiguration configuration) {
        Map<PipelineStage, StageConfiguration> map = new EnumMap<>(PipelineStage.class);
        map.putAll(stages);
        map.put(stage, configuration);
        return new JobConfigurations(map);
    }
}
