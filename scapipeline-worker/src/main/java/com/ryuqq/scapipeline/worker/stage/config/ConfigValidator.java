package com.ryuqq.scapipeline.worker.stage.config;

import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.worker.context.WorkerContext;

import java.util.List;

/**
 * Run 생성 시 전달된 job configuration을 검증하고 최종 설정으로 변환합니다.
 *
 * <p>전달되는 컨텍스트의 Run은 이미 해석된 설정 context를 가지고 있으므로, 설정 파일은
 * {@link WorkerContext#downloadConfigurationFile}로 읽을 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConfigValidator {

    /**
     * 검증.
     *
     * @param context 해석된 context가 반영된 컨텍스트
     * @param jobConfigs 선언된 job configuration
     * @return 검증 결과
     * @throws Exception 검증 로직 실행 실패
     */
    ConfigValidationResult validate(WorkerContext context, JobConfigurations jobConfigs) throws Exception;

    /**
     * 선언된 설정을 그대로 통과시키는 검증기.
     *
     * @return 검증기
     */
    static ConfigValidator passThrough() {
        return (context, jobConfigs) -> new ConfigValidationResult.Success(jobConfigs, List.of());
    }
}
