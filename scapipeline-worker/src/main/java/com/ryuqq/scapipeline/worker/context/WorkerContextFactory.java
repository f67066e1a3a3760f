package com.ryuqq.scapipeline.worker.context;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.spi.ConfigManager;
import com.ryuqq.scapipeline.core.spi.RepositoryRepository;
import com.ryuqq.scapipeline.core.spi.RunNotFoundException;
import com.ryuqq.scapipeline.core.spi.RunRepository;
import com.ryuqq.scapipeline.core.spi.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WorkerContext} 생성기.
 *
 * <p>Run과 Hierarchy는 컨텍스트 생성 시점에 즉시 조회합니다. 존재하지 않는 Run ID는
 * 컨텍스트를 만들기 전에 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerContextFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerContextFactory.class);

    private final RunRepository runRepository;
    private final RepositoryRepository repositoryRepository;
    private final SecretStore secretStore;
    private final ConfigManager configManager;

    /**
     * 생성자.
     *
     * @param runRepository Run 저장소
     * @param repositoryRepository Hierarchy 조회
     * @param secretStore secret 값 저장소
     * @param configManager 설정 파일 제공자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerContextFactory(
        RunRepository runRepository,
        RepositoryRepository repositoryRepository,
        SecretStore secretStore,
        ConfigManager configManager
    ) {
        if (runRepository == null) {
            throw new IllegalArgumentException("runRepository cannot be null");
        }
        if (repositoryRepository == null) {
            throw new IllegalArgumentException("repositoryRepository cannot be null");
        }
        if (secretStore == null) {
            throw new IllegalArgumentException("secretStore cannot be null");
        }
        if (configManager == null) {
            throw new IllegalArgumentException("configManager cannot be null");
        }
        this.runRepository = runRepository;
        this.repositoryRepository = repositoryRepository;
        this.secretStore = secretStore;
        this.configManager = configManager;
    }

    /**
     * Run에 바인딩된 컨텍스트 생성.
     *
     * @param runId Run ID
     * @return 새 컨텍스트 (호출자가 닫아야 함)
     * @throws RunNotFoundException Run이 존재하지 않는 경우
     * @throws IllegalStateException Run의 저장소 Hierarchy를 찾을 수 없는 경우
     */
    public WorkerContext createContext(long runId) {
        Run run = runRepository.get(runId).orElseThrow(() -> new RunNotFoundException(runId));
        Hierarchy hierarchy = repositoryRepository.getHierarchy(run.repositoryId())
            .orElseThrow(() -> new IllegalStateException(
                "No hierarchy found for repository " + run.repositoryId() + " of run " + runId
            ));

        log.info("Created worker context for run {} (repository={})", runId, run.repositoryId());
        return new DefaultWorkerContext(run, hierarchy, secretStore, configManager);
    }
}
