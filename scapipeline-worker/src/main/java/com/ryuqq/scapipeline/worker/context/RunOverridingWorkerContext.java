package com.ryuqq.scapipeline.worker.context;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.spi.ConfigPath;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

/**
 * Run만 교체하고 나머지 기능은 위임하는 {@link WorkerContext}.
 *
 * <p>CONFIG 단계는 설정 context를 해석한 뒤, 그 값을 가진 Run으로 검증 로직을 실행해야 합니다.
 * 캐시와 임시 디렉터리는 위임 대상이 소유하므로 {@link #close()}는 아무것도 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunOverridingWorkerContext implements WorkerContext {

    private final WorkerContext delegate;
    private final Run run;

    /**
     * 생성자.
     *
     * @param delegate 위임 대상
     * @param run 노출할 Run
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RunOverridingWorkerContext(WorkerContext delegate, Run run) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        this.delegate = delegate;
        this.run = run;
    }

    @Override
    public Run getRun() {
        return run;
    }

    @Override
    public Hierarchy getHierarchy() {
        return delegate.getHierarchy();
    }

    @Override
    public String getConfigurationContext() {
        return run.resolvedJobConfigContext();
    }

    @Override
    public String resolveSecret(Secret secret) {
        return delegate.resolveSecret(secret);
    }

    @Override
    public Map<Secret, String> resolveSecrets(Collection<Secret> secrets) {
        return delegate.resolveSecrets(secrets);
    }

    @Override
    public Map<String, PluginConfiguration> resolvePluginConfigSecrets(Map<String, PluginConfiguration> pluginConfigs) {
        return delegate.resolvePluginConfigSecrets(pluginConfigs);
    }

    @Override
    public Path downloadConfigurationFile(ConfigPath path, Path targetDirectory, String targetName) {
        return delegate.downloadConfigurationFile(path, targetDirectory, targetName);
    }

    @Override
    public Map<ConfigPath, Path> downloadConfigurationFiles(Collection<ConfigPath> paths, Path targetDirectory) {
        return delegate.downloadConfigurationFiles(paths, targetDirectory);
    }

    @Override
    public Map<ConfigPath, Path> downloadConfigurationDirectory(ConfigPath directory, Path targetDirectory) {
        return delegate.downloadConfigurationDirectory(directory, targetDirectory);
    }

    @Override
    public Path createTempDir() {
        return delegate.createTempDir();
    }

    @Override
    public void close() {
        // 위임 대상의 수명은 호출자가 관리
    }
}
