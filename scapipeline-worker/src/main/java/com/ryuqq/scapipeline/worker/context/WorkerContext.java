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
 * 단계 1회 실행 동안의 Run 실행 핸들.
 *
 * <p>Run/Hierarchy 메타데이터, secret 해석, 설정 파일 다운로드, 임시 디렉터리를 제공합니다.
 * 모든 캐시와 임시 디렉터리는 이 컨텍스트가 소유하며 {@link #close()} 시 해제됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (WorkerContext context = factory.createContext(runId)) {
 *     Path workDir = context.createTempDir();
 *     String password = context.resolveSecret(service.passwordSecret());
 *     ...
 * } // 모든 임시 디렉터리 재귀 삭제
 * </pre>
 *
 * <p><strong>캐시 규칙:</strong></p>
 * <ul>
 *   <li>secret: secret 경로 단위, 동시 요청도 store 조회는 1회 (single-flight)</li>
 *   <li>설정 파일: (원본 경로, 대상 디렉터리, 파일 이름) 단위</li>
 *   <li>한 번 캐시된 값은 store 값이 바뀌어도 컨텍스트가 닫힐 때까지 유지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkerContext extends AutoCloseable {

    /**
     * 현재 Run.
     *
     * @return Run
     */
    Run getRun();

    /**
     * Run 저장소의 Hierarchy.
     *
     * @return Hierarchy
     */
    Hierarchy getHierarchy();

    /**
     * 설정 파일을 읽을 때 사용하는 context.
     *
     * @return Run의 해석된 설정 context (없으면 null)
     */
    String getConfigurationContext();

    /**
     * Secret 값 해석 (캐시).
     *
     * @param secret secret 참조
     * @return secret 값
     * @throws com.ryuqq.scapipeline.core.spi.SecretNotFoundException store에 값이 없는 경우
     */
    String resolveSecret(Secret secret);

    /**
     * 여러 secret 값 해석 (secret 단위 캐시).
     *
     * @param secrets secret 참조
     * @return secret → 값
     */
    Map<Secret, String> resolveSecrets(Collection<Secret> secrets);

    /**
     * 플러그인 설정의 secret 참조를 실제 값으로 치환.
     *
     * @param pluginConfigs 플러그인 이름 → 설정 (null 허용)
     * @return 같은 구조, secrets 값이 해석된 값으로 치환됨. 입력이 null이면 빈 맵
     */
    Map<String, PluginConfiguration> resolvePluginConfigSecrets(Map<String, PluginConfiguration> pluginConfigs);

    /**
     * 설정 파일을 대상 디렉터리로 다운로드 (캐시).
     *
     * @param path 설정 저장소 안의 파일 경로
     * @param targetDirectory 대상 디렉터리
     * @param targetName 저장할 파일 이름 (null이면 원본 이름)
     * @return 다운로드된 파일
     * @throws com.ryuqq.scapipeline.core.spi.ConfigException 파일을 읽을 수 없는 경우
     */
    Path downloadConfigurationFile(ConfigPath path, Path targetDirectory, String targetName);

    /**
     * 설정 파일을 원본 이름으로 다운로드.
     *
     * @param path 설정 저장소 안의 파일 경로
     * @param targetDirectory 대상 디렉터리
     * @return 다운로드된 파일
     */
    default Path downloadConfigurationFile(ConfigPath path, Path targetDirectory) {
        return downloadConfigurationFile(path, targetDirectory, null);
    }

    /**
     * 여러 설정 파일을 원본 이름으로 다운로드.
     *
     * @param paths 파일 경로
     * @param targetDirectory 대상 디렉터리
     * @return 원본 경로 → 다운로드된 파일
     */
    Map<ConfigPath, Path> downloadConfigurationFiles(Collection<ConfigPath> paths, Path targetDirectory);

    /**
     * 설정 디렉터리 아래의 모든 파일을 다운로드.
     *
     * <p>하위 디렉터리 구조는 대상 디렉터리 아래에 그대로 유지됩니다.</p>
     *
     * @param directory 설정 저장소 안의 디렉터리 경로
     * @param targetDirectory 대상 디렉터리
     * @return 원본 경로 → 다운로드된 파일
     */
    Map<ConfigPath, Path> downloadConfigurationDirectory(ConfigPath directory, Path targetDirectory);

    /**
     * 고유한 임시 디렉터리 생성.
     *
     * @return 새 디렉터리 (컨텍스트 종료 시 재귀 삭제)
     */
    Path createTempDir();

    /**
     * 컨텍스트 종료 (멱등).
     *
     * <p>임시 디렉터리를 재귀 삭제하고 캐시를 비웁니다. 삭제 실패가 있어도 나머지 디렉터리 정리를 계속한 뒤
     * 마지막에 예외를 던집니다.</p>
     *
     * @throws java.io.UncheckedIOException 임시 디렉터리 삭제에 실패한 경우
     */
    @Override
    void close();
}
