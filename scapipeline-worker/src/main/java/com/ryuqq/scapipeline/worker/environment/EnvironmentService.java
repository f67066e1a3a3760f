package com.ryuqq.scapipeline.worker.environment;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentServiceDefinition;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition.LiteralVariable;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition.SecretVariable;
import com.ryuqq.scapipeline.worker.environment.generator.EnvironmentConfigGenerator;
import com.ryuqq.scapipeline.worker.environment.generator.GeneratedFile;
import com.ryuqq.scapipeline.worker.environment.generator.MavenSettingsGenerator;
import com.ryuqq.scapipeline.worker.environment.generator.NetRcGenerator;
import com.ryuqq.scapipeline.worker.environment.generator.NpmRcGenerator;
import com.ryuqq.scapipeline.worker.environment.generator.NuGetConfigGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 해석된 environment configuration으로 단계 프로세스 환경을 준비합니다.
 *
 * <p>모든 파일은 Worker Context의 임시 디렉터리에 작성되므로 컨텍스트가 닫힐 때 삭제됩니다.</p>
 *
 * <ul>
 *   <li>환경 변수: secret 값 또는 리터럴 값</li>
 *   <li>{@code .netrc}: {@link CredentialsType#NETRC_FILE}로 표시된 서비스. {@code HOME}이 설정 디렉터리를 가리킵니다.</li>
 *   <li>패키지 매니저 설정 파일: definition 타입별 generator</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvironmentService {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentService.class);

    public static final String HOME_VARIABLE = "HOME";

    private final List<EnvironmentConfigGenerator<?>> generators;
    private final NetRcGenerator netRcGenerator;

    /**
     * 기본 generator (Maven, NPM, NuGet) 사용.
     */
    public EnvironmentService() {
        this(List.of(new MavenSettingsGenerator(), new NpmRcGenerator(), new NuGetConfigGenerator()));
    }

    /**
     * 생성자.
     *
     * @param generators definition 타입별 generator
     */
    public EnvironmentService(List<EnvironmentConfigGenerator<?>> generators) {
        if (generators == null) {
            throw new IllegalArgumentException("generators cannot be null");
        }
        this.generators = List.copyOf(generators);
        this.netRcGenerator = new NetRcGenerator();
    }

    /**
     * 환경 준비.
     *
     * @param context Worker Context
     * @param config 해석된 설정
     * @return 준비된 환경
     * @throws IOException 설정 파일 작성 실패
     */
    public EnvironmentSetup setup(WorkerContext context, ResolvedEnvironmentConfig config) throws IOException {
        Path configDirectory = context.createTempDir();
        Map<String, String> variables = new LinkedHashMap<>();
        List<Path> files = new ArrayList<>();

        for (EnvironmentVariableDefinition variable : config.environmentVariables()) {
            if (variable instanceof SecretVariable secretVariable) {
                variables.put(secretVariable.name(), context.resolveSecret(secretVariable.secret()));
            } else if (variable instanceof LiteralVariable literal) {
                variables.put(literal.name(), literal.value());
            }
        }

        Set<InfrastructureService> netrcServices = netrcServices(config);
        if (!netrcServices.isEmpty()) {
            files.add(netRcGenerator.generate(context, configDirectory, netrcServices));
            variables.put(HOME_VARIABLE, configDirectory.toAbsolutePath().toString());
        }

        for (EnvironmentConfigGenerator<?> generator : generators) {
            runGenerator(generator, context, configDirectory, config.environmentDefinitions()).ifPresent(generated -> {
                files.add(generated.file());
                variables.putAll(generated.variables());
            });
        }

        log.info(
            "Prepared environment for run {}: {} variable(s), {} file(s)",
            context.getRun().id(), variables.size(), files.size()
        );
        return new EnvironmentSetup(configDirectory, variables, files);
    }

    private static Set<InfrastructureService> netrcServices(ResolvedEnvironmentConfig config) {
        Set<InfrastructureService> services = new LinkedHashSet<>();
        for (EnvironmentServiceDefinition definition : config.environmentDefinitions()) {
            if (definition.credentialsTypes().contains(CredentialsType.NETRC_FILE)) {
                services.add(definition.service());
            }
        }
        for (InfrastructureService service : config.infrastructureServices()) {
            if (service.exposes(CredentialsType.NETRC_FILE)) {
                services.add(service);
            }
        }
        return services;
    }

    private static <T extends EnvironmentServiceDefinition> Optional<GeneratedFile> runGenerator(
        EnvironmentConfigGenerator<T> generator,
        WorkerContext context,
        Path configDirectory,
        List<EnvironmentServiceDefinition> definitions
    ) throws IOException {
        List<T> matching = new ArrayList<>();
        for (EnvironmentServiceDefinition definition : definitions) {
            if (generator.definitionType().isInstance(definition)) {
                matching.add(generator.definitionType().cast(definition));
            }
        }
        if (matching.isEmpty()) {
            return Optional.empty();
        }

        GeneratedFile generated = generator.generate(context, configDirectory, matching);
        log.debug("Generated {} for {} definition(s)", generated.file().getFileName(), matching.size());
        return Optional.of(generated);
    }
}
