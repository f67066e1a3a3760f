package com.ryuqq.scapipeline.worker.environment;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.outcome.Fail;
import com.ryuqq.scapipeline.core.outcome.Ok;
import com.ryuqq.scapipeline.core.outcome.Outcome;
import com.ryuqq.scapipeline.core.spi.InfrastructureServiceRepository;
import com.ryuqq.scapipeline.core.spi.SecretRepository;
import com.ryuqq.scapipeline.worker.environment.RepositoryEnvironmentConfig.RepositoryEnvironmentVariable;
import com.ryuqq.scapipeline.worker.environment.RepositoryEnvironmentConfig.RepositoryInfrastructureService;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentDefinitionFactory;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentServiceDefinition;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition.LiteralVariable;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition.SecretVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 저장소 environment configuration 로더.
 *
 * <p>설정에 포함된 참조(secret 이름, 서비스 이름)를 Run의 Hierarchy 기준으로 해석합니다.</p>
 *
 * <p><strong>해석 순서:</strong></p>
 * <ol>
 *   <li>참조된 모든 secret 이름 수집 후 저장소 → 제품 → 조직 순서로 조회 (남은 이름이 있을 때만 조회)</li>
 *   <li>설정 파일 서비스는 두 secret이 모두 해석된 경우에만 생성</li>
 *   <li>definition의 서비스는 설정 파일 서비스 → 제품 → 조직 순서로 조회</li>
 *   <li>환경 변수를 secret 또는 리터럴 값에 바인딩</li>
 * </ol>
 *
 * <p>문제는 단계별로 모두 모은 뒤 한 번에 처리합니다. strict 모드면 {@link EnvironmentConfigException},
 * 아니면 경고 로그를 남기고 해당 선언만 제외합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvironmentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    /** 저장소 루트 기준 설정 파일 경로. */
    public static final String CONFIG_FILE_PATH = ".ort.env.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .findAndRegisterModules()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final SecretRepository secretRepository;
    private final InfrastructureServiceRepository serviceRepository;
    private final EnvironmentDefinitionFactory definitionFactory;

    /**
     * 생성자.
     *
     * @param secretRepository secret 참조 조회
     * @param serviceRepository 제품/조직 서비스 조회
     * @param definitionFactory definition 생성기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public EnvironmentConfigLoader(
        SecretRepository secretRepository,
        InfrastructureServiceRepository serviceRepository,
        EnvironmentDefinitionFactory definitionFactory
    ) {
        if (secretRepository == null) {
            throw new IllegalArgumentException("secretRepository cannot be null");
        }
        if (serviceRepository == null) {
            throw new IllegalArgumentException("serviceRepository cannot be null");
        }
        if (definitionFactory == null) {
            throw new IllegalArgumentException("definitionFactory cannot be null");
        }
        this.secretRepository = secretRepository;
        this.serviceRepository = serviceRepository;
        this.definitionFactory = definitionFactory;
    }

    /**
     * 체크아웃된 저장소의 {@value #CONFIG_FILE_PATH} 파일을 읽어 해석.
     *
     * @param repositoryDirectory 저장소 루트
     * @param hierarchy 저장소 Hierarchy
     * @return 해석된 설정 (파일이 없으면 빈 설정)
     * @throws EnvironmentConfigException 파일 형식 오류 또는 strict 모드의 해석 실패
     */
    public ResolvedEnvironmentConfig parse(Path repositoryDirectory, Hierarchy hierarchy)
        throws EnvironmentConfigException {
        Path configFile = repositoryDirectory.resolve(CONFIG_FILE_PATH);
        if (!Files.isRegularFile(configFile)) {
            log.debug("No environment configuration file found at {}", configFile);
            return ResolvedEnvironmentConfig.empty();
        }

        log.info("Parsing environment configuration file '{}'", configFile);
        RepositoryEnvironmentConfig config;
        try (InputStream in = Files.newInputStream(configFile)) {
            config = YAML_MAPPER.readValue(in, RepositoryEnvironmentConfig.class);
        } catch (IOException e) {
            throw new EnvironmentConfigException(
                "Invalid environment configuration file '" + configFile + "': " + e.getMessage(), e
            );
        }
        if (config == null) {
            return ResolvedEnvironmentConfig.empty();
        }
        return resolve(config, hierarchy);
    }

    /**
     * 파일 대신 Run 생성 시 전달된 설정을 해석.
     *
     * @param config 설정
     * @param hierarchy 저장소 Hierarchy
     * @return 해석된 설정
     * @throws EnvironmentConfigException strict 모드의 해석 실패
     */
    public ResolvedEnvironmentConfig resolve(RepositoryEnvironmentConfig config, Hierarchy hierarchy)
        throws EnvironmentConfigException {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (hierarchy == null) {
            throw new IllegalArgumentException("hierarchy cannot be null");
        }

        List<String> warnings = new ArrayList<>();
        Map<String, Secret> secrets = resolveSecrets(config, hierarchy, warnings);
        List<InfrastructureService> services = parseServices(config, secrets);
        List<EnvironmentServiceDefinition> definitions = parseDefinitions(config, hierarchy, services, warnings);
        Set<EnvironmentVariableDefinition> variables = parseVariables(config, secrets, warnings);

        return new ResolvedEnvironmentConfig(services, definitions, variables, warnings);
    }

    private Map<String, Secret> resolveSecrets(
        RepositoryEnvironmentConfig config,
        Hierarchy hierarchy,
        List<String> warnings
    ) throws EnvironmentConfigException {
        Set<String> outstanding = new LinkedHashSet<>();
        for (RepositoryEnvironmentVariable variable : config.environmentVariables()) {
            if (variable.referencesSecret()) {
                outstanding.add(variable.secretName());
            }
        }
        for (RepositoryInfrastructureService service : config.infrastructureServices()) {
            outstanding.add(service.usernameSecret());
            outstanding.add(service.passwordSecret());
        }

        Map<String, Secret> resolved = new LinkedHashMap<>();
        fetchSecrets(outstanding, resolved, () -> secretRepository.listForRepository(hierarchy.repository().id()));
        fetchSecrets(outstanding, resolved, () -> secretRepository.listForProduct(hierarchy.product().id()));
        fetchSecrets(outstanding, resolved, () -> secretRepository.listForOrganization(hierarchy.organization().id()));

        if (!outstanding.isEmpty()) {
            handleProblem(config, "Invalid secret names. The following names cannot be resolved: " + outstanding, warnings);
        }
        return resolved;
    }

    private static void fetchSecrets(Set<String> outstanding, Map<String, Secret> resolved, Supplier<List<Secret>> fetcher) {
        if (outstanding.isEmpty()) {
            return;
        }
        for (Secret secret : fetcher.get()) {
            if (outstanding.remove(secret.name())) {
                resolved.put(secret.name(), secret);
            }
        }
    }

    private static List<InfrastructureService> parseServices(
        RepositoryEnvironmentConfig config,
        Map<String, Secret> secrets
    ) {
        List<InfrastructureService> services = new ArrayList<>();
        for (RepositoryInfrastructureService declared : config.infrastructureServices()) {
            Secret username = secrets.get(declared.usernameSecret());
            Secret password = secrets.get(declared.passwordSecret());
            if (username != null && password != null) {
                services.add(new InfrastructureService(
                    declared.name(),
                    declared.url(),
                    declared.description(),
                    username,
                    password,
                    null,
                    null,
                    declared.credentialsTypes()
                ));
            }
        }
        return services;
    }

    private List<EnvironmentServiceDefinition> parseDefinitions(
        RepositoryEnvironmentConfig config,
        Hierarchy hierarchy,
        List<InfrastructureService> configServices,
        List<String> warnings
    ) throws EnvironmentConfigException {
        ServiceResolver resolver = new ServiceResolver(hierarchy, serviceRepository, configServices);

        List<EnvironmentServiceDefinition> definitions = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (Map.Entry<String, List<Map<String, String>>> entry : config.environmentDefinitions().entrySet()) {
            for (Map<String, String> properties : entry.getValue()) {
                Outcome<EnvironmentServiceDefinition> outcome = resolver.resolveService(properties)
                    .flatMap(service -> definitionFactory.createDefinition(entry.getKey(), service, properties));

                if (outcome instanceof Ok<EnvironmentServiceDefinition> ok) {
                    definitions.add(ok.value());
                } else if (outcome instanceof Fail<EnvironmentServiceDefinition> fail) {
                    failures.add(fail.message());
                }
            }
        }

        if (!failures.isEmpty()) {
            handleProblem(config, aggregate("Found invalid environment service definitions:", failures), warnings);
        }
        return definitions;
    }

    private static Set<EnvironmentVariableDefinition> parseVariables(
        RepositoryEnvironmentConfig config,
        Map<String, Secret> secrets,
        List<String> warnings
    ) throws EnvironmentConfigException {
        Set<EnvironmentVariableDefinition> variables = new LinkedHashSet<>();
        List<String> failures = new ArrayList<>();
        for (RepositoryEnvironmentVariable variable : config.environmentVariables()) {
            if (!variable.referencesSecret()) {
                variables.add(new LiteralVariable(variable.name(), variable.value()));
            } else if (secrets.containsKey(variable.secretName())) {
                variables.add(new SecretVariable(variable.name(), secrets.get(variable.secretName())));
            } else {
                failures.add(variable.toString());
            }
        }

        if (!failures.isEmpty()) {
            handleProblem(config, aggregate("Found invalid environment variable definitions:", failures), warnings);
        }
        return variables;
    }

    private static String aggregate(String title, List<String> lines) {
        StringBuilder message = new StringBuilder(title).append(System.lineSeparator());
        for (String line : lines) {
            message.append(line).append(System.lineSeparator());
        }
        return message.toString();
    }

    private static void handleProblem(RepositoryEnvironmentConfig config, String message, List<String> warnings)
        throws EnvironmentConfigException {
        if (config.strict()) {
            throw new EnvironmentConfigException(message);
        }
        log.warn(message);
        warnings.add(message);
    }
}
