package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.model.SecretScope;
import com.ryuqq.scapipeline.core.outcome.Fail;
import com.ryuqq.scapipeline.core.outcome.Ok;
import com.ryuqq.scapipeline.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EnvironmentDefinitionFactoryTest {

    private static final InfrastructureService SERVICE = new InfrastructureService(
        "Nexus",
        "https://nexus.example.org/repository/npm/",
        null,
        Secret.create(1L, SecretScope.ORGANIZATION, 1L, "user", null),
        Secret.create(2L, SecretScope.ORGANIZATION, 1L, "password", null),
        1L,
        null,
        Set.of(CredentialsType.GIT_CREDENTIALS_FILE)
    );

    private final EnvironmentDefinitionFactory factory = EnvironmentDefinitionFactory.defaults();

    @Test
    void defaults는_maven_npm_nuget을_지원함() {
        assertThat(factory.createDefinition("maven", SERVICE, Map.of("id", "central"))).isInstanceOf(Ok.class);
        assertThat(factory.createDefinition("npm", SERVICE, Map.of())).isInstanceOf(Ok.class);
        assertThat(factory.createDefinition("nuget", SERVICE, Map.of("sourceName", "n", "sourcePath", "p")))
            .isInstanceOf(Ok.class);
    }

    @Test
    void createDefinition_maven() {
        Outcome<EnvironmentServiceDefinition> outcome =
            factory.createDefinition("maven", SERVICE, Map.of("service", "Nexus", "id", "central"));

        assertThat(outcome).isInstanceOfSatisfying(Ok.class, ok ->
            assertThat(ok.value()).isEqualTo(new MavenDefinition(SERVICE, null, "central"))
        );
    }

    @Test
    void createDefinition_credentialsTypes가_없으면_서비스_값을_사용함() {
        Outcome<EnvironmentServiceDefinition> outcome =
            factory.createDefinition("maven", SERVICE, Map.of("service", "Nexus", "id", "central"));

        assertThat(((Ok<EnvironmentServiceDefinition>) outcome).value().credentialsTypes())
            .containsExactly(CredentialsType.GIT_CREDENTIALS_FILE);
    }

    @Test
    void createDefinition_npm_credentialsTypes_재정의와_authMode() {
        Outcome<EnvironmentServiceDefinition> outcome = factory.createDefinition("npm", SERVICE, Map.of(
            "service", "Nexus",
            "scope", "@acme",
            "authMode", "password_auth_token",
            "credentialsTypes", "netrc_file, git_credentials_file"
        ));

        NpmDefinition npm = (NpmDefinition) ((Ok<EnvironmentServiceDefinition>) outcome).value();
        assertThat(npm.scope()).isEqualTo("@acme");
        assertThat(npm.authMode()).isEqualTo(NpmAuthMode.PASSWORD_AUTH_TOKEN);
        assertThat(npm.credentialsTypes())
            .containsExactlyInAnyOrder(CredentialsType.NETRC_FILE, CredentialsType.GIT_CREDENTIALS_FILE);
    }

    @Test
    void createDefinition_알_수_없는_타입은_실패() {
        Outcome<EnvironmentServiceDefinition> outcome =
            factory.createDefinition("gradle", SERVICE, Map.of("service", "Nexus"));

        assertThat(outcome).isInstanceOfSatisfying(Fail.class, fail -> {
            assertThat(fail.errorCode()).isEqualTo(EnvironmentDefinitionFactory.ERROR_UNKNOWN_TYPE);
            assertThat(fail.message()).contains("gradle");
        });
    }

    @Test
    void createDefinition_필수_속성_누락은_실패() {
        Outcome<EnvironmentServiceDefinition> outcome =
            factory.createDefinition("nuget", SERVICE, Map.of("service", "Nexus", "sourceName", "nexus"));

        assertThat(outcome).isInstanceOfSatisfying(Fail.class, fail -> {
            assertThat(fail.errorCode()).isEqualTo(EnvironmentDefinitionFactory.ERROR_INVALID_PROPERTIES);
            assertThat(fail.message()).contains("sourcePath");
        });
    }

    @Test
    void createDefinition_알_수_없는_속성은_실패() {
        Outcome<EnvironmentServiceDefinition> outcome =
            factory.createDefinition("maven", SERVICE, Map.of("service", "Nexus", "id", "x", "mirrorOf", "*"));

        assertThat(outcome).isInstanceOfSatisfying(Fail.class, fail ->
            assertThat(fail.message()).isEqualTo("Unknown properties for 'maven' definition: [mirrorOf]")
        );
    }

    @Test
    void createDefinition_잘못된_credentialsType은_실패() {
        Outcome<EnvironmentServiceDefinition> outcome = factory.createDefinition("maven", SERVICE, Map.of(
            "service", "Nexus", "id", "x", "credentialsTypes", "SSH_KEY"
        ));

        assertThat(outcome.isFail()).isTrue();
    }
}
