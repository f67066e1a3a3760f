package com.ryuqq.scapipeline.worker.environment.generator;

import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.definition.NpmDefinition;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Writes an {@code .npmrc} with registry and credentials entries.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NpmRcGenerator implements EnvironmentConfigGenerator<NpmDefinition> {

    public static final String FILE_NAME = ".npmrc";

    public static final String USER_CONFIG_VARIABLE = "NPM_CONFIG_USERCONFIG";

    @Override
    public Class<NpmDefinition> definitionType() {
        return NpmDefinition.class;
    }

    @Override
    public GeneratedFile generate(WorkerContext context, Path configDirectory, List<NpmDefinition> definitions)
        throws IOException {
        StringBuilder npmrc = new StringBuilder();

        for (NpmDefinition definition : definitions) {
            String url = definition.service().url();
            String registryKey = definition.scope() == null ? "registry" : "@" + stripAt(definition.scope()) + ":registry";
            npmrc.append(registryKey).append('=').append(url).append('\n');

            String prefix = authPrefix(url);
            String username = context.resolveSecret(definition.service().usernameSecret());
            String password = context.resolveSecret(definition.service().passwordSecret());
            switch (definition.authMode()) {
                case PASSWORD -> {
                    npmrc.append(prefix).append("username=").append(username).append('\n');
                    npmrc.append(prefix).append("_password=").append(base64(password)).append('\n');
                }
                case USERNAME_PASSWORD_AUTH ->
                    npmrc.append(prefix).append("_auth=").append(base64(username + ":" + password)).append('\n');
                case PASSWORD_AUTH_TOKEN ->
                    npmrc.append(prefix).append("_authToken=").append(password).append('\n');
            }
            if (definition.email() != null) {
                npmrc.append(prefix).append("email=").append(definition.email()).append('\n');
            }
        }

        Path file = configDirectory.resolve(FILE_NAME);
        Files.writeString(file, npmrc.toString(), StandardCharsets.UTF_8);
        return new GeneratedFile(file, Map.of(USER_CONFIG_VARIABLE, file.toAbsolutePath().toString()));
    }

    static String authPrefix(String url) {
        URI uri = URI.create(url);
        String path = uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath();
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        String port = uri.getPort() < 0 ? "" : ":" + uri.getPort();
        return "//" + uri.getHost() + port + path + ":";
    }

    private static String stripAt(String scope) {
        return scope.startsWith("@") ? scope.substring(1) : scope;
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
