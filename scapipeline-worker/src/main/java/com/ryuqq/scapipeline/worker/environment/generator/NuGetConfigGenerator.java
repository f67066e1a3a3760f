package com.ryuqq.scapipeline.worker.environment.generator;

import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.definition.NuGetDefinition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@code NuGet.Config} with package sources and their cleartext credentials.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NuGetConfigGenerator implements EnvironmentConfigGenerator<NuGetDefinition> {

    public static final String FILE_NAME = "NuGet.Config";

    public static final String CONFIG_FILE_VARIABLE = "NUGET_CONFIG_FILE";

    @Override
    public Class<NuGetDefinition> definitionType() {
        return NuGetDefinition.class;
    }

    @Override
    public GeneratedFile generate(WorkerContext context, Path configDirectory, List<NuGetDefinition> definitions)
        throws IOException {
        StringBuilder sources = new StringBuilder();
        StringBuilder credentials = new StringBuilder();

        for (NuGetDefinition definition : definitions) {
            String key = XmlText.escape(definition.sourceName());
            sources.append("    <add key=\"").append(key)
                .append("\" value=\"").append(XmlText.escape(definition.sourcePath())).append('"');
            if (definition.sourceProtocolVersion() != null) {
                sources.append(" protocolVersion=\"")
                    .append(XmlText.escape(definition.sourceProtocolVersion())).append('"');
            }
            sources.append(" />\n");

            credentials.append("    <").append(key).append(">\n")
                .append("      <add key=\"Username\" value=\"")
                .append(XmlText.escape(context.resolveSecret(definition.service().usernameSecret())))
                .append("\" />\n")
                .append("      <add key=\"ClearTextPassword\" value=\"")
                .append(XmlText.escape(context.resolveSecret(definition.service().passwordSecret())))
                .append("\" />\n")
                .append("    </").append(key).append(">\n");
        }

        String xml = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
            + "<configuration>\n"
            + "  <packageSources>\n" + sources + "  </packageSources>\n"
            + "  <packageSourceCredentials>\n" + credentials + "  </packageSourceCredentials>\n"
            + "</configuration>\n";

        Path file = configDirectory.resolve(FILE_NAME);
        Files.writeString(file, xml, StandardCharsets.UTF_8);
        return new GeneratedFile(file, Map.of(CONFIG_FILE_VARIABLE, file.toAbsolutePath().toString()));
    }
}
