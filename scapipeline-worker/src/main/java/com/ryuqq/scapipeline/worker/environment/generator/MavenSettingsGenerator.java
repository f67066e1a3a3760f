package com.ryuqq.scapipeline.worker.environment.generator;

import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.definition.MavenDefinition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a Maven {@code settings.xml} with one {@code <server>} per definition.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MavenSettingsGenerator implements EnvironmentConfigGenerator<MavenDefinition> {

    public static final String FILE_NAME = "settings.xml";

    /** Picked up through {@code MAVEN_ARGS} by Maven 3.9+. */
    public static final String MAVEN_ARGS_VARIABLE = "MAVEN_ARGS";

    @Override
    public Class<MavenDefinition> definitionType() {
        return MavenDefinition.class;
    }

    @Override
    public GeneratedFile generate(WorkerContext context, Path configDirectory, List<MavenDefinition> definitions)
        throws IOException {
        StringBuilder xml = new StringBuilder()
            .append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<settings xmlns=\"http://maven.apache.org/SETTINGS/1.0.0\">\n")
            .append("  <servers>\n");

        for (MavenDefinition definition : definitions) {
            xml.append("    <server>\n")
                .append("      <id>").append(XmlText.escape(definition.id())).append("</id>\n")
                .append("      <username>")
                .append(XmlText.escape(context.resolveSecret(definition.service().usernameSecret())))
                .append("</username>\n")
                .append("      <password>")
                .append(XmlText.escape(context.resolveSecret(definition.service().passwordSecret())))
                .append("</password>\n")
                .append("    </server>\n");
        }

        xml.append("  </servers>\n").append("</settings>\n");

        Path file = configDirectory.resolve(FILE_NAME);
        Files.writeString(file, xml.toString(), StandardCharsets.UTF_8);
        return new GeneratedFile(file, Map.of(MAVEN_ARGS_VARIABLE, "--settings " + file.toAbsolutePath()));
    }
}
