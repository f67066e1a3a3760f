package com.ryuqq.scapipeline.worker.environment.generator;

import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.worker.context.WorkerContext;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@code .netrc} file with one {@code machine} entry per host.
 *
 * <p>When several services share a host, the first one wins.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NetRcGenerator {

    public static final String FILE_NAME = ".netrc";

    /**
     * Write the file.
     *
     * @param context context used to resolve service credentials
     * @param directory target directory
     * @param services services to include
     * @return path of the written file
     * @throws IOException if the file cannot be written
     */
    public Path generate(WorkerContext context, Path directory, Collection<InfrastructureService> services)
        throws IOException {
        Map<String, InfrastructureService> byHost = new LinkedHashMap<>();
        for (InfrastructureService service : services) {
            String host = host(service.url());
            if (host != null) {
                byHost.putIfAbsent(host, service);
            }
        }

        StringBuilder netrc = new StringBuilder();
        byHost.forEach((host, service) -> netrc.append("machine ").append(host)
            .append(" login ").append(context.resolveSecret(service.usernameSecret()))
            .append(" password ").append(context.resolveSecret(service.passwordSecret()))
            .append('\n'));

        Path file = directory.resolve(FILE_NAME);
        Files.writeString(file, netrc.toString(), StandardCharsets.UTF_8);
        return file;
    }

    static String host(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
