package com.ryuqq.scapipeline.adapter.inmemory.config;

import com.ryuqq.scapipeline.core.spi.ConfigException;
import com.ryuqq.scapipeline.core.spi.ConfigManager;
import com.ryuqq.scapipeline.core.spi.ConfigPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * {@link ConfigManager} reading from a local directory.
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * root/
 *   secrets.properties      configuration secrets (key = secret path)
 *   main/                   one directory per context
 *     rules/rules.kts
 * </pre>
 *
 * <p>A null or blank context resolves to {@value #DEFAULT_CONTEXT}. Resolving fails for contexts
 * without a directory or pointing outside of the root. Secrets are shared by all contexts.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileSystemConfigManager implements ConfigManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemConfigManager.class);

    public static final String DEFAULT_CONTEXT = "main";

    public static final String SECRETS_FILE = "secrets.properties";

    private final Path root;

    public FileSystemConfigManager(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root;
    }

    @Override
    public String resolveContext(String context) {
        String resolved = orDefault(context);
        if (!Files.isDirectory(contextDirectory(resolved))) {
            throw new ConfigException("Unknown configuration context: '" + resolved + "'");
        }
        return resolved;
    }

    @Override
    public InputStream getFile(String context, ConfigPath path) {
        Path file = contextDirectory(context).resolve(path.path()).normalize();
        if (!file.startsWith(contextDirectory(context)) || !Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file not found: '" + path + "' in context '" + context + "'");
        }
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new ConfigException("Cannot read configuration file '" + path + "'", e);
        }
    }

    @Override
    public Set<ConfigPath> listFiles(String context, ConfigPath directory) {
        Path contextDir = contextDirectory(context);
        Path dir = contextDir.resolve(directory.path()).normalize();
        if (!dir.startsWith(contextDir) || !Files.isDirectory(dir)) {
            throw new ConfigException("Configuration directory not found: '" + directory + "' in context '" + context + "'");
        }

        Set<ConfigPath> files = new TreeSet<>((a, b) -> a.path().compareTo(b.path()));
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.filter(Files::isRegularFile)
                .map(file -> new ConfigPath(contextDir.relativize(file).toString().replace('\\', '/')))
                .forEach(files::add);
        } catch (IOException e) {
            throw new ConfigException("Cannot list configuration directory '" + directory + "'", e);
        }
        log.debug("Listed {} file(s) in {} ({})", files.size(), directory, context);
        return files;
    }

    @Override
    public String getSecret(ConfigPath path) {
        Path secretsFile = root.resolve(SECRETS_FILE);
        Properties secrets = new Properties();
        if (Files.isRegularFile(secretsFile)) {
            try (Reader reader = Files.newBufferedReader(secretsFile, StandardCharsets.UTF_8)) {
                secrets.load(reader);
            } catch (IOException e) {
                throw new ConfigException("Cannot read " + SECRETS_FILE, e);
            }
        }
        String value = secrets.getProperty(path.path());
        if (value == null) {
            throw new ConfigException("Configuration secret not found: '" + path + "'");
        }
        return value;
    }

    private Path contextDirectory(String context) {
        String resolved = orDefault(context);
        Path base = root.toAbsolutePath().normalize();
        Path dir = base.resolve(resolved).normalize();
        if (!dir.startsWith(base) || dir.equals(base)) {
            throw new ConfigException("Configuration context outside of root: '" + resolved + "'");
        }
        return dir;
    }

    private static String orDefault(String context) {
        return context == null || context.isBlank() ? DEFAULT_CONTEXT : context;
    }
}
