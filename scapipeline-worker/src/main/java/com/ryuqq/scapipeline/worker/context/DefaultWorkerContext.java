package com.ryuqq.scapipeline.worker.context;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.model.SecretPath;
import com.ryuqq.scapipeline.core.spi.ConfigManager;
import com.ryuqq.scapipeline.core.spi.ConfigPath;
import com.ryuqq.scapipeline.core.spi.SecretNotFoundException;
import com.ryuqq.scapipeline.core.spi.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * {@link WorkerContext} 기본 구현.
 *
 * <p>{@link WorkerContextFactory}가 Run과 Hierarchy를 조회한 뒤 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DefaultWorkerContext implements WorkerContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkerContext.class);

    private static final String TEMP_DIR_PREFIX = "scapipeline-";

    private final Run run;
    private final Hierarchy hierarchy;
    private final SecretStore secretStore;
    private final ConfigManager configManager;

    private final SingleFlightCache<SecretPath, String> secretCache = new SingleFlightCache<>();
    private final SingleFlightCache<String, String> configSecretCache = new SingleFlightCache<>();
    private final SingleFlightCache<DownloadKey, Path> downloadCache = new SingleFlightCache<>();
    private final List<Path> tempDirectories = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object tempDirectoryLock = new Object();

    DefaultWorkerContext(Run run, Hierarchy hierarchy, SecretStore secretStore, ConfigManager configManager) {
        this.run = run;
        this.hierarchy = hierarchy;
        this.secretStore = secretStore;
        this.configManager = configManager;
    }

    @Override
    public Run getRun() {
        return run;
    }

    @Override
    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    @Override
    public String getConfigurationContext() {
        return run.resolvedJobConfigContext();
    }

    @Override
    public String resolveSecret(Secret secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        return secretCache.get(secret.path(), path ->
            secretStore.readSecret(path).orElseThrow(() -> new SecretNotFoundException(path))
        );
    }

    @Override
    public Map<Secret, String> resolveSecrets(Collection<Secret> secrets) {
        Map<Secret, String> values = new LinkedHashMap<>();
        for (Secret secret : secrets) {
            values.put(secret, resolveSecret(secret));
        }
        return values;
    }

    @Override
    public Map<String, PluginConfiguration> resolvePluginConfigSecrets(Map<String, PluginConfiguration> pluginConfigs) {
        if (pluginConfigs == null) {
            return Map.of();
        }

        Map<String, PluginConfiguration> resolved = new LinkedHashMap<>();
        pluginConfigs.forEach((plugin, config) -> {
            Map<String, String> secretValues = new LinkedHashMap<>();
            config.secrets().forEach((option, reference) ->
                secretValues.put(option, configSecretCache.get(reference, ref -> configManager.getSecret(new ConfigPath(ref))))
            );
            resolved.put(plugin, new PluginConfiguration(config.options(), secretValues));
        });
        return resolved;
    }

    @Override
    public Path downloadConfigurationFile(ConfigPath path, Path targetDirectory, String targetName) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (targetDirectory == null) {
            throw new IllegalArgumentException("targetDirectory cannot be null");
        }
        String fileName = targetName != null ? targetName : path.fileName();
        return downloadCache.get(new DownloadKey(path, targetDirectory, fileName), this::download);
    }

    @Override
    public Map<ConfigPath, Path> downloadConfigurationFiles(Collection<ConfigPath> paths, Path targetDirectory) {
        Map<ConfigPath, Path> files = new LinkedHashMap<>();
        for (ConfigPath path : paths) {
            files.put(path, downloadConfigurationFile(path, targetDirectory));
        }
        return files;
    }

    @Override
    public Map<ConfigPath, Path> downloadConfigurationDirectory(ConfigPath directory, Path targetDirectory) {
        Map<ConfigPath, Path> files = new LinkedHashMap<>();
        for (ConfigPath file : configManager.listFiles(getConfigurationContext(), directory)) {
            String relative = file.relativeTo(directory);
            int separator = relative.lastIndexOf('/');
            Path fileDirectory = separator < 0
                ? targetDirectory
                : targetDirectory.resolve(relative.substring(0, separator));
            files.put(file, downloadConfigurationFile(file, fileDirectory));
        }
        return files;
    }

    @Override
    public Path createTempDir() {
        synchronized (tempDirectoryLock) {
            if (closed.get()) {
                throw new IllegalStateException("Context for run " + run.id() + " is closed");
            }
            try {
                Path directory = Files.createTempDirectory(TEMP_DIR_PREFIX + run.id() + "-");
                tempDirectories.add(directory);
                return directory;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create temporary directory", e);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        secretCache.clear();
        configSecretCache.clear();
        downloadCache.clear();

        // createTempDir checks closed under the same lock, so nothing is added after this snapshot
        List<Path> directories;
        synchronized (tempDirectoryLock) {
            directories = List.copyOf(tempDirectories);
            tempDirectories.clear();
        }

        UncheckedIOException failure = null;
        for (Path directory : directories) {
            try {
                deleteRecursively(directory);
            } catch (IOException e) {
                log.warn("Failed to delete temporary directory {} of run {}", directory, run.id(), e);
                if (failure == null) {
                    failure = new UncheckedIOException("Failed to delete temporary directories of run " + run.id(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    private Path download(DownloadKey key) {
        Path target = key.targetDirectory().resolve(key.fileName());
        try (InputStream in = configManager.getFile(getConfigurationContext(), key.path())) {
            Files.createDirectories(key.targetDirectory());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded configuration file {} to {}", key.path(), target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to download configuration file " + key.path(), e);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
    }

    private record DownloadKey(ConfigPath path, Path targetDirectory, String fileName) {
    }
}
