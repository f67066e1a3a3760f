package com.ryuqq.scapipeline.core.spi;

import java.io.InputStream;
import java.util.Set;

/**
 * Provider of configuration files and configuration secrets.
 *
 * <p>Files are read from a configuration repository. A <em>context</em> selects the revision of that
 * repository (for example a branch or tag); {@link #resolveContext} pins it to an immutable value so
 * that all stages of a run read the same revision.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConfigManager {

    /**
     * Resolves a context to a stable value.
     *
     * @param context the requested context (nullable for the default)
     * @return the resolved context
     * @throws ConfigException if the context cannot be resolved
     */
    String resolveContext(String context);

    /**
     * Opens a configuration file. The caller closes the stream.
     *
     * @param context the resolved context
     * @param path the file path
     * @return the file content
     * @throws ConfigException if the file does not exist or cannot be read
     */
    InputStream getFile(String context, ConfigPath path);

    /**
     * Lists the files below a directory, recursively.
     *
     * @param context the resolved context
     * @param directory the directory path
     * @return file paths
     * @throws ConfigException if the directory does not exist or cannot be read
     */
    Set<ConfigPath> listFiles(String context, ConfigPath directory);

    /**
     * Reads a configuration secret.
     *
     * @param path the secret path
     * @return the secret value
     * @throws ConfigException if the secret cannot be read
     */
    String getSecret(ConfigPath path);
}
