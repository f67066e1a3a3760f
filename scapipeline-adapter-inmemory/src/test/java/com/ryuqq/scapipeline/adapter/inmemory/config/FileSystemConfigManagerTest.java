package com.ryuqq.scapipeline.adapter.inmemory.config;

import com.ryuqq.scapipeline.core.spi.ConfigException;
import com.ryuqq.scapipeline.core.spi.ConfigPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileSystemConfigManager 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileSystemConfigManagerTest {

    @TempDir
    Path root;

    private FileSystemConfigManager manager;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("main/rules/nested"));
        Files.createDirectories(root.resolve("release-1"));
        Files.writeString(root.resolve("main/rules/rules.kts"), "rules");
        Files.writeString(root.resolve("main/rules/nested/extra.kts"), "extra");
        Files.writeString(root.resolve("secrets.properties"), "artifactory/token=abc\n");
        manager = new FileSystemConfigManager(root);
    }

    @Test
    void resolveContext_null이면_기본_context() {
        assertThat(manager.resolveContext(null)).isEqualTo(FileSystemConfigManager.DEFAULT_CONTEXT);
        assertThat(manager.resolveContext("release-1")).isEqualTo("release-1");
    }

    @Test
    void resolveContext_디렉터리가_없으면_예외() {
        assertThatThrownBy(() -> manager.resolveContext("unknown"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("unknown");
    }

    @Test
    void resolveContext_root_밖을_가리키는_context는_거부함() {
        assertThatThrownBy(() -> manager.resolveContext("../../etc"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("outside of root");
        assertThatThrownBy(() -> manager.resolveContext("."))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("outside of root");
    }

    @Test
    void listFiles_root_밖을_가리키는_context는_거부함() {
        assertThatThrownBy(() -> manager.listFiles("..", new ConfigPath("rules")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("outside of root");
    }

    @Test
    void getFile_null_context는_기본_context에서_읽음() throws Exception {
        // when
        try (InputStream in = manager.getFile(null, new ConfigPath("rules/rules.kts"))) {
            // then
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("rules");
        }
        assertThat(manager.listFiles(null, new ConfigPath("rules"))).hasSize(2);
    }

    @Test
    void getFile_파일_내용을_반환함() throws Exception {
        // when
        try (InputStream in = manager.getFile("main", new ConfigPath("rules/rules.kts"))) {
            // then
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("rules");
        }
    }

    @Test
    void getFile_context_밖의_경로는_거부함() {
        assertThatThrownBy(() -> manager.getFile("main", new ConfigPath("../secrets.properties")))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void listFiles_하위_디렉터리까지_나열함() {
        // when & then
        assertThat(manager.listFiles("main", new ConfigPath("rules")))
            .containsExactly(new ConfigPath("rules/nested/extra.kts"), new ConfigPath("rules/rules.kts"));
    }

    @Test
    void listFiles_없는_디렉터리는_예외() {
        assertThatThrownBy(() -> manager.listFiles("main", new ConfigPath("missing")))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void getSecret_secrets_파일에서_읽음() {
        assertThat(manager.getSecret(new ConfigPath("artifactory/token"))).isEqualTo("abc");
        assertThatThrownBy(() -> manager.getSecret(new ConfigPath("missing")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void getSecret_context_디렉터리의_secrets_파일은_읽지_않음() throws Exception {
        // given
        Files.writeString(root.resolve("main/secrets.properties"), "only/main=x\n");

        // when & then
        assertThatThrownBy(() -> manager.getSecret(new ConfigPath("only/main")))
            .isInstanceOf(ConfigException.class);
    }
}
