package fr.lapetina.fleet.layout.infrastructure.config;

import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenconfigConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load settings from the classpath")
    void shouldLoadFromClasspath() {
        GenconfigConfig config = new GenconfigConfigLoader("genconfig-test.yaml").load();

        assertThat(config.defaultImages())
                .hasSize(ServiceRole.values().length - 2)
                .containsEntry(ServiceRole.WEBAPI, "img-webapi")
                .doesNotContainKeys(ServiceRole.RESHARD, ServiceRole.PROPELLER);
        assertThat(config.getOutput().isSummary()).isTrue();
        assertThat(config.getOutput().getDirectory()).isNull();
    }

    @Test
    @DisplayName("should prefer the file system over the classpath")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("settings.yaml");
        Files.writeString(file, "images:\n  storage: custom\noutput:\n  directory: /tmp/out\n  summary: false\n");

        GenconfigConfig config = new GenconfigConfigLoader(file.toString()).load();

        assertThat(config.defaultImages()).containsExactly(Map.entry(ServiceRole.STORAGE, "custom"));
        assertThat(config.getOutput().getDirectory()).isEqualTo("/tmp/out");
        assertThat(config.getOutput().isSummary()).isFalse();
    }

    @Test
    @DisplayName("should reject images for unknown services")
    void shouldRejectUnknownService() {
        String yaml = "images:\n  manatee: some-image\n";

        assertThatThrownBy(() -> new GenconfigConfigLoader().loadFromStream(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(GenconfigConfigLoader.ConfigurationException.class)
                .hasMessage("images[manatee]: invalid service name");
    }

    @Test
    @DisplayName("should reject unknown settings")
    void shouldRejectUnknownSection() {
        String yaml = "server:\n  port: 8080\n";

        assertThatThrownBy(() -> new GenconfigConfigLoader().loadFromStream(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(GenconfigConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should treat an empty document as defaults")
    void shouldAcceptEmptyDocument() {
        GenconfigConfig config = new GenconfigConfigLoader().loadFromStream(
                new ByteArrayInputStream(new byte[0]));

        assertThat(config.defaultImages()).isEmpty();
        assertThat(config.getOutput().isSummary()).isTrue();
    }

    @Test
    @DisplayName("should fail when the settings cannot be found")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new GenconfigConfigLoader(tempDir.resolve("none.yaml").toString()).load())
                .isInstanceOf(GenconfigConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
