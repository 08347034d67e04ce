package org.duplex.host.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("duplex.host.name");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_explicitFile_overridesReferenceDefaults() throws IOException {
        final File file = write("duplex.host { name = \"from-file\", enableGateway = true }");

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString("duplex.host.name")).isEqualTo("from-file");
        assertThat(config.getBoolean("duplex.host.enableGateway")).isTrue();
        assertThat(config.getInt("duplex.host.proxyPort")).isEqualTo(8080);
        assertThat(config.hasPath("duplex.host.services.health.className")).isTrue();
    }

    @Test
    void load_systemPropertyWinsOverFile() throws IOException {
        final File file = write("duplex.host.name = \"from-file\"");
        System.setProperty("duplex.host.name", "from-property");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString("duplex.host.name")).isEqualTo("from-property");
    }

    @Test
    void load_missingExplicitFile_isRejected() {
        final File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absent.conf");
    }

    private File write(final String content) throws IOException {
        final Path path = tempDir.resolve("duplex.conf");
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path.toFile();
    }
}
