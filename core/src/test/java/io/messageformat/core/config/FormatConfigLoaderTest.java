package io.messageformat.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link FormatConfigLoader}: YAML parsing, defaults and the environment overlay. */
class FormatConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("messageformat.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void fullFile() throws IOException {
            Path file = write("""
                    locales: [fr-CA, en]
                    locale-matcher: lookup
                    functions:
                      draft: true
                    """);

            FormatConfig config = FormatConfigLoader.load(file, env::get);

            assertThat(config.locales()).containsExactly("fr-CA", "en");
            assertThat(config.localeMatcher()).isEqualTo("lookup");
            assertThat(config.draftFunctions()).isTrue();
        }

        @Test
        void localesAsCommaSeparatedString() throws IOException {
            FormatConfig config = FormatConfigLoader.load(write("locales: \"de, en\"\n"), env::get);

            assertThat(config.locales()).containsExactly("de", "en");
        }

        @Test
        void emptyFileGivesDefaults() throws IOException {
            FormatConfig config = FormatConfigLoader.load(write(""), env::get);

            assertThat(config).isEqualTo(FormatConfig.DEFAULT);
            assertThat(config.locales()).containsExactly("en-US");
            assertThat(config.localeMatcher()).isEqualTo("best fit");
            assertThat(config.draftFunctions()).isFalse();
        }

        @Test
        void missingFileIsConfigLoadException() {
            Path missing = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> FormatConfigLoader.load(missing, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void malformedYamlIsConfigLoadException() throws IOException {
            Path file = write("locales: [unclosed\n");

            assertThatThrownBy(() -> FormatConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("environment overlay")
    class Environment {

        @Test
        void environmentWinsOverFile() throws IOException {
            Path file = write("""
                    locales: [fr]
                    locale-matcher: lookup
                    """);
            env.put("MF2_LOCALES", "ar, he");
            env.put("MF2_LOCALE_MATCHER", " best fit ");
            env.put("MF2_DRAFT_FUNCTIONS", "TRUE");

            FormatConfig config = FormatConfigLoader.load(file, env::get);

            assertThat(config.locales()).containsExactly("ar", "he");
            assertThat(config.localeMatcher()).isEqualTo("best fit");
            assertThat(config.draftFunctions()).isTrue();
        }

        @Test
        void blankVariablesCountAsUnset() {
            env.put("MF2_LOCALES", "  ");
            env.put("MF2_LOCALE_MATCHER", "");

            assertThat(FormatConfigLoader.fromEnvironment(env::get)).isEqualTo(FormatConfig.DEFAULT);
        }

        @Test
        void invalidDraftFlagIsIgnoredWithWarning() {
            Logger logger = (Logger) LoggerFactory.getLogger(FormatConfigLoader.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                env.put("MF2_DRAFT_FUNCTIONS", "maybe");

                FormatConfig config = FormatConfigLoader.fromEnvironment(env::get);

                assertThat(config.draftFunctions()).isFalse();
                assertThat(appender.list).singleElement().satisfies(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.WARN);
                    assertThat(e.getFormattedMessage()).isEqualTo("Ignoring MF2_DRAFT_FUNCTIONS=maybe: expected true or false");
                });
            } finally {
                logger.detachAppender(appender);
                appender.stop();
            }
        }
    }

    @Test
    void builderFillsDefaults() {
        FormatConfig config = new FormatConfig(List.of(), " ", true);

        assertThat(config.locales()).containsExactly("en-US");
        assertThat(config.localeMatcher()).isEqualTo("best fit");
    }
}
