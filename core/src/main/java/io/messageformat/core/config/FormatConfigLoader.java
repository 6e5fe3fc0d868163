package io.messageformat.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link FormatConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * locales: [fr-CA, en]
 * locale-matcher: lookup
 * functions:
 *   draft: true
 * </pre>
 *
 * <p>Missing keys receive the defaults of {@link FormatConfig#DEFAULT}. Environment variables
 * {@code MF2_LOCALES} (comma separated), {@code MF2_LOCALE_MATCHER} and {@code
 * MF2_DRAFT_FUNCTIONS} take precedence over the file. A variable counts as set only when it is
 * defined and not blank.
 */
public final class FormatConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FormatConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_LOCALES = "MF2_LOCALES";
    static final String ENV_LOCALE_MATCHER = "MF2_LOCALE_MATCHER";
    static final String ENV_DRAFT_FUNCTIONS = "MF2_DRAFT_FUNCTIONS";

    private FormatConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or is not valid YAML
     */
    public static FormatConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from {@code envLookup}
     * ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing or is not valid YAML
     */
    public static FormatConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        FormatConfig config = fromTree(root, envLookup);
        LOG.debug("Loaded configuration from {}: {}", configPath, config);
        return config;
    }

    /** Resolves configuration from environment variables alone. */
    public static FormatConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(null, envLookup);
    }

    private static FormatConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        FormatConfig.Builder builder = FormatConfig.builder();

        // --- YAML ---
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            JsonNode locales = root.path("locales");
            if (locales.isArray()) {
                List<String> tags = new ArrayList<>();
                locales.forEach(tag -> tags.add(tag.asText()));
                builder.locales(tags);
            } else if (locales.isTextual()) {
                builder.locales(splitLocales(locales.asText()));
            }
            if (root.has("locale-matcher")) {
                builder.localeMatcher(root.get("locale-matcher").asText());
            }
            JsonNode functions = root.path("functions");
            if (functions.has("draft")) {
                builder.draftFunctions(functions.get("draft").asBoolean());
            }
        }

        // --- Environment overlay ---
        if (isSet(envLookup, ENV_LOCALES)) {
            builder.locales(splitLocales(envLookup.apply(ENV_LOCALES)));
        }
        if (isSet(envLookup, ENV_LOCALE_MATCHER)) {
            builder.localeMatcher(envLookup.apply(ENV_LOCALE_MATCHER).trim());
        }
        if (isSet(envLookup, ENV_DRAFT_FUNCTIONS)) {
            String raw = envLookup.apply(ENV_DRAFT_FUNCTIONS).trim();
            if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
                builder.draftFunctions(Boolean.parseBoolean(raw));
            } else {
                LOG.warn("Ignoring {}={}: expected true or false", ENV_DRAFT_FUNCTIONS, raw);
            }
        }
        return builder.build();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static List<String> splitLocales(String raw) {
        List<String> tags = new ArrayList<>();
        for (String tag : raw.split(",")) {
            if (!tag.isBlank()) {
                tags.add(tag.trim());
            }
        }
        return tags;
    }
}
