package io.messageformat.core.testkit;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads function scenarios from YAML resources under {@code scenarios/}.
 *
 * <p>Each resource holds a list of scenarios:
 *
 * <pre>
 * - scenario: NUM-01
 *   name: minimum fraction digits
 *   function: number
 *   operand: 42
 *   options: {minimumFractionDigits: 2}
 *   expected: "42.00"
 * </pre>
 *
 * <p>YAML integers become {@link Integer} or {@link Long}, other numbers {@link java.math.BigDecimal}.
 * An {@code operand_type} of {@code instant}, {@code local-datetime} or {@code local-date} parses a
 * string operand into that {@code java.time} type first.
 */
public final class ScenarioLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ScenarioLoader() {}

    /**
     * Loads every scenario of a classpath resource.
     *
     * @param resource resource path, e.g. {@code scenarios/number.yaml}
     * @return unmodifiable list of scenarios in file order
     */
    public static List<ScenarioDefinition> load(String resource) throws IOException {
        try (InputStream in = ScenarioLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Scenario resource not found: " + resource);
            }
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || !root.isArray()) {
                throw new IOException("Scenario resource must hold a list: " + resource);
            }
            List<ScenarioDefinition> scenarios = new ArrayList<>();
            for (JsonNode node : root) {
                scenarios.add(parseScenario(node));
            }
            return Collections.unmodifiableList(scenarios);
        }
    }

    private static ScenarioDefinition parseScenario(JsonNode root) {
        String id = root.path("scenario").asText();
        String name = root.path("name").asText("");
        String function = root.path("function").asText();

        Object operand = operand(root.get("operand"), root.path("operand_type").asText(null));

        Map<String, Object> options = new LinkedHashMap<>();
        root.path("options").fields().forEachRemaining(e -> options.put(e.getKey(), scalar(e.getValue())));

        List<String> locales = strings(root.path("locales"));
        List<String> literalOptions = strings(root.path("literal_options"));

        String expected = root.has("expected") ? root.get("expected").asText() : null;
        boolean expectFallback = root.path("expected_fallback").asBoolean(false);
        List<String> expectedErrors = strings(root.path("expected_errors"));

        List<String> selectKeys = root.has("select_keys") ? strings(root.get("select_keys")) : null;
        List<String> expectedKeys = strings(root.path("expected_keys"));

        return new ScenarioDefinition(
                id,
                name,
                function,
                operand,
                options,
                locales,
                literalOptions,
                expected,
                expectFallback,
                expectedErrors,
                selectKeys,
                expectedKeys);
    }

    private static Object operand(JsonNode node, String type) {
        Object value = scalar(node);
        if (type == null || !(value instanceof String)) {
            return value;
        }
        String text = (String) value;
        switch (type) {
            case "instant":
                return Instant.parse(text);
            case "local-datetime":
                return LocalDateTime.parse(text);
            case "local-date":
                return LocalDate.parse(text);
            default:
                throw new IllegalArgumentException("Unknown operand_type: " + type);
        }
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else if (node.isTextual()) {
            values.add(node.asText());
        }
        return values;
    }

    /** One function call and the outcome it must produce. */
    public record ScenarioDefinition(
            String id,
            String name,
            String function,
            Object operand,
            Map<String, Object> options,
            List<String> locales,
            List<String> literalOptions,
            String expected,
            boolean expectFallback,
            List<String> expectedErrors,
            List<String> selectKeys,
            List<String> expectedKeys) {

        /** Whether the scenario also checks variant selection. */
        public boolean checksSelection() {
            return selectKeys != null;
        }

        /** Display name for JUnit parameterized test. */
        public String displayName() {
            return id + ": " + name;
        }

        @Override
        public String toString() {
            return displayName();
        }
    }
}
