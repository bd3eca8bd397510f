package io.keyexpr.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link KeyGenConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * key:
 *   expression: "key::%name%::#MONO_INCR#"
 *   delimiters:
 *     field: "%"
 *     generator: "#"
 * </pre>
 *
 * <p>{@code KEYGEN_EXPRESSION}, {@code KEYGEN_FIELD_DELIMITER} and {@code
 * KEYGEN_GENERATOR_DELIMITER} take precedence over the YAML values. A variable counts as set only
 * if it is defined and not blank after trimming.
 */
public final class KeyGenConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(KeyGenConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String ENV_EXPRESSION = "KEYGEN_EXPRESSION";
    public static final String ENV_FIELD_DELIMITER = "KEYGEN_FIELD_DELIMITER";
    public static final String ENV_GENERATOR_DELIMITER = "KEYGEN_GENERATOR_DELIMITER";

    private KeyGenConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or incomplete
     */
    public static KeyGenConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from the supplied
     * lookup. Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or incomplete
     * @throws io.keyexpr.core.error.InvalidDelimiterException if the resulting delimiters are
     *     unusable
     */
    public static KeyGenConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }

        KeyGenConfig config = mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
        LOG.info("Loaded key generator configuration from {}", configPath);
        return config;
    }

    private static KeyGenConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        KeyGenConfig.Builder builder = KeyGenConfig.builder();

        JsonNode key = root.path("key");
        String expression = key.hasNonNull("expression") ? key.get("expression").asText() : null;

        JsonNode delimiters = key.path("delimiters");
        if (delimiters.hasNonNull("field"))
            builder.fieldDelimiter(toDelimiter("key.delimiters.field", delimiters.get("field").asText()));
        if (delimiters.hasNonNull("generator"))
            builder.generatorDelimiter(
                    toDelimiter("key.delimiters.generator", delimiters.get("generator").asText()));

        // --- Environment variable overlay ---
        if (isSet(envLookup, ENV_EXPRESSION)) {
            LOG.debug("Applying environment override {}", ENV_EXPRESSION);
            expression = envLookup.apply(ENV_EXPRESSION);
        }
        envString(
                envLookup,
                ENV_FIELD_DELIMITER,
                value -> builder.fieldDelimiter(toDelimiter(ENV_FIELD_DELIMITER, value)));
        envString(
                envLookup,
                ENV_GENERATOR_DELIMITER,
                value -> builder.generatorDelimiter(toDelimiter(ENV_GENERATOR_DELIMITER, value)));

        if (expression == null) {
            throw new ConfigLoadException(
                    "Missing required key.expression (or " + ENV_EXPRESSION + " environment variable)");
        }
        return builder.expression(expression).build();
    }

    /** A delimiter must be exactly one character. */
    private static char toDelimiter(String name, String value) {
        if (value.length() != 1) {
            throw new ConfigLoadException(name + " must be a single character, got: '" + value + "'");
        }
        return value.charAt(0);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            LOG.debug("Applying environment override {}", envVar);
            setter.accept(envLookup.apply(envVar));
        }
    }
}
