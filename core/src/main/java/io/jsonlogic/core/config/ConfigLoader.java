package io.jsonlogic.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.jsonlogic.core.engine.OperatorRegistry;
import io.jsonlogic.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * engine:
 *   max-depth: 512
 *   unknown-operators: fail      # or literal
 * dates:
 *   zone: Europe/Amsterdam
 * operators:
 *   disabled: [log]
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults from {@link EngineConfig.Builder}. Env vars take precedence
 * over YAML values. An env var is considered "set" if and only if it is defined AND its trimmed
 * value is non-empty. {@code operators.disabled} may only name built-ins that are not reserved
 * control forms.
 */
public final class ConfigLoader {

    static final String ENV_MAX_DEPTH = "JSONLOGIC_MAX_DEPTH";
    static final String ENV_UNKNOWN_OPERATORS = "JSONLOGIC_UNKNOWN_OPERATORS";
    static final String ENV_DATE_ZONE = "JSONLOGIC_DATE_ZONE";
    static final String ENV_DISABLED_OPERATORS = "JSONLOGIC_DISABLED_OPERATORS";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * Returning {@code null} from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, source);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null) {
                root = MissingNode.getInstance();
            }
            return mapToConfig(root, envLookup, source);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e, source);
        }
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        if (!root.isMissingNode() && !root.isNull() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping", source);
        }
        EngineConfig.Builder builder = EngineConfig.builder();

        // --- YAML mapping ---

        JsonNode engine = root.path("engine");
        if (engine.has("max-depth")) {
            JsonNode maxDepth = engine.get("max-depth");
            if (!maxDepth.canConvertToInt() || !maxDepth.isIntegralNumber()) {
                throw new ConfigLoadException("engine.max-depth must be an integer, got: " + maxDepth, source);
            }
            builder.maxDepth(maxDepth.intValue());
        }
        if (engine.has("unknown-operators")) {
            builder.unknownOperatorPolicy(policy(engine.get("unknown-operators").asText(), source));
        }

        JsonNode dates = root.path("dates");
        if (dates.has("zone")) {
            builder.dateZone(zone(dates.get("zone").asText(), source));
        }

        JsonNode operators = root.path("operators");
        if (operators.has("disabled")) {
            JsonNode disabled = operators.get("disabled");
            if (!disabled.isArray()) {
                throw new ConfigLoadException("operators.disabled must be a list of operator names", source);
            }
            List<String> names = new ArrayList<>();
            disabled.forEach(name -> names.add(name.asText()));
            builder.disabledOperators(names);
        }

        // --- Env var overlay ---

        if (isSet(envLookup, ENV_MAX_DEPTH)) {
            String value = envLookup.apply(ENV_MAX_DEPTH).trim();
            try {
                builder.maxDepth(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_MAX_DEPTH + " must be an integer, got: '" + value + "'", e, source);
            }
        }
        if (isSet(envLookup, ENV_UNKNOWN_OPERATORS)) {
            builder.unknownOperatorPolicy(policy(envLookup.apply(ENV_UNKNOWN_OPERATORS), source));
        }
        if (isSet(envLookup, ENV_DATE_ZONE)) {
            builder.dateZone(zone(envLookup.apply(ENV_DATE_ZONE).trim(), source));
        }
        if (isSet(envLookup, ENV_DISABLED_OPERATORS)) {
            List<String> names = new ArrayList<>();
            for (String name : envLookup.apply(ENV_DISABLED_OPERATORS).split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
            builder.disabledOperators(names);
        }

        try {
            EngineConfig config = builder.build();
            OperatorRegistry.standard().withoutBuiltins(config.disabledOperators());
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e, source);
        }
    }

    private static UnknownOperatorPolicy policy(String value, String source) {
        try {
            return UnknownOperatorPolicy.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage(), e, source);
        }
    }

    private static ZoneId zone(String value, String source) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new ConfigLoadException("Invalid date zone: '" + value + "'", e, source);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }
}
