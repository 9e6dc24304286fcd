package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.datashape.core.error.ConfigLoadException;
import io.datashape.core.spi.ErrorMap;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link GlobalSettings} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * abort-early: true
 * debug: false
 * messages:
 *   invalid_type: "Wrong type"
 *   __default: "Invalid value"
 * </pre>
 *
 * <p>{@code messages} becomes the global dictionary error map. Unknown top-level keys and unknown
 * issue codes are rejected.
 *
 * <p>Environment overrides: {@code DATASHAPE_ABORT_EARLY} and {@code DATASHAPE_DEBUG}. A variable
 * counts as set only when it is defined and its trimmed value is non-empty.
 */
public final class GlobalConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_ABORT_EARLY = "DATASHAPE_ABORT_EARLY";
    static final String ENV_DEBUG = "DATASHAPE_DEBUG";

    private static final Set<String> KNOWN_KEYS = Set.of("abort-early", "debug", "messages");

    private GlobalConfigLoader() {
        // utility class
    }

    /** Loads settings from a file, applying overrides from {@link System#getenv}. */
    public static GlobalSettings load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads settings from a file, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or has invalid entries
     */
    public static GlobalSettings load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, configPath.toString());
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return read(in, configPath.toString(), envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e, configPath.toString());
        }
    }

    /**
     * Loads settings from a classpath resource.
     *
     * @throws ConfigLoadException if the resource does not exist or is invalid
     */
    public static GlobalSettings loadResource(String resource, Function<String, String> envLookup) {
        InputStream in = GlobalConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigLoadException("Configuration resource not found: " + resource, resource);
        }
        try (in) {
            return read(in, resource, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + resource, e, resource);
        }
    }

    private static GlobalSettings read(InputStream in, String source, Function<String, String> envLookup)
            throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + source, e, source);
        }
        boolean empty = root == null || root.isMissingNode() || root.isNull();
        GlobalSettings settings = mapToSettings(empty ? YAML_MAPPER.createObjectNode() : root, source);
        settings = applyEnvOverrides(settings, envLookup);
        LOG.info(
                "Loaded datashape configuration from {}: abortEarly={}, debug={}, messages={}",
                source,
                settings.options().abortEarly(),
                settings.options().debug(),
                settings.errorMap() != null);
        return settings;
    }

    private static GlobalSettings mapToSettings(JsonNode root, String source) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + source, source);
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                throw new ConfigLoadException("Unknown configuration key '" + name + "' in " + source, source);
            }
        }

        GlobalOptions options = GlobalOptions.DEFAULTS
                .withAbortEarly(boolOrDefault(root, "abort-early", false, source))
                .withDebug(boolOrDefault(root, "debug", false, source));

        ErrorMap errorMap = null;
        JsonNode messages = root.path("messages");
        if (!messages.isMissingNode() && !messages.isNull()) {
            if (!messages.isObject()) {
                throw new ConfigLoadException("'messages' must be a mapping of issue code to message", source);
            }
            Map<String, String> entries = new LinkedHashMap<>();
            messages.fields()
                    .forEachRemaining(field -> entries.put(field.getKey(), field.getValue().asText()));
            try {
                errorMap = ErrorMap.fromDictionary(entries);
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException(e.getMessage() + " in " + source, e, source);
            }
        }
        return new GlobalSettings(options, errorMap, DefaultIssueFormatter.INSTANCE);
    }

    private static GlobalSettings applyEnvOverrides(GlobalSettings settings, Function<String, String> envLookup) {
        GlobalOptions options = settings.options();
        if (isSet(envLookup, ENV_ABORT_EARLY)) {
            options = options.withAbortEarly(Boolean.parseBoolean(envLookup.apply(ENV_ABORT_EARLY).trim()));
        }
        if (isSet(envLookup, ENV_DEBUG)) {
            options = options.withDebug(Boolean.parseBoolean(envLookup.apply(ENV_DEBUG).trim()));
        }
        return new GlobalSettings(options, settings.errorMap(), settings.issueFormatter());
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue, String source) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("'" + field + "' must be a boolean in " + source, source);
        }
        return value.booleanValue();
    }
}
