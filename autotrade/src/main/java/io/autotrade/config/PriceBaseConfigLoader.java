package io.autotrade.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.autotrade.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PriceBaseConfig}.
 *
 * Sources, in order:
 * 1. JSON file named by AUTOTRADE_CONFIG (env var or system property)
 * 2. {@code autotrade.json} on the classpath
 * 3. {@link PriceBaseConfig#defaults()}
 *
 * The file is overlaid on the defaults, then DB_URL / DB_USER / DB_PASS /
 * DB_POOL_SIZE override the database settings.
 */
public final class PriceBaseConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PriceBaseConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONFIG_ENV = "AUTOTRADE_CONFIG";
    public static final String CLASSPATH_RESOURCE = "autotrade.json";

    /**
     * @throws IllegalStateException if the configured file cannot be read or the result is invalid
     */
    public static PriceBaseConfig load() {
        PriceBaseConfig config = loadFile();
        config = config.withDatabase(
            Env.get("DB_URL", config.dbUrl()),
            Env.get("DB_USER", config.dbUser()),
            Env.get("DB_PASS", config.dbPassword()),
            Env.getInt("DB_POOL_SIZE", config.dbPoolSize()));

        if (!config.isValid()) {
            throw new IllegalStateException("Invalid price base configuration");
        }
        return config;
    }

    private static PriceBaseConfig loadFile() {
        String configured = Env.get(CONFIG_ENV, null);
        if (configured != null) {
            Path path = Path.of(configured);
            try {
                PriceBaseConfig config = parse(Files.readString(path));
                log.info("Loaded config from: {}", path);
                return config;
            } catch (IOException e) {
                log.error("Failed to load config file {}: {}", path, e.getMessage());
                throw new IllegalStateException("Cannot read config " + path, e);
            }
        }

        try (InputStream in = PriceBaseConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.info("No config file found, using defaults");
                return PriceBaseConfig.defaults();
            }
            PriceBaseConfig config = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Loaded config from classpath: {}", CLASSPATH_RESOURCE);
            return config;
        } catch (IOException e) {
            log.error("Failed to load classpath config: {}", e.getMessage());
            throw new IllegalStateException("Cannot read classpath config " + CLASSPATH_RESOURCE, e);
        }
    }

    /**
     * Parse a JSON document, keeping defaults for missing keys.
     */
    public static PriceBaseConfig parse(String json) throws IOException {
        ObjectNode merged = MAPPER.valueToTree(PriceBaseConfig.defaults());
        JsonNode overrides = MAPPER.readTree(json);
        if (overrides != null && overrides.isObject()) {
            merged.setAll((ObjectNode) overrides);
        } else if (overrides != null && !overrides.isMissingNode()) {
            throw new IOException("Config must be a JSON object");
        }
        return MAPPER.treeToValue(merged, PriceBaseConfig.class);
    }

    private PriceBaseConfigLoader() {}
}
