package in.liqmap.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.liqmap.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Resolves the canonical TimeframeConfig for every timeframe.
 *
 * Starts from {@link TimeframeConfig#defaults(Timeframe)} and overlays the optional
 * {@code timeframes.json} in the config directory:
 * <pre>
 * {
 *   "1h": { "pivotLeft": 6, "pivotRight": 6 },
 *   "1m": { "maxZoneAgeCandles": 60 }
 * }
 * </pre>
 * A missing or unreadable file falls back to defaults. Values that fail validation, unknown
 * fields and unknown timeframe keys throw IllegalArgumentException.
 */
public final class TimeframeConfigService {
    private static final Logger log = LoggerFactory.getLogger(TimeframeConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONFIG_FILE = "timeframes.json";

    private final Path configFilePath;
    private final Map<Timeframe, TimeframeConfig> configs;

    public TimeframeConfigService(String configDir) {
        this.configFilePath = Paths.get(configDir, CONFIG_FILE);
        this.configs = Collections.unmodifiableMap(loadConfigs());
    }

    /**
     * Service with built-in defaults only.
     */
    public static TimeframeConfigService withDefaults() {
        return new TimeframeConfigService(Map.of());
    }

    private TimeframeConfigService(Map<Timeframe, TimeframeConfig> overrides) {
        this.configFilePath = null;
        Map<Timeframe, TimeframeConfig> resolved = defaultConfigs();
        resolved.putAll(overrides);
        this.configs = Collections.unmodifiableMap(resolved);
    }

    public TimeframeConfig getConfig(Timeframe timeframe) {
        return configs.get(timeframe);
    }

    /**
     * Config for a timeframe label; unknown labels resolve to the 5m config.
     */
    public TimeframeConfig getConfig(String timeframeLabel) {
        return getConfig(Timeframe.fromLabel(timeframeLabel).orElse(Timeframe.M5));
    }

    public Map<Timeframe, TimeframeConfig> getAll() {
        return configs;
    }

    private Map<Timeframe, TimeframeConfig> loadConfigs() {
        Map<Timeframe, TimeframeConfig> resolved = defaultConfigs();

        JsonNode root;
        try {
            if (!Files.exists(configFilePath)) {
                log.info("No timeframe config file found, using defaults: {}", configFilePath);
                return resolved;
            }
            root = MAPPER.readTree(Files.readString(configFilePath));
        } catch (IOException e) {
            log.error("Failed to load timeframe config file, using defaults: {}", e.getMessage(), e);
            return resolved;
        }

        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Timeframe config must be a JSON object: " + configFilePath);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Timeframe tf = Timeframe.fromLabel(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown timeframe in " + configFilePath + ": " + entry.getKey()));
            resolved.put(tf, applyOverrides(resolved.get(tf), entry.getValue(), tf));
        }

        log.info("Loaded timeframe config overrides from: {}", configFilePath);
        resolved.forEach((tf, cfg) -> log.info("  {} -> pivots {}/{}, maxAge {}, weight {}",
            tf, cfg.pivotLeft(), cfg.pivotRight(), cfg.maxZoneAgeCandles(), cfg.tfWeight()));
        return resolved;
    }

    /**
     * Overlay the JSON fields present in overrides on top of base.
     */
    static TimeframeConfig applyOverrides(TimeframeConfig base, JsonNode overrides, Timeframe tf) {
        if (overrides == null || !overrides.isObject()) {
            throw new IllegalArgumentException("Overrides for " + tf + " must be a JSON object");
        }
        ObjectNode merged = MAPPER.valueToTree(base);
        merged.setAll((ObjectNode) overrides);
        try {
            return MAPPER.treeToValue(merged, TimeframeConfig.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Invalid config for " + tf + ": " + cause.getMessage(), e);
        }
    }

    private static Map<Timeframe, TimeframeConfig> defaultConfigs() {
        Map<Timeframe, TimeframeConfig> map = new EnumMap<>(Timeframe.class);
        for (Timeframe tf : Timeframe.values()) {
            map.put(tf, TimeframeConfig.defaults(tf));
        }
        return map;
    }
}
