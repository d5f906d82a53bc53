package de.zeus.planner.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.planner.exception.PlannerConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies per-run overrides to the bound configuration without touching the bean itself.
 * <p>
 * Overrides are a nested map using the Java property names, e.g.
 * {@code {"risk": {"riskAppetite": 1}}}. Nested maps are merged key by key, any other
 * value replaces the configured one. Unknown keys are rejected.
 */
@Component
public class PlannerConfigMerger {

    private static final Logger logger = LoggerFactory.getLogger(PlannerConfigMerger.class);

    private static final TypeReference<Map<String, Object>> TREE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PlannerConfigMerger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * @return a validated copy of {@code base} with {@code overrides} applied; {@code base}
     * itself when there is nothing to apply.
     */
    public PlannerProperties merge(PlannerProperties base, Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return base;
        }
        Map<String, Object> tree = objectMapper.convertValue(base, TREE_TYPE);
        deepMerge(tree, overrides);

        PlannerProperties merged;
        try {
            merged = objectMapper.convertValue(tree, PlannerProperties.class);
        } catch (IllegalArgumentException ex) {
            throw new PlannerConfigurationException("Invalid configuration override: " + ex.getMessage(), ex);
        }
        PlannerConfigValidator.validate(merged);
        logger.debug("Applied configuration overrides for keys {}", overrides.keySet());
        return merged;
    }

    static void deepMerge(Map<String, Object> target, Map<String, Object> overrides) {
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            Object existing = target.get(key);
            if (value instanceof Map && existing instanceof Map) {
                Map<String, Object> nested = stringKeys((Map<?, ?>) existing);
                deepMerge(nested, stringKeys((Map<?, ?>) value));
                target.put(key, nested);
            } else if (value instanceof Map) {
                target.put(key, stringKeys((Map<?, ?>) value));
            } else {
                target.put(key, value);
            }
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
