package com.source.deblend.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.source.deblend.deblender.StrayFluxPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link DeblendOptions} from a JSON object.
 *
 * <pre>
 * {
 *   "edgeHandling": "noclip",
 *   "strayFluxToPointSources": "always",
 *   "maxNumberOfPeaks": 10,
 *   "parallelism": 4
 * }
 * </pre>
 *
 * <p>Keys left out keep their defaults. Enum values are case-insensitive.
 * Unknown keys and values of the wrong JSON type are rejected with
 * {@link IllegalArgumentException}.</p>
 */
public class DeblendOptionsLoader {
    private static final Logger log = LoggerFactory.getLogger(DeblendOptionsLoader.class);

    private final ObjectMapper objectMapper;

    public DeblendOptionsLoader() {
        this(new ObjectMapper());
    }

    public DeblendOptionsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DeblendOptions load(String json) {
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid deblend options JSON: " + e.getOriginalMessage(), e);
        }
    }

    public DeblendOptions load(InputStream input) {
        try {
            return fromTree(objectMapper.readTree(input));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid deblend options JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read deblend options", e);
        }
    }

    /**
     * Loads options from a classpath resource.
     */
    public DeblendOptions loadResource(String resource) {
        InputStream input = DeblendOptionsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (input == null) {
            throw new IllegalArgumentException("Resource not found: " + resource);
        }
        try (input) {
            return load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close resource " + resource, e);
        }
    }

    private DeblendOptions fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Deblend options must be a JSON object");
        }
        DeblendOptions.Builder builder = DeblendOptions.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            switch (name) {
                case "edgeHandling" -> builder.edgeHandling(
                        parseEnum(EdgeHandling.class, name, value));
                case "strayFluxToPointSources" -> builder.strayFluxToPointSources(
                        parseEnum(StrayFluxPolicy.class, name, value));
                case "findStrayFlux" -> builder.findStrayFlux(requireBoolean(name, value));
                case "assignStrayFlux" -> builder.assignStrayFlux(requireBoolean(name, value));
                case "clipStrayFluxFraction" -> builder.clipStrayFluxFraction(requireNumber(name, value));
                case "psfChisq1" -> builder.psfChisq1(requireNumber(name, value));
                case "psfChisq2" -> builder.psfChisq2(requireNumber(name, value));
                case "psfChisq2b" -> builder.psfChisq2b(requireNumber(name, value));
                case "maxNumberOfPeaks" -> builder.maxNumberOfPeaks(requireInt(name, value));
                case "tinyFootprintSize" -> builder.tinyFootprintSize(requireInt(name, value));
                case "parallelism" -> builder.parallelism(requireInt(name, value));
                default -> throw new IllegalArgumentException("Unknown deblend option: " + name);
            }
        }
        DeblendOptions options = builder.build();
        log.debug("options.loaded {}", options);
        return options;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, JsonNode value) {
        if (!value.isTextual()) {
            throw new IllegalArgumentException(name + " must be a string");
        }
        try {
            return Enum.valueOf(type, value.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value.asText(), e);
        }
    }

    private static boolean requireBoolean(String name, JsonNode value) {
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(name + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static double requireNumber(String name, JsonNode value) {
        if (!value.isNumber()) {
            throw new IllegalArgumentException(name + " must be a number");
        }
        return value.doubleValue();
    }

    private static int requireInt(String name, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
        return value.intValue();
    }
}
