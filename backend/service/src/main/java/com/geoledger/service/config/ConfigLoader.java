package com.geoledger.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.geoledger.core.config.ConfigurationException;
import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads JSON configuration from a config directory. String values may reference environment
 * variables as {@code ${VAR}} or {@code ${VAR:default}}; an unset variable without a default
 * becomes the empty string.
 */
public final class ConfigLoader {
    public static final String PIPELINE_FILE = "pipeline.json";

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?}");

    private ConfigLoader() {
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        return loadPipeline(configDir, System::getenv);
    }

    public static PipelineConfig loadPipeline(Path configDir, Function<String, String> env) {
        Path path = configDir.resolve(PIPELINE_FILE);
        PipelineConfig config = read(path, env, new TypeReference<>() {
        });
        validate(config);
        return config;
    }

    /**
     * Default centroids extended with the entries of the optional centroids file.
     */
    public static CentroidRegistry loadCentroids(Path configDir, PipelineConfig config) {
        CentroidRegistry registry = CentroidRegistry.defaults();
        if (config.centroidsFile() == null || config.centroidsFile().isBlank()) {
            return registry;
        }
        Path path = configDir.resolve(config.centroidsFile());
        List<CentroidRegistry.Centroid> extra = read(path, System::getenv, new TypeReference<>() {
        });
        return registry.extendedWith(extra);
    }

    static String substitute(String value, Function<String, String> env) {
        Matcher matcher = ENV_REFERENCE.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String resolved = env.apply(matcher.group(1).trim());
            if (resolved == null) {
                resolved = matcher.group(2) == null ? "" : matcher.group(2);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static void validate(PipelineConfig config) {
        if (config.stages().isEmpty()) {
            throw ConfigurationException.missing("stages");
        }
        if (config.workers() < 1) {
            throw new ConfigurationException("workers", "Config key 'workers' must be at least 1");
        }
        for (int i = 0; i < config.stages().size(); i++) {
            StageConfig stage = config.stages().get(i);
            if (stage.id() == null || stage.id().isBlank()) {
                throw ConfigurationException.missing("stages[" + i + "].id");
            }
            if (stage.type() == null || stage.type().isBlank()) {
                throw ConfigurationException.missing("stages[" + i + "].type");
            }
        }
        long distinctIds = config.stages().stream().map(StageConfig::id).distinct().count();
        if (distinctIds != config.stages().size()) {
            throw new ConfigurationException("stages", "Stage ids must be unique");
        }
    }

    private static <T> T read(Path path, Function<String, String> env, TypeReference<T> ref) {
        if (!Files.exists(path)) {
            throw new ConfigurationException(path.toString(), "Config file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode tree = JsonUtils.objectMapper().readTree(in);
            return JsonUtils.objectMapper().convertValue(substituteTree(tree, env), ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException(path.toString(), "Failed loading config from " + path, e);
        }
    }

    private static JsonNode substituteTree(JsonNode node, Function<String, String> env) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(substituteTree(field.getValue(), env));
            }
            return object;
        }
        if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substituteTree(array.get(i), env));
            }
            return array;
        }
        if (node != null && node.isTextual()) {
            return TextNode.valueOf(substitute(node.asText(), env));
        }
        return node;
    }
}
