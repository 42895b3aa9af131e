package com.geoledger.service.config;

import com.geoledger.core.config.ConfigurationException;
import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.SkipRules;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageSettings;
import com.geoledger.stages.enrichment.EnrichmentStage;
import com.geoledger.stages.fallback.CentroidFallbackStage;
import com.geoledger.stages.resolver.AttributeLocationResolver;
import com.geoledger.stages.resolver.LocationResolver;
import com.geoledger.stages.resolver.ResolverStage;
import com.geoledger.stages.validation.RevalidationStage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds stages from configuration. Stage types:
 * <ul>
 *     <li>{@code resolver}: an external technique; {@code params.resolver} names a registered
 *     {@link LocationResolver} ({@code attributes} is built in)</li>
 *     <li>{@code centroid_fallback}: city centroid fallback</li>
 *     <li>{@code revalidation}: re-validates current results</li>
 *     <li>{@code enrichment}: jurisdiction enrichment, requires {@code params.jurisdictionFile}</li>
 * </ul>
 */
public class StageFactory {
    public static final String ATTRIBUTES_RESOLVER = "attributes";

    private final Path configDir;
    private final CentroidRegistry centroids;
    private final Map<String, LocationResolver> resolvers = new LinkedHashMap<>();

    public StageFactory(Path configDir, CentroidRegistry centroids) {
        this.configDir = Objects.requireNonNull(configDir, "configDir is required");
        this.centroids = Objects.requireNonNull(centroids, "centroids is required");
    }

    public StageFactory registerResolver(String name, LocationResolver resolver) {
        resolvers.put(name, resolver);
        return this;
    }

    public List<Stage> createAll(List<StageConfig> configs) {
        List<Stage> stages = new ArrayList<>();
        for (StageConfig config : configs) {
            stages.add(create(config));
        }
        return stages;
    }

    public Stage create(StageConfig config) {
        String type = config.type().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "resolver" -> {
                StageSettings settings = config.toSettings(SkipRules.defaults());
                yield new ResolverStage(settings, resolverFor(settings));
            }
            case "centroid_fallback" -> new CentroidFallbackStage(config.toSettings(SkipRules.defaults()), centroids);
            case "revalidation" -> new RevalidationStage(config.toSettings(RevalidationStage.defaultSettings().skipRules()));
            case "enrichment" -> EnrichmentStage.withJurisdictions(
                    config.toSettings(EnrichmentStage.defaultSettings().skipRules()),
                    configDir
            );
            default -> throw new ConfigurationException(
                    "stages." + config.id() + ".type",
                    "Unknown stage type '" + config.type() + "' for stage " + config.id()
            );
        };
    }

    private LocationResolver resolverFor(StageSettings settings) {
        String name = settings.requiredParam("resolver", String.class);
        if (ATTRIBUTES_RESOLVER.equals(name)) {
            Object technique = settings.params().getOrDefault("technique", settings.id().toUpperCase(Locale.ROOT));
            return new AttributeLocationResolver(technique.toString());
        }
        LocationResolver resolver = resolvers.get(name);
        if (resolver == null) {
            throw new ConfigurationException(
                    "stages." + settings.id() + ".params.resolver",
                    "No resolver registered under '" + name + "' for stage " + settings.id()
            );
        }
        return resolver;
    }
}
