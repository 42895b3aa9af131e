package com.geoledger.stages.enrichment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.util.JsonUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Looks up the jurisdiction containing a point. Regions are checked in file order; the first match wins.
 */
public class JurisdictionEnricher implements MetadataEnricher {
    private static final Logger LOGGER = Logger.getLogger(JurisdictionEnricher.class.getName());

    private final List<JurisdictionRegion> regions;

    public JurisdictionEnricher(List<JurisdictionRegion> regions) {
        this.regions = List.copyOf(regions);
    }

    public static JurisdictionEnricher load(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Jurisdiction file not found: " + path);
        }
        try {
            List<JurisdictionRegion> regions = JsonUtils.objectMapper().readValue(
                    path.toFile(),
                    new TypeReference<List<JurisdictionRegion>>() {
                    }
            );
            LOGGER.info("Loaded " + regions.size() + " jurisdictions from " + path);
            return new JurisdictionEnricher(regions);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read jurisdiction file " + path, e);
        }
    }

    @Override
    public Map<String, Object> enrich(Ticket ticket, Coordinates coordinates) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (JurisdictionRegion region : regions) {
            if (region.contains(coordinates)) {
                metadata.put("jurisdiction", region.name());
                if (region.type() != null) {
                    metadata.put("jurisdictionType", region.type());
                }
                metadata.putAll(region.attributes());
                metadata.put("jurisdictionFound", true);
                return metadata;
            }
        }
        metadata.put("jurisdictionFound", false);
        return metadata;
    }

    public int size() {
        return regions.size();
    }
}
