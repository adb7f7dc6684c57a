package com.dvc.core.catalog;

import com.dvc.config.DvcProperties;
import com.dvc.core.model.ChallengeDefinition;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the challenge catalog JSON ({@code {"challenges": [...]}}) once at start-up.
 * Unknown fields are ignored so catalogs may carry extra metadata.
 */
@Configuration
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectReader reader;

    public CatalogLoader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(CatalogFile.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public ChallengeCatalog challengeCatalog(DvcProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getCatalog().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("Challenge catalog not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ChallengeCatalog catalog = read(in, location);
            log.info("Loaded {} challenge(s) from {}", catalog.size(), location);
            return catalog;
        } catch (IOException e) {
            throw new CatalogException("Failed to read challenge catalog " + location, e);
        }
    }

    public ChallengeCatalog read(InputStream in, String source) throws IOException {
        CatalogFile file = reader.readValue(in);
        if (file.challenges() == null) {
            throw new CatalogException("Challenge catalog " + source + " has no 'challenges' array");
        }
        return new ChallengeCatalog(file.challenges(), source);
    }

    public record CatalogFile(
        @JsonProperty("schema_version") String schemaVersion,
        List<ChallengeDefinition> challenges
    ) {}
}
