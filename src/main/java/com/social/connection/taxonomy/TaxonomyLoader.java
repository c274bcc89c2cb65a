package com.social.connection.taxonomy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads taxonomy seed rows from JSON.
 *
 * <p>Expected format: an array of objects.</p>
 * <pre>
 * [
 *   {"category": "Professional", "name": "Mentor", "directionality": "Bidirectional",
 *    "approvalRequired": true, "reverseLabel": "Mentee", "defaultBucket": "Universal"}
 * ]
 * </pre>
 */
public class TaxonomyLoader {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);

    /** Classpath location of the bundled Relatives / Friend / Professional taxonomy. */
    public static final String DEFAULT_RESOURCE = "/taxonomy/default-relations.json";

    private static final TypeReference<List<TaxonomyEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TaxonomyLoader() {
        this(new ObjectMapper());
    }

    public TaxonomyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses seed rows from a stream. The stream is not closed.
     *
     * @throws UncheckedIOException if the content is not a valid seed array
     */
    public List<TaxonomyEntry> read(InputStream input) {
        try {
            List<TaxonomyEntry> entries = objectMapper.readValue(input, ENTRY_LIST);
            log.debug("Read {} taxonomy entries", entries.size());
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read taxonomy seed data", e);
        }
    }

    /**
     * Reads seed rows from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public List<TaxonomyEntry> readResource(String resource) {
        try (InputStream input = TaxonomyLoader.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException("Taxonomy resource not found: " + resource);
            }
            return read(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close taxonomy resource " + resource, e);
        }
    }

    public List<TaxonomyEntry> readDefaults() {
        return readResource(DEFAULT_RESOURCE);
    }

    /**
     * Seeds the store with the bundled taxonomy. Safe to run on every start-up.
     */
    public SeedResult seedDefaults(TaxonomyStore store) {
        SeedResult result = store.seed(readDefaults());
        log.info("taxonomy.defaults.loaded total={} inserted={} updated={}",
                result.total(), result.inserted(), result.updated());
        return result;
    }
}
