package com.social.connection.taxonomy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.SubRelationRule;

/**
 * Raw seed row for the taxonomy, as read from a seed file.
 *
 * @param category         category name, e.g. "Relatives"
 * @param name             sub-relation name, e.g. "father"
 * @param directionality   "Unidirectional" or "Bidirectional"
 * @param approvalRequired whether the recipient has to approve; defaults to true
 * @param reverseLabel     canonical counterpart label, may be empty
 * @param defaultBucket    "Inner", "Outer", "Universal" (or legacy "Universe"), may be empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxonomyEntry(String category,
                            String name,
                            String directionality,
                            boolean approvalRequired,
                            String reverseLabel,
                            String defaultBucket) {

    @JsonCreator
    public static TaxonomyEntry fromJson(@JsonProperty("category") String category,
                                         @JsonProperty("name") String name,
                                         @JsonProperty("directionality") String directionality,
                                         @JsonProperty("approvalRequired") Boolean approvalRequired,
                                         @JsonProperty("reverseLabel") String reverseLabel,
                                         @JsonProperty("defaultBucket") String defaultBucket) {
        return new TaxonomyEntry(category, name, directionality,
                approvalRequired == null || approvalRequired,
                reverseLabel, defaultBucket);
    }

    /**
     * Converts this row into a validated rule.
     *
     * @throws IllegalArgumentException if a field cannot be parsed
     */
    public SubRelationRule toRule() {
        return SubRelationRule.builder()
                .category(category)
                .name(name)
                .directionality(Directionality.fromLabel(directionality))
                .approvalRequired(approvalRequired)
                .reverseLabel(reverseLabel)
                .defaultBucket(BucketType.parse(defaultBucket))
                .build();
    }
}
