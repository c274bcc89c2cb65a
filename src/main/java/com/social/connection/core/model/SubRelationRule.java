package com.social.connection.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Taxonomy rule for one sub-relation label ("father", "mentor", "friend").
 *
 * A rule belongs to exactly one {@link RelationCategory} and tells the engine how the
 * label is mirrored to the other participant and which bucket it defaults to.
 */
public final class SubRelationRule {

    private final RelationCategory category;
    private final String name;
    private final Directionality directionality;
    private final boolean approvalRequired;
    private final String reverseLabel;
    private final BucketType defaultBucket;

    private SubRelationRule(Builder builder) {
        this.category = Objects.requireNonNull(builder.category, "category is required");
        this.name = Objects.requireNonNull(builder.name, "name is required").trim();
        this.directionality = Objects.requireNonNull(builder.directionality, "directionality is required");
        this.approvalRequired = builder.approvalRequired;
        this.reverseLabel = builder.reverseLabel != null ? builder.reverseLabel.trim() : "";
        this.defaultBucket = builder.defaultBucket;
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Sub-relation name must not be blank");
        }
    }

    public RelationCategory getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public Directionality getDirectionality() {
        return directionality;
    }

    public boolean isBidirectional() {
        return directionality == Directionality.BIDIRECTIONAL;
    }

    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    /**
     * Canonical counterpart label; empty when the rule defines none.
     */
    public String getReverseLabel() {
        return reverseLabel;
    }

    /**
     * Default bucket, or empty when the rule leaves it unset.
     */
    public Optional<BucketType> getDefaultBucket() {
        return Optional.ofNullable(defaultBucket);
    }

    /**
     * Case-insensitive name match.
     */
    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate.trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubRelationRule that = (SubRelationRule) o;
        return approvalRequired == that.approvalRequired
                && category.equals(that.category)
                && name.equals(that.name)
                && directionality == that.directionality
                && reverseLabel.equals(that.reverseLabel)
                && defaultBucket == that.defaultBucket;
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name, directionality, approvalRequired, reverseLabel, defaultBucket);
    }

    @Override
    public String toString() {
        return "SubRelationRule{" +
                "category='" + category.name() + '\'' +
                ", name='" + name + '\'' +
                ", directionality=" + directionality +
                ", reverseLabel='" + reverseLabel + '\'' +
                ", defaultBucket=" + defaultBucket +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .category(category)
                .name(name)
                .directionality(directionality)
                .approvalRequired(approvalRequired)
                .reverseLabel(reverseLabel)
                .defaultBucket(defaultBucket);
    }

    public static class Builder {
        private RelationCategory category;
        private String name;
        private Directionality directionality;
        private boolean approvalRequired = true;
        private String reverseLabel;
        private BucketType defaultBucket;

        public Builder category(RelationCategory category) {
            this.category = category;
            return this;
        }

        public Builder category(String categoryName) {
            this.category = new RelationCategory(categoryName);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder directionality(Directionality directionality) {
            this.directionality = directionality;
            return this;
        }

        public Builder approvalRequired(boolean approvalRequired) {
            this.approvalRequired = approvalRequired;
            return this;
        }

        public Builder reverseLabel(String reverseLabel) {
            this.reverseLabel = reverseLabel;
            return this;
        }

        public Builder defaultBucket(BucketType defaultBucket) {
            this.defaultBucket = defaultBucket;
            return this;
        }

        public SubRelationRule build() {
            return new SubRelationRule(this);
        }
    }
}
