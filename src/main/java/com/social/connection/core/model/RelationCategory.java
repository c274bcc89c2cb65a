package com.social.connection.core.model;

import java.util.Objects;

/**
 * Top-level relationship category such as "Relatives", "Friend" or "Professional".
 *
 * @param name the category name
 */
public record RelationCategory(String name) {

    public RelationCategory {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Category name must not be blank");
        }
        name = name.trim();
    }
}
