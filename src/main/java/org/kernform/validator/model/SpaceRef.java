package org.kernform.validator.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Names the function space an argument is defined over.
 * <p>
 * Two references are equal only if their identifiers are equal, ignoring case.
 * Placeholder names such as {@code any_space_1} are ordinary symbols and never match
 * a different identifier.
 *
 * @param id The lower-cased space identifier.
 */
public record SpaceRef(String id) {

    public SpaceRef {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Space identifier must not be blank");
        }
        id = id.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Creates a space reference.
     * @param id The space identifier.
     * @return The reference.
     */
    public static SpaceRef of(String id) {
        return new SpaceRef(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
