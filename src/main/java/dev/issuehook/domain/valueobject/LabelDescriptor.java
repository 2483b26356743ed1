package dev.issuehook.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A label as carried on an issue. Only {@code name} is guaranteed; labels that
 * arrive as bare names have no id, color or description.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LabelDescriptor(Long id, String name, String color, String description) {
    public LabelDescriptor {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("label name required");
    }

    public static LabelDescriptor named(String name) {
        return new LabelDescriptor(null, name, null, null);
    }
}
