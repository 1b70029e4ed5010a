package com.parallax.core.model;

import java.io.Serializable;

/**
 * One declared field of a specification's output schema.
 *
 * @param name        field name
 * @param type        declared type, e.g. "string", "number", "boolean", "array", "object"
 * @param description what the field holds
 * @param required    whether the artifact must provide the field
 */
public record OutputField(
    String name,
    String type,
    String description,
    boolean required
) implements Serializable {

    public OutputField {
        description = description != null ? description : "";
    }
}
