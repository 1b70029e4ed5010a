package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declared shape of the artifact a specification must produce.
 *
 * @param name        schema name
 * @param description free-text description of the output
 * @param fields      named fields with declared types
 */
public record OutputSchema(
    String name,
    String description,
    List<OutputField> fields
) implements Serializable {

    public OutputSchema {
        description = description != null ? description : "";
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
