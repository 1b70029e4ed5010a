package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A resource path written by two or more distinct work items within one level.
 *
 * @param path                  normalized resource path
 * @param itemIndices           sorted, distinct indices of the items that wrote it
 * @param resolved              whether the resolution session reconciled the writes
 * @param resolutionDescription what the resolution did (empty while unresolved)
 */
public record FileConflict(
    String path,
    List<Integer> itemIndices,
    boolean resolved,
    String resolutionDescription
) implements Serializable {

    public FileConflict {
        if (itemIndices == null || itemIndices.stream().distinct().count() < 2) {
            throw new IllegalArgumentException("A conflict needs at least two distinct items: " + path);
        }
        itemIndices = itemIndices.stream().distinct().sorted().toList();
        resolutionDescription = resolutionDescription != null ? resolutionDescription : "";
    }

    public static FileConflict detected(String path, List<Integer> itemIndices) {
        return new FileConflict(path, itemIndices, false, "");
    }

    public FileConflict resolve(String description) {
        return new FileConflict(path, itemIndices, true, description);
    }
}
