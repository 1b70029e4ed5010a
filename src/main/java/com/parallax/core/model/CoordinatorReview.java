package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a level's conflict-resolution session.
 *
 * @param levelNumber  level the review covers
 * @param conflicts    conflicts after resolution, each flagged resolved or not
 * @param summary      human-readable account of what was found and changed
 * @param fixesApplied individual fixes the session reported
 * @param warnings     warnings to carry into the next level
 * @param completed    false when the session failed and the conflicts were left as detected
 */
public record CoordinatorReview(
    int levelNumber,
    List<FileConflict> conflicts,
    String summary,
    List<String> fixesApplied,
    List<String> warnings,
    boolean completed
) implements Serializable {

    public CoordinatorReview {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        summary = summary != null ? summary : "";
        fixesApplied = fixesApplied != null ? List.copyOf(fixesApplied) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public long resolvedCount() {
        return conflicts.stream().filter(FileConflict::resolved).count();
    }
}
