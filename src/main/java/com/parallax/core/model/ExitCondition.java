package com.parallax.core.model;

import java.io.Serializable;

/**
 * A condition under which the work described by a specification is considered finished.
 */
public record ExitCondition(
    String name,
    String description,
    String criteria
) implements Serializable {}
