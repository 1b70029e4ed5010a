package com.parallax.core.model;

/**
 * Kind of work a specification describes. Each kind carries its own agent
 * capability set and prompt data through a registered profile.
 */
public enum TaskKind {
    CODE,
    RESEARCH,
    ANALYSIS
}
