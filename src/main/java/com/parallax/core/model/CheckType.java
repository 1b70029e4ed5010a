package com.parallax.core.model;

/**
 * Kind of mechanical check run in the first evaluation stage.
 */
public enum CheckType {
    LINT,
    BUILD,
    TEST,
    STATIC,
    COVERAGE
}
