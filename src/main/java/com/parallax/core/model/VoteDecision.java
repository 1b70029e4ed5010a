package com.parallax.core.model;

public enum VoteDecision {
    APPROVED,
    REJECTED,
    CONDITIONAL
}
