package com.parallax.core.model;

/**
 * Role a participant plays in consensus deliberation.
 */
public enum VoterRole {
    /** Argues the artifact's strengths. */
    ADVOCATE,
    /** Checks whether the artifact treats a symptom rather than the root requirement. */
    CRITIC,
    /** Weighs both positions and issues the final decision. */
    JUDGE
}
