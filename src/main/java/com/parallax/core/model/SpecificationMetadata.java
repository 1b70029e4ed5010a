package com.parallax.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Provenance data attached to a specification by the upstream interview.
 *
 * @param specId         unique identifier of the specification
 * @param version        schema version of the document
 * @param createdAt      when the specification was produced
 * @param ambiguityScore residual ambiguity in [0, 1]; boxed so a missing value can be detected
 * @param interviewId    interview that produced the specification (nullable)
 * @param parentSpecId   specification this one was derived from (nullable)
 */
public record SpecificationMetadata(
    String specId,
    String version,
    Instant createdAt,
    Double ambiguityScore,
    String interviewId,
    String parentSpecId
) implements Serializable {}
