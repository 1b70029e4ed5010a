package com.parallax.core.model;

import java.io.Serializable;

/**
 * Outcome of one mechanical check.
 *
 * @param type    kind of check
 * @param name    configured check name
 * @param passed  whether the check passed
 * @param message one-line outcome
 * @param details captured output tail, empty when the check produced none
 */
public record CheckResult(
    CheckType type,
    String name,
    boolean passed,
    String message,
    String details
) implements Serializable {

    public CheckResult {
        message = message != null ? message : "";
        details = details != null ? details : "";
    }
}
