package com.parallax.core.evaluation;

import com.parallax.core.model.CheckResult;
import com.parallax.core.model.CheckType;

/**
 * Runs one named mechanical check.
 */
public interface CheckRunner {

    CheckResult run(String name, CheckType type, String command);
}
