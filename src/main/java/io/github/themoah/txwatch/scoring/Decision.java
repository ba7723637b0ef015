package io.github.themoah.txwatch.scoring;

import io.github.themoah.txwatch.model.Severity;

/**
 * Severity with the evidence that produced it.
 *
 * @param severity the decided severity
 * @param reason human-readable evidence
 */
public record Decision(Severity severity, String reason) {}
