package com.mendwatch.core.agent;

/**
 * Result of one {@link SecurityScanner} run.
 *
 * @param score           0 to 100, higher is safer
 * @param vulnerabilities number of findings
 */
public record SecurityScan(int score, int vulnerabilities) {}
