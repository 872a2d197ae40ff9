package com.mendwatch.core.agent;

import java.time.Instant;

/**
 * Security state of an agent.
 *
 * @param score           last known score
 * @param vulnerabilities last known finding count
 * @param lastScan        when the last successful scan completed (null before the first)
 * @param stale           true when the most recent scan failed and the values are carried over
 */
public record SecuritySnapshot(
    int score,
    int vulnerabilities,
    Instant lastScan,
    boolean stale
) {

    public static SecuritySnapshot initial() {
        return new SecuritySnapshot(100, 0, null, false);
    }

    public static SecuritySnapshot of(SecurityScan scan, Instant at) {
        return new SecuritySnapshot(scan.score(), scan.vulnerabilities(), at, false);
    }

    public SecuritySnapshot markStale() {
        return new SecuritySnapshot(score, vulnerabilities, lastScan, true);
    }
}
