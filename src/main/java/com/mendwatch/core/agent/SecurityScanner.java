package com.mendwatch.core.agent;

/**
 * Security scan run on the event loop on behalf of an agent.
 */
@FunctionalInterface
public interface SecurityScanner {

    SecurityScan scan();
}
