package com.mendwatch.core.agent;

import java.time.Instant;

public record AgentLogEntry(Instant timestamp, String level, String message) {}
