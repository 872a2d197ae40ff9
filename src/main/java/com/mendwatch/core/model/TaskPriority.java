package com.mendwatch.core.model;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Maps an error severity onto the priority of the task that fixes it. */
    public static TaskPriority forSeverity(ErrorSeverity severity) {
        if (severity == null) {
            return MEDIUM;
        }
        return switch (severity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }
}
