package com.streamity.telemetry.store;

/**
 * The independently rotated log files of the service.
 */
public enum LogCategory {
    /** Client error reports and general application events. */
    APPLICATION("app_errors.log"),
    /** Runtime errors of the service itself, including failures while logging. */
    RUNTIME("runtime_errors.log"),
    /** Database errors reported by the player backend. */
    DATABASE("database_errors.log");

    private final String defaultFileName;

    LogCategory(String defaultFileName) {
        this.defaultFileName = defaultFileName;
    }

    public String defaultFileName() {
        return defaultFileName;
    }
}
