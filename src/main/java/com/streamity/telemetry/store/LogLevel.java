package com.streamity.telemetry.store;

/**
 * Level tags written between brackets after the entry timestamp.
 */
public enum LogLevel {
    INFO("INFO"),
    WARNING("WARNING"),
    ERROR("ERROR"),
    CLIENT_ERROR("CLIENT ERROR");

    private final String tag;

    LogLevel(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
