package com.splitttr.gateway.event;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jboss.logging.Logger;

public enum LogLevel {
    DEBUG("DEBUG", Logger.Level.DEBUG),
    INFO("INFO", Logger.Level.INFO),
    WARNING("WARNING", Logger.Level.WARN),
    ERROR("ERROR", Logger.Level.ERROR);

    private final String value;
    private final Logger.Level loggerLevel;

    LogLevel(String value, Logger.Level loggerLevel) {
        this.value = value;
        this.loggerLevel = loggerLevel;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Logger.Level loggerLevel() {
        return loggerLevel;
    }
}
