package com.modelicaformatter.api.error;

/**
 * Severity of a formatter diagnostic. Only FATAL and ERROR make a result unsuccessful.
 */
public enum Severity {
    FATAL,   // file could not be read or the plugin crashed
    ERROR,   // formatting ran but the output must not be written
    WARNING, // suspicious input, e.g. an unmatched else or end if
    INFO;

    public boolean failsResult() {
        return this == FATAL || this == ERROR;
    }
}
