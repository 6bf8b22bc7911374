/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.exceptions;

/**
 * Exception thrown when table compilation fails.
 *
 * <p>Carries the station being compiled and the lever or token that triggered the
 * failure so operators can locate the offending table cell. Any instance aborts the run.
 */
public class CompilationException extends RuntimeException {

    private final String stationId;
    private final String subject;

    public CompilationException(String message) {
        this(message, null, null);
    }

    public CompilationException(String message, String stationId, String subject) {
        super(format(message, stationId, subject));
        this.stationId = stationId;
        this.subject = subject;
    }

    public CompilationException(String message, String stationId, String subject, Throwable cause) {
        super(format(message, stationId, subject), cause);
        this.stationId = stationId;
        this.subject = subject;
    }

    /**
     * @return station id being compiled, or null when not station specific
     */
    public String getStationId() {
        return stationId;
    }

    /**
     * @return lever, token or object name the failure refers to, or null
     */
    public String getSubject() {
        return subject;
    }

    private static String format(String message, String stationId, String subject) {
        if (stationId == null && subject == null) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" [");
        if (stationId != null) {
            sb.append("station=").append(stationId);
        }
        if (subject != null) {
            if (stationId != null) {
                sb.append(", ");
            }
            sb.append("at=").append(subject);
        }
        return sb.append(']').toString();
    }
}
