/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

public enum SignalIndication {
    R,
    YY,
    Y,
    YG,
    G;

    /**
     * Maps an aspect string to an indication. Unknown or missing values mean stop.
     */
    public static SignalIndication fromString(String value) {
        if (value == null) {
            return R;
        }
        return switch (value) {
            case "YY" -> YY;
            case "Y" -> Y;
            case "YG" -> YG;
            case "G" -> G;
            default -> R;
        };
    }
}
