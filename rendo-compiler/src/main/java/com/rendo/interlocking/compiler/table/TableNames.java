/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.table;

/**
 * Naming conventions that turn table cells into registry object names.
 * Every name is prefixed with its station id.
 */
public final class TableNames {

    private TableNames() {
    }

    /** {@code <station>_W<start>} */
    public static String switchingMachine(String stationId, String start) {
        return stationId + "_W" + start;
    }

    /** {@code <station>_<start without R/L>} */
    public static String lever(String stationId, String start) {
        return stationId + "_" + start.replace("R", "").replace("L", "");
    }

    /** {@code <station>_<end without parentheses>P} */
    public static String destinationButton(String stationId, String end) {
        return stationId + "_" + end.replace("(", "").replace(")", "") + "P";
    }

    /**
     * {@code <station>_<start><end>}. A parenthesised end marks a route without a
     * destination button of its own and is left out.
     */
    public static String route(String stationId, String start, String end) {
        return stationId + "_" + start + (end.startsWith("(") ? "" : end);
    }

    /**
     * Replaces the half-width katakana used in lever tokens with their full-width form.
     */
    public static String toFullWidth(String value) {
        return value.replace('ｲ', 'イ').replace('ﾛ', 'ロ');
    }
}
