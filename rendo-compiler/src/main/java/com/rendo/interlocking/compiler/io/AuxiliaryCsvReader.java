/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the auxiliary CSV files ({@code 運転告知器.csv}, {@code 進路.csv}), whose rows have a
 * few fixed columns followed by a variable list of track circuit names.
 */
public class AuxiliaryCsvReader {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /**
     * An operation notification display row: name, station, up, down, track circuits.
     */
    public record OperationNotificationDisplayRow(
            String name, String stationId, boolean isUp, boolean isDown, List<String> trackCircuitNames) {
    }

    /**
     * A route lock row: route name followed by track circuits.
     */
    public record RouteTrackCircuitRow(String routeName, List<String> trackCircuitNames) {
    }

    public List<OperationNotificationDisplayRow> readOperationNotificationDisplays(Path file) throws IOException {
        List<OperationNotificationDisplayRow> result = new ArrayList<>();
        for (String[] cells : readRows(file)) {
            if (cells.length < 4 || cells[0].isBlank()) {
                continue;
            }
            result.add(new OperationNotificationDisplayRow(
                    cells[0].trim(),
                    cells[1].trim(),
                    parseFlag(cells[2]),
                    parseFlag(cells[3]),
                    names(cells, 4)));
        }
        return result;
    }

    public List<RouteTrackCircuitRow> readRouteTrackCircuits(Path file) throws IOException {
        List<RouteTrackCircuitRow> result = new ArrayList<>();
        for (String[] cells : readRows(file)) {
            if (cells.length < 1 || cells[0].isBlank()) {
                continue;
            }
            result.add(new RouteTrackCircuitRow(cells[0].trim(), names(cells, 1)));
        }
        return result;
    }

    private List<String[]> readRows(Path file) throws IOException {
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(file.toFile())) {
            List<String[]> all = rows.readAll();
            // first row is the header
            return all.isEmpty() ? all : all.subList(1, all.size());
        }
    }

    private static List<String> names(String[] cells, int from) {
        return Arrays.stream(cells, Math.min(from, cells.length), cells.length)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static boolean parseFlag(String cell) {
        String value = cell.trim();
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }
}
