/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.rendo.interlocking.compiler.table.RendoTableRow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a station interlocking table. Columns are positional; the header row is skipped
 * and columns beyond the known ones are ignored.
 */
public class RendoTableReader {

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("name")
            .addColumn("start")
            .addColumn("end")
            .addColumn("indicator")
            .addColumn("approachTime")
            .addColumn("approachLock")
            .addColumn("lockToSwitchingMachine")
            .addColumn("lockToRoute")
            .addColumn("signalControl")
            .addColumn("routeLock")
            .build()
            .withSkipFirstDataRow(true);

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public List<RendoTableRow> read(Path file) throws IOException {
        try (MappingIterator<RendoTableRow> rows = csvMapper.readerFor(RendoTableRow.class)
                .with(SCHEMA)
                .readValues(file.toFile())) {
            return rows.readAll();
        }
    }
}
