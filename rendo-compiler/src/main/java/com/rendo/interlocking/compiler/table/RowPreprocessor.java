/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.table;

import java.util.List;

/**
 * Normalises the human-oriented shorthand of an interlocking table.
 *
 * <p>Blank or ditto (同…) names and blank start levers are filled from the nearest
 * preceding row. Rows continuing the same start lever inherit the approach time and
 * approach lock of the first row of that lever, which is the only row the table
 * records them on. No name resolution happens here.
 */
public class RowPreprocessor {

    private static final char DITTO_MARK = '同';

    /**
     * Normalises {@code rows} in place, in table order.
     *
     * @param rows rows of one station table
     */
    public void preprocess(List<RendoTableRow> rows) {
        String previousName = "";
        String previousStart = "";
        String rememberedApproachTime = "";
        String rememberedApproachLock = "";

        for (RendoTableRow row : rows) {
            if (row.getName().isBlank() || row.getName().charAt(0) == DITTO_MARK) {
                row.setName(previousName);
            } else {
                previousName = row.getName();
            }

            if (row.getStart().isBlank()) {
                row.setStart(previousStart);
            }

            if (!previousStart.equals(row.getStart())) {
                rememberedApproachTime = row.getApproachTime();
                rememberedApproachLock = row.getApproachLock();
            } else {
                row.setApproachTime(rememberedApproachTime);
                row.setApproachLock(rememberedApproachLock);
            }

            previousStart = row.getStart();
        }
    }
}
