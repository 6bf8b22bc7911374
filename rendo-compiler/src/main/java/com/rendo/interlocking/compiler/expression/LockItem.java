/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

import com.rendo.interlocking.api.model.NR;

import java.util.List;

/**
 * Node of a parsed lock expression, before names are resolved to objects.
 *
 * @param kind         leaf or boolean combinator
 * @param name         token text for leaves, null for combinators
 * @param stationId    station the leaf name belongs to
 * @param reverse      position the referenced object must take
 * @param timerSeconds time condition attached by a {@code 但 N秒} suffix, or null
 * @param totalControl true inside a total control group
 * @param children     operands of a combinator, empty for leaves
 */
public record LockItem(
        Kind kind,
        String name,
        String stationId,
        NR reverse,
        Integer timerSeconds,
        boolean totalControl,
        List<LockItem> children
) {

    public enum Kind {
        LEAF,
        AND,
        OR,
        NOT
    }

    public LockItem {
        children = List.copyOf(children);
    }

    public static LockItem leaf(String name, String stationId, NR reverse, boolean totalControl) {
        return new LockItem(Kind.LEAF, name, stationId, reverse, null, totalControl, List.of());
    }

    public static LockItem and(List<LockItem> children, String stationId, NR reverse) {
        return new LockItem(Kind.AND, null, stationId, reverse, null, false, children);
    }

    public static LockItem or(List<LockItem> children, String stationId, NR reverse) {
        return new LockItem(Kind.OR, null, stationId, reverse, null, false, children);
    }

    public static LockItem not(LockItem child, String stationId, NR reverse) {
        return new LockItem(Kind.NOT, null, stationId, reverse, null, false, List.of(child));
    }

    /**
     * Wraps several items into an implicit AND. A single item is returned unchanged.
     */
    public static LockItem groupByAnd(List<LockItem> items) {
        if (items.size() == 1) {
            return items.get(0);
        }
        return new LockItem(Kind.AND, null, null, NR.NORMAL, null, false, items);
    }

    public LockItem withTimerSeconds(int seconds) {
        return new LockItem(kind, name, stationId, reverse, seconds, totalControl, children);
    }

    public boolean isLeaf() {
        return kind == Kind.LEAF;
    }
}
