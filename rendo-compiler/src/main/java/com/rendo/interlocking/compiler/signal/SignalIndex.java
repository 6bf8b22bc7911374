/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.signal;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Dense integer ids for signal names so that visibility expansion works on int arrays
 * instead of name-keyed maps.
 */
public class SignalIndex {

    private final Object2IntMap<String> nameToId = new Object2IntOpenHashMap<>();
    private final List<String> idToName = new ArrayList<>();

    public SignalIndex() {
        nameToId.defaultReturnValue(-1);
    }

    /**
     * Returns the id of {@code name}, assigning the next free id on first use.
     */
    public int encode(String name) {
        int id = nameToId.getInt(name);
        if (id >= 0) {
            return id;
        }
        id = idToName.size();
        idToName.add(name);
        nameToId.put(name, id);
        return id;
    }

    /**
     * @return the name of {@code id}, or null when out of range
     */
    public String decode(int id) {
        if (id >= 0 && id < idToName.size()) {
            return idToName.get(id);
        }
        return null;
    }

    /**
     * @return the id of {@code name}, or -1 when it was never encoded
     */
    public int getId(String name) {
        return nameToId.getInt(name);
    }

    public int size() {
        return idToName.size();
    }
}
