/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.signal;

import com.rendo.interlocking.api.model.NextSignal;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Computes bounded-depth "next visible signal" chains.
 *
 * <p>Depth 1 rows come straight from the topology. For depth 2 to {@link NextSignal#MAX_DEPTH},
 * a signal S that sees M at depth d-1, where M directly sees T, sees T at depth d through
 * source M, unless S already sees T at a lower depth. Only signals known to the registry
 * act as origins of expanded rows. Existing rows are never duplicated.
 */
public class SignalVisibilityExpander {

    private static final Logger logger = LoggerFactory.getLogger(SignalVisibilityExpander.class);

    /**
     * Computes the rows missing from {@code existing}.
     *
     * @param signalNames  registered signals, the origins of expanded rows
     * @param directEdges  configured next signals per signal, in document order
     * @param existing     rows already held by the registry
     * @return new rows in creation order: depth 1 first, then by increasing depth
     */
    public List<NextSignal> expand(Collection<String> signalNames,
                                   Map<String, List<String>> directEdges,
                                   Collection<NextSignal> existing) {
        SignalIndex index = new SignalIndex();
        LongSet knownPairs = new LongOpenHashSet();
        List<Int2ObjectMap<IntList>> byDepth = new ArrayList<>();
        for (int depth = 0; depth <= NextSignal.MAX_DEPTH; depth++) {
            byDepth.add(new Int2ObjectOpenHashMap<>());
        }

        for (NextSignal row : existing) {
            int origin = index.encode(row.signalName());
            int target = index.encode(row.targetSignalName());
            knownPairs.add(pair(origin, target));
            if (row.depth() >= 1 && row.depth() <= NextSignal.MAX_DEPTH) {
                edges(byDepth.get(row.depth()), origin).add(target);
            }
        }

        List<NextSignal> created = new ArrayList<>();

        for (Map.Entry<String, List<String>> entry : directEdges.entrySet()) {
            int origin = index.encode(entry.getKey());
            for (String targetName : entry.getValue()) {
                int target = index.encode(targetName);
                if (!knownPairs.add(pair(origin, target))) {
                    continue;
                }
                edges(byDepth.get(1), origin).add(target);
                created.add(new NextSignal(entry.getKey(), entry.getKey(), targetName, 1));
            }
        }

        IntList origins = new IntArrayList();
        for (String signalName : signalNames) {
            origins.add(index.encode(signalName));
        }

        Int2ObjectMap<IntList> direct = byDepth.get(1);
        for (int depth = 2; depth <= NextSignal.MAX_DEPTH; depth++) {
            Int2ObjectMap<IntList> previous = byDepth.get(depth - 1);
            Int2ObjectMap<IntList> current = byDepth.get(depth);
            int before = created.size();

            for (int i = 0; i < origins.size(); i++) {
                int origin = origins.getInt(i);
                IntList intermediates = previous.get(origin);
                if (intermediates == null) {
                    continue;
                }
                for (int j = 0; j < intermediates.size(); j++) {
                    int intermediate = intermediates.getInt(j);
                    IntList targets = direct.get(intermediate);
                    if (targets == null) {
                        continue;
                    }
                    for (int k = 0; k < targets.size(); k++) {
                        int target = targets.getInt(k);
                        if (!knownPairs.add(pair(origin, target))) {
                            continue;
                        }
                        edges(current, origin).add(target);
                        created.add(new NextSignal(
                                index.decode(origin), index.decode(intermediate), index.decode(target), depth));
                    }
                }
            }
            logger.debug("Depth {}: {} next signal rows", depth, created.size() - before);
        }

        logger.info("Expanded {} next signal rows over {} signals", created.size(), index.size());
        return created;
    }

    private static IntList edges(Int2ObjectMap<IntList> map, int origin) {
        IntList list = map.get(origin);
        if (list == null) {
            list = new IntArrayList();
            map.put(origin, list);
        }
        return list;
    }

    private static long pair(int origin, int target) {
        return ((long) origin << 32) | (target & 0xFFFFFFFFL);
    }
}
