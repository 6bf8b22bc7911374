/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.resolve;

import com.rendo.interlocking.api.exceptions.UnresolvedReferenceException;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.compiler.expression.LockItem;
import com.rendo.interlocking.compiler.table.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps leaf tokens of a lock expression to registry objects.
 *
 * <p>Zero matches are fatal except for two known table gaps, which resolve to
 * {@link Resolution.Skip}: guide routes (tokens ending in {@code Z}) that are not modelled,
 * and the directional lever {@code 14} of {@code TH65}.
 */
public class NameResolver {

    private static final Logger logger = LoggerFactory.getLogger(NameResolver.class);

    // Lever reference inside a token, e.g. 12R or 3LZ
    private static final Pattern LEVER_REFERENCE = Pattern.compile("(\\d+)[RL](Z?)");
    // Closure block track circuit, e.g. 12T or 12
    private static final Pattern CLOSURE_BLOCK = Pattern.compile("^(\\d+)T?$");

    static final String PREFIX_TRACK_CIRCUIT_UP = "上り";
    static final String PREFIX_TRACK_CIRCUIT_DOWN = "下り";

    private static final char GUIDE_ROUTE_SUFFIX = 'Z';
    private static final String DIRECTIONAL_LEVER_STATION = "TH65";
    private static final String DIRECTIONAL_LEVER_PREFIX = "14";

    private final ResolutionIndex index;

    public NameResolver(ResolutionIndex index) {
        this.index = index;
    }

    /**
     * Resolves a leaf item.
     *
     * @param item     leaf carrying the token and its station
     * @param strategy lookup strategy of the column
     * @return resolved objects, a documented skip, or a fatal unresolved reference
     */
    public Resolution resolve(LockItem item, ResolutionStrategy strategy) {
        List<InterlockingObject> found = switch (strategy) {
            case SWITCHING_MACHINE -> searchSwitchingMachine(item);
            case GENERAL -> searchGeneral(item);
            case APPROACH -> searchApproach(item);
        };

        if (!found.isEmpty()) {
            logger.debug("Resolved {} {} -> {}", item.stationId(), item.name(), found.size());
            return Resolution.resolved(found);
        }

        String token = item.name();
        if (!token.isEmpty() && token.charAt(token.length() - 1) == GUIDE_ROUTE_SUFFIX) {
            logger.warn("Guide route not found, skipping: {} {}", item.stationId(), token);
            return Resolution.skip("guide route " + item.stationId() + " " + token);
        }
        if (DIRECTIONAL_LEVER_STATION.equals(item.stationId()) && token.startsWith(DIRECTIONAL_LEVER_PREFIX)) {
            logger.warn("Directional lever is not supported, skipping: {} {}", item.stationId(), token);
            return Resolution.skip("directional lever " + item.stationId() + " " + token);
        }
        return Resolution.fatal(new UnresolvedReferenceException(
                "No " + strategy.name().toLowerCase() + " object matches token", item.stationId(), token));
    }

    private List<InterlockingObject> searchSwitchingMachine(LockItem item) {
        return index.switchingMachine(TableNames.switchingMachine(item.stationId(), item.name()))
                .map(List::of)
                .orElse(List.of());
    }

    private List<InterlockingObject> searchGeneral(LockItem item) {
        String key = TableNames.toFullWidth(TableNames.route(item.stationId(), item.name(), ""));
        Optional<InterlockingObject> direct = index.object(key);
        if (direct.isPresent()) {
            return List.of(direct.get());
        }

        // A lever reference stands for every route of that lever
        Matcher matcher = LEVER_REFERENCE.matcher(item.name());
        if (matcher.find()) {
            String leverName = TableNames.lever(item.stationId(), matcher.group(1) + matcher.group(2));
            return index.routesOfLever(leverName);
        }
        return List.of();
    }

    private List<InterlockingObject> searchApproach(LockItem item) {
        List<InterlockingObject> general = searchGeneral(item);
        if (!general.isEmpty()) {
            return general;
        }

        return index.trackCircuit(closureTrackCircuitName(item.name()))
                .map(List::of)
                .orElse(List.of());
    }

    /**
     * Physical track circuit name of an approach lock token. Closure block numbers take
     * the up prefix when even and the down prefix when odd; other tokens are used as is.
     */
    static String closureTrackCircuitName(String token) {
        Matcher matcher = CLOSURE_BLOCK.matcher(token);
        if (!matcher.matches()) {
            return token;
        }
        String digits = matcher.group(1).replaceFirst("^0+(?=\\d)", "");
        int lastDigit = digits.charAt(digits.length() - 1) - '0';
        String prefix = lastDigit % 2 == 0 ? PREFIX_TRACK_CIRCUIT_UP : PREFIX_TRACK_CIRCUIT_DOWN;
        return prefix + digits + "T";
    }
}
