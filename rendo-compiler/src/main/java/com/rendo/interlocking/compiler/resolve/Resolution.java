/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.resolve;

import com.rendo.interlocking.api.exceptions.UnresolvedReferenceException;
import com.rendo.interlocking.api.model.InterlockingObject;

import java.util.List;

/**
 * Outcome of resolving one leaf token.
 *
 * <p>Exactly one of {@link Resolved}, {@link Skip} or {@link Fatal}. Skips are documented
 * table gaps that contribute nothing to the lock tree; fatal results abort compilation.
 */
public interface Resolution {

    static Resolution resolved(List<InterlockingObject> objects) {
        return new Resolved(objects);
    }

    static Resolution skip(String reason) {
        return new Skip(reason);
    }

    static Resolution fatal(UnresolvedReferenceException error) {
        return new Fatal(error);
    }

    /**
     * One or more objects matched, in lookup order.
     */
    record Resolved(List<InterlockingObject> objects) implements Resolution {
        public Resolved {
            if (objects.isEmpty()) {
                throw new IllegalArgumentException("Resolved requires at least one object");
            }
            objects = List.copyOf(objects);
        }
    }

    record Skip(String reason) implements Resolution {
    }

    record Fatal(UnresolvedReferenceException error) implements Resolution {
    }
}
