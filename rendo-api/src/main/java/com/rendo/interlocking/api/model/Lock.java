/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Root of one lock condition tree gating a route or switching machine.
 *
 * @param routeLockGroup 1-based position among the locks of the same object and type
 */
public record Lock(long id, long objectId, LockType type, int routeLockGroup) {

    public Lock withId(long id) {
        return new Lock(id, objectId, type, routeLockGroup);
    }
}
