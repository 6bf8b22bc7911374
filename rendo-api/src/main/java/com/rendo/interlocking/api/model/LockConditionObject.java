/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Leaf of a lock tree naming the object whose state is checked.
 */
public record LockConditionObject(
        long id,
        long lockId,
        long objectId,
        Long parentId,
        Integer timerSeconds,
        NR reverse
) {

    public LockConditionObject withId(long id) {
        return new LockConditionObject(id, lockId, objectId, parentId, timerSeconds, reverse);
    }
}
