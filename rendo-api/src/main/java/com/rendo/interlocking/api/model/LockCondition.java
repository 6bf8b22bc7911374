/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Boolean combinator inside a lock tree. A null parent places the node directly under the lock.
 */
public record LockCondition(long id, long lockId, LockConditionType type, Long parentId) {

    public LockCondition withId(long id) {
        return new LockCondition(id, lockId, type, parentId);
    }
}
