/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.materialize;

import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.Lock;
import com.rendo.interlocking.api.model.LockCondition;
import com.rendo.interlocking.api.model.LockConditionObject;
import com.rendo.interlocking.api.model.LockConditionType;
import com.rendo.interlocking.api.model.LockType;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.SwitchingMachineRoute;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.expression.LockItem;
import com.rendo.interlocking.compiler.resolve.NameResolver;
import com.rendo.interlocking.compiler.resolve.Resolution;
import com.rendo.interlocking.compiler.resolve.ResolutionStrategy;

import java.util.List;

/**
 * Writes parsed lock groups into the registry as Lock / LockCondition / LockConditionObject
 * trees.
 *
 * <p>Each top-level group becomes one {@link Lock} numbered from 1. Combinators become
 * {@link LockCondition} rows under their parent, or directly under the lock when they are
 * the root; combinators without operands are dropped. A leaf that resolves to several
 * objects is wrapped in an implicit AND so that all of them must hold.
 */
public class LockGraphMaterializer {

    private final InterlockingRegistry registry;
    private final NameResolver resolver;

    public LockGraphMaterializer(InterlockingRegistry registry, NameResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    /**
     * Materializes the groups of one lock column.
     *
     * @param groups                   parsed top-level groups
     * @param objectId                 route or switching machine the locks gate
     * @param lockType                 type of the created locks
     * @param strategy                 resolution strategy of the column
     * @param emitSwitchingMachineRoutes true to record required positions of resolved switching machines
     * @return counts of rows written
     * @throws com.rendo.interlocking.api.exceptions.UnresolvedReferenceException when a leaf cannot be resolved
     */
    public MaterializationStats materialize(List<LockItem> groups,
                                            long objectId,
                                            LockType lockType,
                                            ResolutionStrategy strategy,
                                            boolean emitSwitchingMachineRoutes) {
        MaterializationStats stats = new MaterializationStats();
        for (int i = 0; i < groups.size(); i++) {
            Lock lock = registry.insertLock(new Lock(0, objectId, lockType, i + 1));
            stats.lockAdded();
            Target target = new Target(lock.id(), objectId, strategy, emitSwitchingMachineRoutes);
            materializeItem(groups.get(i), null, target, stats);
        }
        return stats;
    }

    private void materializeItem(LockItem item, Long parentId, Target target, MaterializationStats stats) {
        if (!item.isLeaf()) {
            if (item.children().isEmpty()) {
                return;
            }
            LockCondition condition = registry.insertLockCondition(
                    new LockCondition(0, target.lockId(), conditionType(item.kind()), parentId));
            stats.lockConditionAdded();
            for (LockItem child : item.children()) {
                materializeItem(child, condition.id(), target, stats);
            }
            return;
        }

        Resolution resolution = resolver.resolve(item, target.strategy());
        if (resolution instanceof Resolution.Fatal fatal) {
            throw fatal.error();
        }
        if (resolution instanceof Resolution.Skip) {
            stats.referenceSkipped();
            return;
        }

        List<InterlockingObject> objects = ((Resolution.Resolved) resolution).objects();
        Long leafParentId = parentId;
        if (objects.size() > 1) {
            LockCondition implicitAnd = registry.insertLockCondition(
                    new LockCondition(0, target.lockId(), LockConditionType.AND, parentId));
            stats.lockConditionAdded();
            leafParentId = implicitAnd.id();
        }

        for (InterlockingObject object : objects) {
            registry.insertLockConditionObject(new LockConditionObject(
                    0, target.lockId(), object.id(), leafParentId, item.timerSeconds(), item.reverse()));
            stats.lockConditionObjectAdded();

            if (target.emitSwitchingMachineRoutes() && object.type() == ObjectType.SWITCHING_MACHINE) {
                registry.insertSwitchingMachineRoute(
                        new SwitchingMachineRoute(target.objectId(), object.id(), item.reverse()));
                stats.switchingMachineRouteAdded();
            }
        }
    }

    private static LockConditionType conditionType(LockItem.Kind kind) {
        return switch (kind) {
            case AND -> LockConditionType.AND;
            case OR -> LockConditionType.OR;
            case NOT -> LockConditionType.NOT;
            case LEAF -> throw new IllegalArgumentException("Leaf is not a condition");
        };
    }

    private record Target(long lockId, long objectId, ResolutionStrategy strategy,
                          boolean emitSwitchingMachineRoutes) {
    }
}
