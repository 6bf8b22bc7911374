/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

public enum RouteType {
    ARRIVING,
    DEPARTURE,
    GUIDE,
    SWITCH_SIGNAL,
    SWITCH_ROUTE
}
