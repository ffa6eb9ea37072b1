/*
 * This file is part of PNSym.
 * Copyright (c) 2026 The PNSym authors.
 *
 * PNSym is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PNSym is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PNSym. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.pnsym.bdd;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_INITIAL_NODE_TABLE_SIZE = 1024;
    public static final int DEFAULT_INITIAL_CACHE_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final double DEFAULT_CACHE_MAXIMUM_LOAD = 0.5d;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_NODE_TABLE_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public int initialCacheSize() {
        return DEFAULT_INITIAL_CACHE_SIZE;
    }

    /**
     * Fraction of occupied cache slots after which the operation cache is grown. Entries are never
     * overwritten, so this only controls probe lengths.
     */
    @Value.Default
    public double cacheMaximumLoad() {
        return DEFAULT_CACHE_MAXIMUM_LOAD;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must exceed 1, got %s", growthFactor());
        Util.checkArgument(
                0.0 < cacheMaximumLoad() && cacheMaximumLoad() < 1.0,
                "Cache load must be in (0, 1), got %s",
                cacheMaximumLoad());
    }
}
