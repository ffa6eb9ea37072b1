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
package de.tum.in.pnsym.analysis;

import de.tum.in.pnsym.bdd.Util;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
public abstract class DeadlockSearchConfiguration {
    public static final int DEFAULT_ITERATION_LIMIT = 1000;

    /**
     * Maximal number of solver calls before the search gives up.
     */
    @Value.Default
    public int iterationLimit() {
        return DEFAULT_ITERATION_LIMIT;
    }

    /**
     * Time budget of a single solver call. Unbounded if absent.
     */
    public abstract Optional<Duration> solverTimeLimit();

    @Value.Check
    protected void check() {
        Util.checkArgument(iterationLimit() > 0, "Iteration limit must be positive, got %d", iterationLimit());
        solverTimeLimit()
                .ifPresent(limit -> Util.checkArgument(
                        !limit.isNegative() && !limit.isZero(), "Solver time limit must be positive, got %s", limit));
    }
}
