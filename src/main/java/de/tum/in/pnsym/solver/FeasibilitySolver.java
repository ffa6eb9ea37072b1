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
package de.tum.in.pnsym.solver;

import java.time.Duration;
import java.util.Optional;

/**
 * An external decision procedure for {@link FeasibilityModel}s. A call blocks until the solver
 * returns, the solver keeps no state between calls.
 */
@FunctionalInterface
public interface FeasibilitySolver {
    /**
     * Searches a 0/1 assignment satisfying all constraints of the {@code model}.
     *
     * @param model The model, which is not modified.
     * @param timeLimit Optional budget for this call. Running out of time yields an {@link
     *     SolverStatus#INCONCLUSIVE} result.
     */
    SolverResult solve(FeasibilityModel model, Optional<Duration> timeLimit);
}
