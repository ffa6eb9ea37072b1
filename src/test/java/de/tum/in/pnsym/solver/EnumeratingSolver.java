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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Returns the numerically smallest satisfying assignment, which makes the order of proposals
 * predictable. Only usable for few variables.
 */
public class EnumeratingSolver implements FeasibilitySolver {
    private final List<BitSet> proposals = new ArrayList<>();
    private int calls = 0;

    @Override
    public SolverResult solve(FeasibilityModel model, Optional<Duration> timeLimit) {
        calls += 1;
        int width = model.variableCount();
        for (long value = 0; value < (1L << width); value++) {
            BitSet assignment = BitSet.valueOf(new long[] {value});
            if (model.isSatisfiedBy(assignment)) {
                proposals.add(assignment);
                return SolverResult.optimal(assignment);
            }
        }
        return SolverResult.infeasible();
    }

    public List<BitSet> proposals() {
        return proposals;
    }

    public int calls() {
        return calls;
    }
}
