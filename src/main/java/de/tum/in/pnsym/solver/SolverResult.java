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

import de.tum.in.pnsym.bdd.BitSets;
import java.util.BitSet;
import java.util.Optional;
import javax.annotation.Nullable;

public final class SolverResult {
    private static final SolverResult INFEASIBLE = new SolverResult(SolverStatus.INFEASIBLE, null, "");

    private final SolverStatus status;
    @Nullable
    private final BitSet assignment;
    private final String detail;

    private SolverResult(SolverStatus status, @Nullable BitSet assignment, String detail) {
        this.status = status;
        this.assignment = assignment;
        this.detail = detail;
    }

    public static SolverResult optimal(BitSet assignment) {
        return new SolverResult(SolverStatus.OPTIMAL, BitSets.copyOf(assignment), "");
    }

    public static SolverResult infeasible() {
        return INFEASIBLE;
    }

    public static SolverResult inconclusive(String reason) {
        return new SolverResult(SolverStatus.INCONCLUSIVE, null, reason);
    }

    public SolverStatus status() {
        return status;
    }

    /**
     * The satisfying assignment, present iff the status is {@link SolverStatus#OPTIMAL}.
     */
    public Optional<BitSet> assignment() {
        return assignment == null ? Optional.empty() : Optional.of(BitSets.copyOf(assignment));
    }

    public String detail() {
        return detail;
    }

    @Override
    public String toString() {
        switch (status) {
            case OPTIMAL:
                return "optimal " + assignment;
            case INFEASIBLE:
                return "infeasible";
            case INCONCLUSIVE:
                return "inconclusive (" + detail + ")";
            default:
                throw new AssertionError(status);
        }
    }
}
