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

public enum DeadlockStatus {
    /** A reachable dead marking was found. */
    FOUND,
    /** It is proven that no reachable dead marking exists. */
    INFEASIBLE,
    /** The solver could not decide the model. */
    UNKNOWN,
    /** The iteration limit was hit, nothing is known. */
    LIMIT_EXCEEDED;

    static DeadlockStatus of(DeadlockSearchState state) {
        switch (state) {
            case FOUND:
                return FOUND;
            case INFEASIBLE:
                return INFEASIBLE;
            case UNKNOWN:
                return UNKNOWN;
            case LIMIT_EXCEEDED:
                return LIMIT_EXCEEDED;
            default:
                throw new IllegalArgumentException("Not a terminal state: " + state);
        }
    }

    /**
     * Whether this status is a definite answer.
     */
    public boolean isConclusive() {
        return this == FOUND || this == INFEASIBLE;
    }
}
