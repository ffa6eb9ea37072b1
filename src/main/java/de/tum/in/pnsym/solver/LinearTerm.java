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

import java.util.BitSet;

/**
 * A term {@code coefficient * x} or, if negated, {@code coefficient * (1 - x)} over a 0/1 variable.
 */
public final class LinearTerm {
    private final int coefficient;
    private final int variable;
    private final boolean negated;

    private LinearTerm(int coefficient, int variable, boolean negated) {
        this.coefficient = coefficient;
        this.variable = variable;
        this.negated = negated;
    }

    public static LinearTerm of(int coefficient, int variable) {
        return new LinearTerm(coefficient, variable, false);
    }

    public static LinearTerm complementOf(int coefficient, int variable) {
        return new LinearTerm(coefficient, variable, true);
    }

    public int coefficient() {
        return coefficient;
    }

    public int variable() {
        return variable;
    }

    public boolean isNegated() {
        return negated;
    }

    public int valueUnder(BitSet assignment) {
        return assignment.get(variable) != negated ? coefficient : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinearTerm)) {
            return false;
        }
        LinearTerm other = (LinearTerm) o;
        return coefficient == other.coefficient && variable == other.variable && negated == other.negated;
    }

    @Override
    public int hashCode() {
        return (31 * coefficient + variable) * 2 + (negated ? 1 : 0);
    }

    @Override
    public String toString() {
        String literal = negated ? "(1 - x" + variable + ")" : "x" + variable;
        return coefficient == 1 ? literal : coefficient + "*" + literal;
    }
}
