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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A linear inequality {@code sum(terms) >= bound} or {@code sum(terms) <= bound} over 0/1 variables.
 */
public final class LinearConstraint {
    public enum Comparison {
        AT_LEAST(">="),
        AT_MOST("<=");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        boolean holds(int value, int bound) {
            return this == AT_LEAST ? value >= bound : value <= bound;
        }
    }

    private final List<LinearTerm> terms;
    private final Comparison comparison;
    private final int bound;

    private LinearConstraint(List<LinearTerm> terms, Comparison comparison, int bound) {
        this.terms = List.copyOf(terms);
        this.comparison = comparison;
        this.bound = bound;
    }

    public static LinearConstraint atLeast(List<LinearTerm> terms, int bound) {
        return new LinearConstraint(terms, Comparison.AT_LEAST, bound);
    }

    public static LinearConstraint atMost(List<LinearTerm> terms, int bound) {
        return new LinearConstraint(terms, Comparison.AT_MOST, bound);
    }

    /**
     * The constant constraint {@code 0 >= 1}.
     */
    public static LinearConstraint unsatisfiable() {
        return atLeast(List.of(), 1);
    }

    /**
     * Forbids exactly the given assignment of the variables {@code 0, ..., width - 1}: the number of
     * variables agreeing with the assignment is at most {@code width - 1}, i.e. at least one differs.
     */
    public static LinearConstraint excluding(BitSet assignment, int width) {
        List<LinearTerm> terms = new ArrayList<>(width);
        for (int variable = 0; variable < width; variable++) {
            terms.add(assignment.get(variable)
                    ? LinearTerm.of(1, variable)
                    : LinearTerm.complementOf(1, variable));
        }
        return atMost(terms, width - 1);
    }

    public List<LinearTerm> terms() {
        return terms;
    }

    public Comparison comparison() {
        return comparison;
    }

    public int bound() {
        return bound;
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    public boolean isSatisfiedBy(BitSet assignment) {
        int value = 0;
        for (LinearTerm term : terms) {
            value += term.valueUnder(assignment);
        }
        return comparison.holds(value, bound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinearConstraint)) {
            return false;
        }
        LinearConstraint other = (LinearConstraint) o;
        return bound == other.bound && comparison == other.comparison && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return (terms.hashCode() * 31 + comparison.hashCode()) * 31 + bound;
    }

    @Override
    public String toString() {
        String left = terms.isEmpty()
                ? "0"
                : terms.stream().map(LinearTerm::toString).collect(Collectors.joining(" + "));
        return left + " " + comparison.symbol + " " + bound;
    }
}
