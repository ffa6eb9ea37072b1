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

import de.tum.in.pnsym.bdd.Util;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A pure feasibility problem: binary variables {@code 0, ..., variableCount - 1} and linear
 * constraints over them, without objective. Constraints can only be added.
 */
public final class FeasibilityModel {
    private final List<String> variableNames;
    private final List<LinearConstraint> constraints = new ArrayList<>();

    public FeasibilityModel(List<String> variableNames) {
        this.variableNames = List.copyOf(variableNames);
    }

    public int variableCount() {
        return variableNames.size();
    }

    public String variableName(int variable) {
        return variableNames.get(variable);
    }

    public void add(LinearConstraint constraint) {
        for (LinearTerm term : constraint.terms()) {
            Util.checkArgument(
                    0 <= term.variable() && term.variable() < variableCount(), "Unknown variable %d", term.variable());
        }
        constraints.add(constraint);
    }

    public List<LinearConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    public boolean isSatisfiedBy(BitSet assignment) {
        return constraints.stream().allMatch(constraint -> constraint.isSatisfiedBy(assignment));
    }

    @Override
    public String toString() {
        return String.format("FeasibilityModel[%d variables, %d constraints]", variableCount(), constraints.size());
    }
}
