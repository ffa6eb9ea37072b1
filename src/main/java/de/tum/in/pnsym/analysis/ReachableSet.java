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

import de.tum.in.pnsym.bdd.Bdd;
import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.ReachabilityOracle;
import java.math.BigInteger;

/**
 * The converged set of reachable markings, a diagram over the current-state variables only.
 */
public final class ReachableSet implements ReachabilityOracle {
    private final VariableLayout layout;
    private final int node;
    private final int iterations;

    ReachableSet(VariableLayout layout, int node, int iterations) {
        this.layout = layout;
        this.node = node;
        this.iterations = iterations;
    }

    public Bdd bdd() {
        return layout.bdd();
    }

    public VariableLayout layout() {
        return layout;
    }

    public int node() {
        return node;
    }

    /**
     * Number of fixed-point iterations, including the final one which found no new marking.
     */
    public int iterations() {
        return iterations;
    }

    public boolean isEmpty() {
        return node == bdd().falseNode();
    }

    public BigInteger count() {
        return bdd().countSatisfyingAssignments(node, layout.currentVariables());
    }

    public boolean contains(Marking marking) {
        return bdd().evaluate(node, layout.assignmentOf(marking));
    }

    @Override
    public boolean isReachable(Marking marking) {
        return contains(marking);
    }

    @Override
    public String toString() {
        return String.format("ReachableSet[node %d, %d iterations]", node, iterations);
    }
}
