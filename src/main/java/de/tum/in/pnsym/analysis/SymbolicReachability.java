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
import de.tum.in.pnsym.net.PetriNet;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the reachable markings of a net as a least fixed point: starting from the initial marking,
 * the images under all transition relations are added until nothing changes. Convergence is detected
 * by handle identity, which is function equality since diagrams are canonical.
 */
public final class SymbolicReachability {
    private static final Logger logger = Logger.getLogger(SymbolicReachability.class.getName());

    private final Bdd bdd;
    private final PetriNet net;
    private final VariableLayout layout;
    private final List<TransitionRelation> relations;
    private final BitSet currentVariables;
    private final int[] nextToCurrent;

    public SymbolicReachability(Bdd bdd, PetriNet net) {
        this.bdd = bdd;
        this.net = net;
        this.layout = VariableLayout.declare(bdd, net);
        this.relations = new TransitionRelationBuilder(layout).buildAll(net);
        this.currentVariables = layout.currentVariables();
        this.nextToCurrent = layout.nextToCurrent();
    }

    public VariableLayout layout() {
        return layout;
    }

    public List<TransitionRelation> relations() {
        return relations;
    }

    public int initialStates() {
        return layout.cubeOf(net.initialMarking());
    }

    /**
     * The markings reachable from {@code states} by firing {@code relation} once.
     */
    public int image(int states, TransitionRelation relation) {
        int product = bdd.and(states, relation.node());
        if (product == bdd.falseNode()) {
            return product;
        }
        return bdd.substitute(bdd.exists(product, currentVariables), nextToCurrent);
    }

    /**
     * One iteration: {@code states} together with all of its one-step successors.
     */
    public int step(int states) {
        int images = bdd.falseNode();
        for (TransitionRelation relation : relations) {
            images = bdd.or(images, image(states, relation));
        }
        return bdd.or(states, images);
    }

    public ReachableSet compute() {
        int states = initialStates();
        int iterations = 0;
        while (true) {
            int next = step(states);
            iterations += 1;
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Iteration {0}: {1} nodes, {2} table entries", new Object[] {
                    iterations, bdd.nodeCount(next), bdd.activeNodeCount()
                });
            }
            if (next == states) {
                break;
            }
            states = next;
        }
        return new ReachableSet(layout, states, iterations);
    }
}
