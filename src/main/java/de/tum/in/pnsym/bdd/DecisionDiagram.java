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
package de.tum.in.pnsym.bdd;

import java.util.BitSet;

/**
 * A shared, append-only store of decision diagram nodes. Nodes are referred to by integer handles
 * into the store. A handle stays valid for the whole lifetime of the diagram; nothing is ever
 * removed, so there is no reference counting.
 */
public interface DecisionDiagram {
    /**
     * A special reserved placeholder distinct from any possible node value, which may be used as a placeholder in some operations.
     * Needs to stay constant throughout the life of the diagram.
     *
     * @return A placeholder value
     */
    int placeholder();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    /**
     * Returns the number of variables in this decision diagram.
     *
     * @return The number of variables.
     */
    int numberOfVariables();

    /**
     * Number of inner nodes allocated so far. As the store is append-only, this number never
     * decreases.
     */
    int activeNodeCount();

    /**
     * Counts the number of inner nodes reachable from the specified {@code node}.
     */
    int nodeCount(int node);

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}. The support
     * of a function are all variables which have an influence on its value.
     *
     * @param node The node whose support should be computed.
     * @return A bit set with bit {@code i} is set iff the {@code i}-th variable is in the support.
     */
    default BitSet support(int node) {
        BitSet filter = new BitSet(numberOfVariables());
        filter.set(0, numberOfVariables());
        return supportFilteredTo(node, new BitSet(numberOfVariables()), filter);
    }

    /**
     * Computes the <b>support</b> of the given {@code node} and writes it in the {@code bitSet}.
     * Only considers variables in the given {@code filter}. Note that the {@code bitSet} is not
     * cleared, the support variables are added to the set.
     *
     * @param node The node whose support should be computed.
     * @param bitSet The BitSet used to store the result.
     * @return The given bitset, useful for chaining.
     * @see #support(int)
     */
    BitSet supportFilteredTo(int node, BitSet bitSet, BitSet filter);

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    String statistics();
}
