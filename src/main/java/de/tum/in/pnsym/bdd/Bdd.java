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

import java.math.BigInteger;
import java.util.BitSet;
import java.util.OptionalInt;

/**
 * This interface contains various BDD operations.
 *
 * <p>All diagrams are reduced and ordered, and nodes are hash-consed: two diagrams denoting the same
 * boolean function are always the same handle. Hence, {@code ==} on handles is function equality.</p>
 *
 * <p>Note that for the sake of performance, most required properties of the arguments are only
 * checked though {@code assert} statements. With disabled assertions, undefined behaviour might
 * occur with invalid arguments.</p>
 */
public interface Bdd extends DecisionDiagram {
    /**
     * Returns the node representing {@code true}.
     */
    int trueNode();

    /**
     * Returns the node representing {@code false}.
     */
    int falseNode();

    int high(int node);

    int low(int node);

    /**
     * Determines whether the given {@code node} represents a variable.
     */
    default boolean isVariable(int node) {
        return !isLeaf(node) && low(node) == falseNode() && high(node) == trueNode();
    }

    /**
     * Returns the node which represents the variable with given {@code variableNumber}. The variable
     * must already have been created.
     *
     * @param variableNumber The number of the requested variable.
     * @return The corresponding node.
     */
    int variableNode(int variableNumber);

    /**
     * Returns the node of the variable called {@code name}, creating the variable if it does not
     * exist yet. Variables are allocated sequentially starting from 0 and the allocation order is
     * the variable order of every diagram built afterwards, i.e. {@code
     * variableOf(createVariable(name)) == numberOfVariables() - 1} for a fresh name.
     *
     * @param name The unique name of the variable.
     * @return The node representing the variable.
     */
    int createVariable(String name);

    /**
     * Returns the name the given variable was created with.
     */
    String variableName(int variableNumber);

    /**
     * Returns the number of the variable called {@code name}, if it exists.
     */
    OptionalInt variableNumber(String name);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * assignment. Follows exactly one path, i.e. the cost is bounded by the number of variables.
     *
     * @param node The node to evaluate.
     * @param assignment The variable assignment.
     * @return The truth value of the node under the given assignment.
     */
    boolean evaluate(int node, BitSet assignment);

    /**
     * Array variant of {@link #evaluate(int, BitSet)}.
     */
    boolean evaluate(int node, boolean[] assignment);

    /**
     * Returns any satisfying assignment.
     *
     * @throws java.util.NoSuchElementException if the given {@code node} is {@literal false}.
     */
    BitSet getSatisfyingAssignment(int node);

    /**
     * Counts the number of satisfying assignments over all variables.
     */
    BigInteger countSatisfyingAssignments(int node);

    /**
     * Counts the number of satisfying assignments, only considering variables in the {@code
     * support}. The support of {@code node} must be contained in {@code support}.
     */
    BigInteger countSatisfyingAssignments(int node, BitSet support);

    /**
     * Constructs the node representing {@code node1 operation node2}, or {@code NOT node1} for
     * {@link BddOperation#NOT}.
     */
    default int apply(BddOperation operation, int node1, int node2) {
        switch (operation) {
            case AND:
                return and(node1, node2);
            case OR:
                return or(node1, node2);
            case XOR:
                return xor(node1, node2);
            case NOT:
                return not(node1);
            default:
                throw new AssertionError(operation);
        }
    }

    /**
     * Constructs the node representing {@code node1 AND node2}.
     */
    int and(int node1, int node2);

    /**
     * Constructs the node representing {@code node1 OR node2}.
     */
    int or(int node1, int node2);

    /**
     * Constructs the node representing {@code node1 XOR node2}.
     */
    int xor(int node1, int node2);

    /**
     * Constructs the node representing {@code NOT node}.
     */
    int not(int node);

    /**
     * Constructs the node representing {@code IF ifNode THEN thenNode ELSE elseNode}.
     */
    int ifThenElse(int ifNode, int thenNode, int elseNode);

    /**
     * Constructs the node representing {@code node1 EQUIVALENT node2}.
     */
    default int equivalence(int node1, int node2) {
        return not(xor(node1, node2));
    }

    /**
     * Constructs the node representing the function obtained by existential quantification of {@code
     * node} with all variables specified by {@code quantifiedVariables}, i.e. the variables are
     * eliminated by OR-ing the two cofactors.
     *
     * @param node The node representing the basis of the quantification.
     * @param quantifiedVariables The variables which should be quantified over.
     * @return The node representing the quantification.
     */
    int exists(int node, BitSet quantifiedVariables);

    /**
     * Constructs the node representing the <i>composition</i> of the function represented by {@code
     * node} with the functions represented by the entries of {@code variableMapping}, i.e. if {@code
     * node} represents {@code f(x_1, ..., x_n)}, the result represents {@code f(g_1, ..., g_n)} with
     * {@code g_i = variableMapping[i]}. The array may be shorter than the number of variables, then
     * only the first variables are replaced. {@link #placeholder()} entries denote "keep this
     * variable".
     */
    int compose(int node, int[] variableMapping);

    /**
     * Renames variables: every variable {@code v} with {@code renaming[v] >= 0} is replaced by the
     * variable {@code renaming[v]}, all others stay. Used to move an image computed over next-state
     * variables back onto the current-state variables.
     */
    default int substitute(int node, int[] renaming) {
        int[] mapping = new int[renaming.length];
        for (int variable = 0; variable < renaming.length; variable++) {
            mapping[variable] = renaming[variable] < 0 ? placeholder() : variableNode(renaming[variable]);
        }
        return compose(node, mapping);
    }

    /**
     * Creates the conjunction of the literals given by {@code variables}, where variable {@code v}
     * occurs positively iff {@code values.get(v)}.
     *
     * @param variables The variables of the cube.
     * @param values The polarity of each variable.
     * @return The node representing the cube.
     */
    int cube(BitSet variables, BitSet values);

    /**
     * Creates the conjunction of all {@code variables}.
     */
    default int conjunction(BitSet variables) {
        return cube(variables, variables);
    }
}
