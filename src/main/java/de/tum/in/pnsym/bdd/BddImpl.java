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

import static de.tum.in.pnsym.bdd.Util.checkArgument;
import static de.tum.in.pnsym.bdd.Util.min;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/* Implementation notes:
 * - Many of the methods are practically copy-paste of each other except for a few variables and
 *   corner cases, as the structure of BDD algorithms is the same for most of the operations.
 * - Due to the implementation of all operations, variable numbers increase while descending the
 *   tree of a particular node.
 * - Nodes are never freed, hence no result needs to be protected while a recursion is running.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "ReassignedVariable",
    "AssignmentToMethodParameter",
})
final class BddImpl extends NodeTable implements Bdd {
    private static final BigInteger TWO = BigInteger.valueOf(2L);

    private static final int TRUE_NODE = -1;
    private static final int FALSE_NODE = -2;

    private final OperationCache cache;
    private int numberOfVariables;
    private int[] variableNodes;
    private final List<String> variableNames = new ArrayList<>();
    private final Map<String, Integer> variableNumbers = new HashMap<>();

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    BddImpl(BddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        tree = new int[2 * tableSize()];
        cache = new OperationCache(this, configuration);
        variableNodes = new int[32];
        numberOfVariables = 0;
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    private int makeNode(int variable, int low, int high) {
        assert 0 <= variable;
        assert (isLeaf(low) || variable < variableOf(low));
        assert (isLeaf(high) || variable < variableOf(high));

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int freeNode = findOrCreateNode(variable, hashCode(variable, low, high));

        this.tree[2 * freeNode] = low;
        this.tree[2 * freeNode + 1] = high;
        assert hashCode(variable, low, high) == hashCode(freeNode, variable);
        return freeNode;
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    @Override
    public boolean isLeaf(int node) {
        assert -2 <= node && node < tableSize();
        return node < 0;
    }

    // Variables and base nodes

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public int variableNode(int variableNumber) {
        assert 0 <= variableNumber && variableNumber < numberOfVariables;
        return variableNodes[variableNumber];
    }

    @Override
    public int createVariable(String name) {
        Integer existing = variableNumbers.get(name);
        if (existing != null) {
            return variableNodes[existing];
        }

        int variableNode = makeNode(numberOfVariables, FALSE_NODE, TRUE_NODE);
        if (numberOfVariables == variableNodes.length) {
            variableNodes = Arrays.copyOf(variableNodes, variableNodes.length * 2);
        }
        variableNodes[numberOfVariables] = variableNode;
        variableNames.add(name);
        variableNumbers.put(name, numberOfVariables);
        numberOfVariables++;
        return variableNode;
    }

    @Override
    public String variableName(int variableNumber) {
        return variableNames.get(variableNumber);
    }

    @Override
    public OptionalInt variableNumber(String name) {
        Integer number = variableNumbers.get(name);
        return number == null ? OptionalInt.empty() : OptionalInt.of(number);
    }

    // Reading

    @Override
    public boolean evaluate(int node, BitSet assignment) {
        int current = node;
        while (current >= FIRST_NODE) {
            current = assignment.get(variableOf(current)) ? high(current) : low(current);
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        int current = node;
        while (current >= FIRST_NODE) {
            current = assignment[variableOf(current)] ? high(current) : low(current);
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    @Override
    public BitSet getSatisfyingAssignment(int node) {
        assert isNodeValidOrLeaf(node);

        if (node == FALSE_NODE) {
            throw new NoSuchElementException("False has no solution");
        }

        BitSet path = new BitSet(numberOfVariables);
        int currentNode = node;
        while (currentNode != TRUE_NODE) {
            int lowNode = low(currentNode);
            if (lowNode == FALSE_NODE) {
                int highNode = high(currentNode);
                path.set(variableOf(currentNode));
                currentNode = highNode;
            } else {
                currentNode = lowNode;
            }
        }
        return path;
    }

    @Override
    public BigInteger countSatisfyingAssignments(int node) {
        assert isNodeValidOrLeaf(node);
        if (node == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (node == TRUE_NODE) {
            return TWO.pow(numberOfVariables);
        }
        // Counts are not kept across calls, the memo only lives for this traversal
        Map<Integer, BigInteger> counts = new HashMap<>();
        BigInteger count = countSatisfyingAssignmentsRecursive(node, counts);
        return count.multiply(TWO.pow(variableOf(node)));
    }

    @Override
    public BigInteger countSatisfyingAssignments(int node, BitSet support) {
        assert BitSets.isSubset(support(node), support);
        BigInteger count = countSatisfyingAssignments(node);
        return count.divide(TWO.pow(numberOfVariables - support.cardinality()));
    }

    private BigInteger countSatisfyingAssignmentsRecursive(int node, Map<Integer, BigInteger> counts) {
        assert isNodeValid(node);

        BigInteger cached = counts.get(node);
        if (cached != null) {
            return cached;
        }

        int nodeVar = variableOf(node);
        BigInteger lowCount = doCountSatisfyingAssignments(low(node), nodeVar, counts);
        BigInteger highCount = doCountSatisfyingAssignments(high(node), nodeVar, counts);

        BigInteger result = lowCount.add(highCount);
        counts.put(node, result);
        return result;
    }

    private BigInteger doCountSatisfyingAssignments(int subNode, int currentVar, Map<Integer, BigInteger> counts) {
        if (subNode == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (subNode == TRUE_NODE) {
            return TWO.pow(numberOfVariables - currentVar - 1);
        }
        BigInteger multiplier = TWO.pow(variableOf(subNode) - currentVar - 1);
        return multiplier.multiply(countSatisfyingAssignmentsRecursive(subNode, counts));
    }

    // Bdd operations

    @Override
    public int cube(BitSet variables, BitSet values) {
        checkArgument(
                variables.length() <= numberOfVariables, "Cube refers to unknown variable %d", variables.length() - 1);
        // Build bottom-up so that every node is created exactly once
        int node = TRUE_NODE;
        for (int variable = variables.length() - 1; variable >= 0; variable = variables.previousSetBit(variable - 1)) {
            node = values.get(variable) ? makeNode(variable, FALSE_NODE, node) : makeNode(variable, node, FALSE_NODE);
        }
        return node;
    }

    @Override
    public int and(int node1, int node2) {
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        return andRecursive(node1, node2);
    }

    private int andRecursive(int node1, int node2) {
        if (node1 == node2 || node2 == TRUE_NODE) {
            return node1;
        }
        if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
            return FALSE_NODE;
        }
        if (node1 == TRUE_NODE) {
            return node2;
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);

        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }
        assert cache.binarySymmetricWellOrdered(node1, node2);

        if (cache.lookup(OperationCache.AND, node1, node2)) {
            return cache.lookupResult();
        }
        int lowNode;
        int highNode;
        if (node1var == node2var) {
            lowNode = andRecursive(low(node1), low(node2));
            highNode = andRecursive(high(node1), high(node2));
        } else { // v < getVariable(node2)
            lowNode = andRecursive(low(node1), node2);
            highNode = andRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1var, lowNode, highNode);
        cache.put(OperationCache.AND, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int or(int node1, int node2) {
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        return orRecursive(node1, node2);
    }

    private int orRecursive(int node1, int node2) {
        if (node1 == node2 || node2 == FALSE_NODE) {
            return node1;
        }
        if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
            return TRUE_NODE;
        }
        if (node1 == FALSE_NODE) {
            return node2;
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);

        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }

        if (cache.lookup(OperationCache.OR, node1, node2)) {
            return cache.lookupResult();
        }
        int lowNode;
        int highNode;
        if (node1var == node2var) {
            lowNode = orRecursive(low(node1), low(node2));
            highNode = orRecursive(high(node1), high(node2));
        } else {
            lowNode = orRecursive(low(node1), node2);
            highNode = orRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1var, lowNode, highNode);
        cache.put(OperationCache.OR, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int xor(int node1, int node2) {
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        return xorRecursive(node1, node2);
    }

    private int xorRecursive(int node1, int node2) {
        if (node1 == node2) {
            return FALSE_NODE;
        }
        if (node1 == FALSE_NODE) {
            return node2;
        }
        if (node2 == FALSE_NODE) {
            return node1;
        }
        if (node1 == TRUE_NODE) {
            return notRecursive(node2);
        }
        if (node2 == TRUE_NODE) {
            return notRecursive(node1);
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);

        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }

        if (cache.lookup(OperationCache.XOR, node1, node2)) {
            return cache.lookupResult();
        }
        int lowNode;
        int highNode;
        if (node1var == node2var) {
            lowNode = xorRecursive(low(node1), low(node2));
            highNode = xorRecursive(high(node1), high(node2));
        } else {
            lowNode = xorRecursive(low(node1), node2);
            highNode = xorRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1var, lowNode, highNode);
        cache.put(OperationCache.XOR, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int not(int node) {
        assert isNodeValidOrLeaf(node);
        return notRecursive(node);
    }

    private int notRecursive(int node) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }

        if (cache.lookup(OperationCache.NOT, node)) {
            return cache.lookupResult();
        }

        int lowNode = notRecursive(low(node));
        int highNode = notRecursive(high(node));
        int resultNode = makeNode(variableOf(node), lowNode, highNode);
        cache.put(OperationCache.NOT, node, resultNode);
        return resultNode;
    }

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        assert isNodeValidOrLeaf(ifNode) && isNodeValidOrLeaf(thenNode) && isNodeValidOrLeaf(elseNode);
        return ifThenElseRecursive(ifNode, thenNode, elseNode);
    }

    private int ifThenElseRecursive(int ifNode, int thenNode, int elseNode) {
        if (ifNode == TRUE_NODE) {
            return thenNode;
        }
        if (ifNode == FALSE_NODE) {
            return elseNode;
        }
        if (thenNode == elseNode) {
            return thenNode;
        }
        if (thenNode == TRUE_NODE) {
            if (elseNode == FALSE_NODE) {
                return ifNode;
            }
            return orRecursive(ifNode, elseNode);
        }
        if (thenNode == FALSE_NODE) {
            if (elseNode == TRUE_NODE) {
                return notRecursive(ifNode);
            }
            return andRecursive(notRecursive(ifNode), elseNode);
        }
        if (elseNode == TRUE_NODE) {
            return orRecursive(notRecursive(ifNode), thenNode);
        }
        if (elseNode == FALSE_NODE) {
            return andRecursive(ifNode, thenNode);
        }
        if (ifNode == thenNode) {
            return orRecursive(ifNode, elseNode);
        }
        if (ifNode == elseNode) {
            return andRecursive(ifNode, thenNode);
        }

        if (cache.lookup(OperationCache.ITE, ifNode, thenNode, elseNode)) {
            return cache.lookupResult();
        }
        int ifVar = variableOf(ifNode);
        int thenVar = variableOf(thenNode);
        int elseVar = variableOf(elseNode);

        int minVar = min(ifVar, thenVar, elseVar);
        int ifLowNode;
        int ifHighNode;

        if (ifVar == minVar) {
            ifLowNode = low(ifNode);
            ifHighNode = high(ifNode);
        } else {
            ifLowNode = ifNode;
            ifHighNode = ifNode;
        }

        int thenHighNode;
        int thenLowNode;
        if (thenVar == minVar) {
            thenLowNode = low(thenNode);
            thenHighNode = high(thenNode);
        } else {
            thenLowNode = thenNode;
            thenHighNode = thenNode;
        }

        int elseHighNode;
        int elseLowNode;
        if (elseVar == minVar) {
            elseLowNode = low(elseNode);
            elseHighNode = high(elseNode);
        } else {
            elseLowNode = elseNode;
            elseHighNode = elseNode;
        }

        int lowNode = ifThenElseRecursive(ifLowNode, thenLowNode, elseLowNode);
        int highNode = ifThenElseRecursive(ifHighNode, thenHighNode, elseHighNode);
        int result = makeNode(minVar, lowNode, highNode);
        cache.put(OperationCache.ITE, ifNode, thenNode, elseNode, result);
        return result;
    }

    @Override
    public int exists(int node, BitSet quantifiedVariables) {
        assert isNodeValidOrLeaf(node);
        assert quantifiedVariables.length() <= numberOfVariables;

        if (quantifiedVariables.isEmpty() || isLeaf(node)) {
            return node;
        }
        if (quantifiedVariables.cardinality() == numberOfVariables) {
            return TRUE_NODE;
        }

        int context = cache.registerContext(BitSets.copyOf(quantifiedVariables));
        return existsRecursive(node, 0, BitSets.toArray(quantifiedVariables), context);
    }

    private int existsRecursive(int node, int currentIndex, int[] quantifiedVariables, int context) {
        if (node == TRUE_NODE || node == FALSE_NODE) {
            return node;
        }
        if (currentIndex == quantifiedVariables.length) {
            return node;
        }

        int nodeVariable = variableOf(node);
        int quantifiedVariable = quantifiedVariables[currentIndex];

        while (quantifiedVariable < nodeVariable) {
            currentIndex += 1;
            if (currentIndex == quantifiedVariables.length) {
                return node;
            }
            quantifiedVariable = quantifiedVariables[currentIndex];
        }

        if (cache.lookup(OperationCache.EXISTS, context, node)) {
            return cache.lookupResult();
        }

        int lowExists = existsRecursive(low(node), currentIndex, quantifiedVariables, context);
        int highExists = existsRecursive(high(node), currentIndex, quantifiedVariables, context);
        int resultNode;
        if (quantifiedVariable > nodeVariable) {
            // The variable of this node is smaller than the variable looked for - only propagate the
            // quantification downward
            resultNode = makeNode(nodeVariable, lowExists, highExists);
        } else {
            // nodeVariable == nextVariable, i.e. "quantify out" the current node.
            resultNode = orRecursive(lowExists, highExists);
        }
        cache.put(OperationCache.EXISTS, context, node, resultNode);
        return resultNode;
    }

    @Override
    public int compose(int node, int[] variableMapping) {
        assert variableMapping.length <= numberOfVariables;

        if (node == TRUE_NODE || node == FALSE_NODE) {
            return node;
        }

        // Replace NOT_A_NODE by actual variable reference, the argument is left untouched
        int[] replacement = new int[variableMapping.length];
        int highestReplacedVariable = -1;
        for (int i = 0; i < variableMapping.length; i++) {
            int mapped = variableMapping[i];
            if (mapped == NOT_A_NODE) {
                replacement[i] = variableNodes[i];
            } else {
                assert isNodeValidOrLeaf(mapped);
                replacement[i] = mapped;
            }
            if (replacement[i] != variableNodes[i]) {
                highestReplacedVariable = i;
            }
        }
        if (highestReplacedVariable == -1) {
            return node;
        }

        int[] relevantReplacement = Arrays.copyOf(replacement, highestReplacedVariable + 1);
        int context = cache.registerContext(new ComposeContext(relevantReplacement));
        return composeRecursive(node, relevantReplacement, highestReplacedVariable, context);
    }

    private int composeRecursive(int node, int[] replacement, int highestReplacedVariable, int context) {
        if (node == TRUE_NODE || node == FALSE_NODE) {
            return node;
        }

        int nodeVariable = variableOf(node);
        if (nodeVariable > highestReplacedVariable) {
            return node;
        }

        if (cache.lookup(OperationCache.COMPOSE, context, node)) {
            return cache.lookupResult();
        }

        int variableReplacementNode = replacement[nodeVariable];
        int resultNode;
        // Short-circuit constant replacements.
        if (variableReplacementNode == TRUE_NODE) {
            resultNode = composeRecursive(high(node), replacement, highestReplacedVariable, context);
        } else if (variableReplacementNode == FALSE_NODE) {
            resultNode = composeRecursive(low(node), replacement, highestReplacedVariable, context);
        } else {
            int lowCompose = composeRecursive(low(node), replacement, highestReplacedVariable, context);
            int highCompose = composeRecursive(high(node), replacement, highestReplacedVariable, context);
            resultNode = ifThenElseRecursive(variableReplacementNode, highCompose, lowCompose);
        }
        cache.put(OperationCache.COMPOSE, context, node, resultNode);
        return resultNode;
    }

    // Diagnostics

    @Override
    public String statistics() {
        return getStatistics() + System.lineSeparator() + cache.getStatistics();
    }

    OperationCache cache() {
        return cache;
    }

    @Override
    public String toString() {
        return String.format("BDD[%d vars, %d nodes]", numberOfVariables, activeNodeCount());
    }

    // Tree structure

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, HashUtil.PRIME * high);
    }

    @Override
    protected void forEachChild(int node, IntConsumer action) {
        action.accept(tree[2 * node]);
        action.accept(tree[2 * node + 1]);
    }

    @Override
    protected int sumEachBelow(int node, IntUnaryOperator operator) {
        return operator.applyAsInt(tree[2 * node]) + operator.applyAsInt(tree[2 * node + 1]);
    }

    @Override
    protected Node node(int node) {
        return new BinaryNode(variableOf(node), tree[2 * node], tree[2 * node + 1]);
    }

    // Utility classes

    private static final class ComposeContext {
        private final int[] replacement;

        ComposeContext(int[] replacement) {
            this.replacement = replacement;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof ComposeContext && Arrays.equals(replacement, ((ComposeContext) o).replacement));
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(replacement);
        }
    }

    private static final class BinaryNode implements NodeTable.Node {
        final int var;
        final int low;
        final int high;

        BinaryNode(int var, int low, int high) {
            this.var = var;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BinaryNode)) {
                return false;
            }
            BinaryNode node = (BinaryNode) o;
            return var == node.var && low == node.low && high == node.high;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(var, low, high);
        }

        @Override
        public String childrenString() {
            return String.format("%5d %5d", low, high);
        }
    }
}
