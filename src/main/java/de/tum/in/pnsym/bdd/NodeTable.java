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

import static de.tum.in.pnsym.bdd.Util.checkState;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The unique table: an arena of nodes addressed by integer handles together with a hash index
 * keyed by (variable, children). Nodes are allocated sequentially and never freed, so a handle is
 * valid iff it lies in {@code [FIRST_NODE, nextFreeNode)}. Subclasses define what the children of
 * a node are.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    /* Layout of the metadata: <---VAR---><MARK> */
    private static final int VARIABLE_OFFSET = 1;

    static int dataMake(int variable) {
        return variable << VARIABLE_OFFSET;
    }

    static int dataGetVariable(int metadata) {
        return metadata >>> VARIABLE_OFFSET;
    }

    static int dataSetMark(int metadata) {
        return metadata | 1;
    }

    static int dataClearMark(int metadata) {
        return metadata & ~1;
    }

    static boolean dataIsMarked(int metadata) {
        return (metadata & 1) != 0;
    }

    // Use 0 as "not a node" to make re-allocations slightly more efficient
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;

    private static final int MINIMUM_NODE_TABLE_SIZE = Primes.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Index of the next node to be allocated. All nodes below are valid, all above are unused. */
    private int nextFreeNode;

    /* Stores the variable of each node together with a mark bit used by traversals. */
    private int[] nodes;

    /* Hash index for existing nodes: hashToChainStart maps a bucket to the first node of its chain,
     * hashChain links each node to the next node of the same bucket. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long lookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    protected NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        nodes = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        nextFreeNode = FIRST_NODE;
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? -1 : dataGetVariable(nodes[node]);
    }

    @Override
    public final int placeholder() {
        return NOT_A_NODE;
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. For most operations it is
     * required that this is the case.
     *
     * @param node The node to be checked.
     * @return If {@code} is valid or leaf node.
     * @see #isLeaf(int)
     */
    public boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    // Node creation

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    /**
     * Returns the node with the given {@code variable} whose children match the ones currently
     * prepared by the subclass (see {@link #checkLookupChildrenMatch(int)}), allocating a new node
     * if none exists. The caller writes the children of a freshly allocated node.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        lookups += 1;

        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        int chainLookups = 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (dataGetVariable(nodes[currentLookupNode]) == variable
                    && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextFreeNode == tableSize()) {
            grow();
        }

        int freeNode = nextFreeNode;
        nextFreeNode += 1;
        this.nodes[freeNode] = dataMake(variable);
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private void grow() {
        growCount += 1;
        int oldSize = tableSize();
        checkState(oldSize < MAXIMAL_NODE_COUNT, "Node table exhausted at %d nodes", oldSize);
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_NODE_COUNT, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        onTableResize(newSize);
        nodes = Arrays.copyOf(nodes, newSize);
        hashChain = new int[newSize];
        // Bucket positions depend on the table size, re-index every node
        hashToChainStart = new int[newSize];
        for (int node = nextFreeNode - 1; node >= FIRST_NODE; node--) {
            connectHashList(node, hashCode(node, dataGetVariable(nodes[node])));
        }
        assert check();
    }

    private void connectHashList(int node, int hashCode) {
        assert isNodeValid(node);
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        return HashUtil.mod(hashCode, nodes.length);
    }

    protected abstract int hashCode(int node, int variable);

    protected abstract void onTableResize(int newSize);

    // Marking

    private boolean isNoneMarked() {
        for (int i = FIRST_NODE; i < nextFreeNode; i++) {
            if (dataIsMarked(nodes[i])) {
                return false;
            }
        }
        return true;
    }

    private int markAllUnmarkedBelow(int node) {
        /* The algorithm does not descend into trees whose root is marked, hence at the start of the
         * algorithm, every marked node must have all of its descendants marked to ensure correctness. */
        assert isNodeValidOrLeaf(node);

        if (isLeaf(node)) {
            return 0;
        }

        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);

        if (metadata == markedData) {
            return 0;
        }
        nodes[node] = markedData;
        return 1 + sumEachBelow(node, this::markAllUnmarkedBelow);
    }

    private int unMarkAllMarkedBelow(int node) {
        assert isNodeValidOrLeaf(node);

        if (isLeaf(node)) {
            return 0;
        }

        int metadata = nodes[node];
        int unmarkedData = dataClearMark(metadata);

        if (metadata == unmarkedData) {
            return 0;
        }
        nodes[node] = unmarkedData;
        return 1 + sumEachBelow(node, this::unMarkAllMarkedBelow);
    }

    // Reading

    public int tableSize() {
        return nodes.length;
    }

    @Override
    public int activeNodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    @Override
    public int nodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        assert isNoneMarked();

        int count = markAllUnmarkedBelow(node);
        if (count > 0) {
            int unmarked = unMarkAllMarkedBelow(node);
            assert count == unmarked : "Expected " + count + " but only unmarked " + unmarked;
        }
        return count;
    }

    // Traversal

    protected void forEachNodeBelowOnce(int node, NodeVisitor action) {
        assert isNoneMarked();
        doForEachNodeBelowOnce(node, action);
        unMarkAllMarkedBelow(node);
    }

    private void doForEachNodeBelowOnce(int node, NodeVisitor action) {
        if (isLeaf(node)) {
            return;
        }
        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);
        if (metadata == markedData) {
            return;
        }
        nodes[node] = markedData;
        action.visit(node, dataGetVariable(metadata));
        forEachChild(node, child -> doForEachNodeBelowOnce(child, action));
    }

    @Override
    public BitSet supportFilteredTo(int node, BitSet bitSet, BitSet filter) {
        assert isNodeValidOrLeaf(node);
        if (filter.isEmpty()) {
            return bitSet;
        }

        forEachNodeBelowOnce(node, (n, var) -> {
            if (filter.get(var)) {
                bitSet.set(var);
            }
        });

        return bitSet;
    }

    // Integrity checks and utility

    /**
     * Performs some integrity / invariant checks: children descend in the variable order, every node
     * is reachable through its own hash chain and there are no two nodes with equal content.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(nextFreeNode <= tableSize());

        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int metadata = nodes[node];
            checkState(!dataIsMarked(metadata), "Node (%s) is marked", node(node));
            int current = node;
            forEachChild(node, child -> {
                checkState(isNodeValidOrLeaf(child), "Invalid child entry (%s) -> (%s)", node(current), child);
                if (!isLeaf(child)) {
                    checkState(
                            dataGetVariable(metadata) < dataGetVariable(nodes[child]),
                            "(%s) -> (%s) does not descend tree",
                            node(current),
                            node(child));
                }
            });
        }

        int maximalNodeCountCheckedSet = 1 << 16;
        if (nextFreeNode < maximalNodeCountCheckedSet) {
            logger.log(Level.FINER, "Checking duplicate nodes");
            Set<Node> seen = new HashSet<>();
            for (int node = FIRST_NODE; node < nextFreeNode; node++) {
                Node nodeObject = node(node);
                checkState(seen.add(nodeObject), "Duplicate entry (%s)", nodeObject);
            }
        }

        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int chainPosition = hashToChainStart[hashToTable(hashCode(node, dataGetVariable(nodes[node])))];
            boolean found = false;
            while (chainPosition != NOT_A_NODE) {
                if (chainPosition == node) {
                    found = true;
                    break;
                }
                chainPosition = hashChain[chainPosition];
            }
            checkState(found, "(%s) is not contained in its hash list", node(node));
        }
        return true;
    }

    public String getStatistics() {
        int longestChain = 0;
        int usedBuckets = 0;
        for (int start : hashToChainStart) {
            if (start == NOT_A_NODE) {
                continue;
            }
            usedBuckets += 1;
            int length = 0;
            for (int node = start; node != NOT_A_NODE; node = hashChain[node]) {
                length += 1;
            }
            longestChain = Math.max(longestChain, length);
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, %2$d nodes, %3$d grows%n"
                        + "Hash table: %4$d chains, %5$d max; %6$d lookups, %7$.2f avg. len, %8$d hits",
                tableSize(),
                activeNodeCount(),
                growCount,
                usedBuckets,
                longestChain,
                lookups,
                lookups == 0 ? 0.0 : hashChainLookupLength * 1.0 / lookups,
                hashChainLookupHit);
    }

    public String nodeToString(int node) {
        if (!isNodeValid(node)) {
            return String.format("%5d| == INVALID ==", node);
        }
        return String.format("%5d|%3d|%s", node, dataGetVariable(nodes[node]), node(node).childrenString());
    }

    /**
     * Generates a string representation of the given {@code node}.
     *
     * @param node The node to be printed.
     * @return A string representing the given node.
     */
    public String treeToString(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return String.format("Node %d%n", node);
        }
        StringBuilder builder =
                new StringBuilder(50).append("Node ").append(node).append('\n').append("  NODE|VAR|DATA\n");
        forEachNodeBelowOnce(node, (child, var) -> builder.append(' ')
                .append(nodeToString(child))
                .append('\n'));
        return builder.toString();
    }

    protected abstract Node node(int node);

    public interface Node {
        String childrenString();
    }

    @FunctionalInterface
    protected interface NodeVisitor {
        void visit(int node, int variable);
    }

    // Tree structure abstraction

    protected abstract void forEachChild(int node, IntConsumer action);

    protected abstract int sumEachBelow(int node, IntUnaryOperator operator);
}
