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
import de.tum.in.pnsym.bdd.Util;
import de.tum.in.pnsym.net.Marking;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds a reachable marking maximising a weighted sum by a longest-path search over the reachable set
 * diagram. A path from the root to {@code true} fixes the places it tests; the remaining places are
 * free on that path and are marked iff their weight is positive.
 *
 * <p>All intermediate values live in the maps of a single call, nothing is shared between calls.</p>
 */
public final class OptimalMarkingExtractor {
    private static final Logger logger = Logger.getLogger(OptimalMarkingExtractor.class.getName());
    private static final long UNREACHABLE = Long.MIN_VALUE;

    private OptimalMarkingExtractor() {}

    /**
     * Returns an optimal marking, or nothing if the set contains no marking at all.
     */
    public static Optional<OptimalMarking> extract(ReachableSet reachable, WeightVector weights) {
        VariableLayout layout = reachable.layout();
        Util.checkArgument(
                weights.size() == layout.placeCount(), "%d weights for %d places", weights.size(), layout.placeCount());
        if (reachable.isEmpty()) {
            logger.log(Level.FINE, "No reachable marking");
            return Optional.empty();
        }
        return Optional.of(new Search(reachable.bdd(), layout, weights).run(reachable.node()));
    }

    private static final class Search {
        private final Bdd bdd;
        private final VariableLayout layout;
        private final WeightVector weights;
        private final int placeCount;
        // positiveSuffix[k] = sum of the positive weights of places k, k + 1, ...
        private final long[] positiveSuffix;

        private final Map<Integer, Long> scores = new HashMap<>();
        private final BitSet takesHigh = new BitSet();

        Search(Bdd bdd, VariableLayout layout, WeightVector weights) {
            this.bdd = bdd;
            this.layout = layout;
            this.weights = weights;
            this.placeCount = layout.placeCount();
            this.positiveSuffix = new long[placeCount + 1];
            for (int place = placeCount - 1; place >= 0; place--) {
                positiveSuffix[place] = positiveSuffix[place + 1] + Math.max(0, weights.weight(place));
            }
        }

        OptimalMarking run(int root) {
            computeScores(root);
            long objective = score(root) + freeGain(-1, root);

            BitSet marked = new BitSet(placeCount);
            BitSet onPath = new BitSet(placeCount);
            int current = root;
            while (current != bdd.trueNode()) {
                assert current != bdd.falseNode();
                int place = placeOf(current);
                onPath.set(place);
                if (takesHigh.get(current)) {
                    marked.set(place);
                    current = bdd.high(current);
                } else {
                    current = bdd.low(current);
                }
            }

            BitSet completed = new BitSet(placeCount);
            for (int place = onPath.nextClearBit(0); place < placeCount; place = onPath.nextClearBit(place + 1)) {
                completed.set(place);
                if (weights.weight(place) > 0) {
                    marked.set(place);
                }
            }

            Marking marking = Marking.of(placeCount, marked);
            long verification = weights.valueOf(marking);
            assert objective == verification : "Objective " + objective + " differs from " + verification;
            logger.log(Level.FINE, "Optimal marking {0} with value {1}, {2} nodes scored", new Object[] {
                marking, objective, scores.size()
            });
            return new OptimalMarking(marking, objective, verification, completed);
        }

        // Post-order over the diagram with an explicit stack, children are scored before their parent
        private void computeScores(int root) {
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                int node = stack.peek();
                if (isScored(node)) {
                    stack.pop();
                    continue;
                }
                int low = bdd.low(node);
                int high = bdd.high(node);
                boolean childrenScored = true;
                if (!isScored(low)) {
                    stack.push(low);
                    childrenScored = false;
                }
                if (!isScored(high)) {
                    stack.push(high);
                    childrenScored = false;
                }
                if (childrenScored) {
                    stack.pop();
                    scoreNode(node, low, high);
                }
            }
        }

        private void scoreNode(int node, int low, int high) {
            int place = placeOf(node);
            long lowScore = score(low);
            if (lowScore != UNREACHABLE) {
                lowScore += freeGain(place, low);
            }
            long highScore = score(high);
            if (highScore != UNREACHABLE) {
                highScore += weights.weight(place) + freeGain(place, high);
            }
            // Both children cannot be false in a reduced diagram
            assert lowScore != UNREACHABLE || highScore != UNREACHABLE;
            if (highScore >= lowScore) {
                takesHigh.set(node);
                scores.put(node, highScore);
            } else {
                scores.put(node, lowScore);
            }
        }

        /**
         * Gain of the places strictly between {@code place} and the place of {@code child}, which are
         * not tested on this edge and hence free.
         */
        private long freeGain(int place, int child) {
            return positiveSuffix[place + 1] - positiveSuffix[placeOf(child)];
        }

        private boolean isScored(int node) {
            return bdd.isLeaf(node) || scores.containsKey(node);
        }

        private long score(int node) {
            if (node == bdd.trueNode()) {
                return 0L;
            }
            if (node == bdd.falseNode()) {
                return UNREACHABLE;
            }
            return scores.get(node);
        }

        private int placeOf(int node) {
            if (bdd.isLeaf(node)) {
                return placeCount;
            }
            int variable = bdd.variableOf(node);
            assert layout.isCurrentVariable(variable) : "Reachable set depends on variable " + variable;
            return layout.placeOf(variable);
        }
    }
}
