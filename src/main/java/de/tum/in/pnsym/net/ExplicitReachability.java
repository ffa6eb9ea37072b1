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
package de.tum.in.pnsym.net;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exhaustive breadth-first enumeration of the reachable markings. Only feasible for small nets, but
 * serves as a drop-in {@link ReachabilityOracle} and as a reference for the symbolic computation.
 */
public final class ExplicitReachability implements ReachabilityOracle {
    private static final Logger logger = Logger.getLogger(ExplicitReachability.class.getName());

    private final PetriNet net;
    private final Set<Marking> visited;
    private final List<Edge> edges;
    private final Map<Marking, Edge> predecessors;

    private ExplicitReachability(
            PetriNet net, Set<Marking> visited, List<Edge> edges, Map<Marking, Edge> predecessors) {
        this.net = net;
        this.visited = visited;
        this.edges = edges;
        this.predecessors = predecessors;
    }

    public static ExplicitReachability explore(PetriNet net) {
        return explore(net, false);
    }

    /**
     * Explores all markings reachable from the initial marking.
     *
     * @param keepEdges Whether every firing (including those leading to known markings) is recorded.
     */
    public static ExplicitReachability explore(PetriNet net, boolean keepEdges) {
        Marking start = net.initialMarking();
        Set<Marking> visited = new LinkedHashSet<>();
        visited.add(start);
        List<Edge> edges = new ArrayList<>();
        Map<Marking, Edge> predecessors = new HashMap<>();

        Queue<Marking> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Marking marking = queue.poll();
            for (Transition transition : net.transitions()) {
                if (!transition.isEnabled(marking)) {
                    continue;
                }
                Marking successor = transition.fire(marking);
                Edge edge = new Edge(marking, transition, successor);
                if (keepEdges) {
                    edges.add(edge);
                }
                if (visited.add(successor)) {
                    predecessors.put(successor, edge);
                    queue.add(successor);
                }
            }
        }
        logger.log(Level.FINE, "Explicit exploration of {0} found {1} markings", new Object[] {net, visited.size()});
        return new ExplicitReachability(
                net,
                Collections.unmodifiableSet(visited),
                Collections.unmodifiableList(edges),
                Collections.unmodifiableMap(predecessors));
    }

    public PetriNet net() {
        return net;
    }

    /**
     * All reachable markings in the order of discovery.
     */
    public Set<Marking> visited() {
        return visited;
    }

    public int count() {
        return visited.size();
    }

    public List<Edge> edges() {
        return edges;
    }

    @Override
    public boolean isReachable(Marking marking) {
        return visited.contains(marking);
    }

    /**
     * Returns a shortest firing sequence leading from the initial marking to {@code target}, or
     * nothing if the target is not reachable.
     */
    public Optional<List<Transition>> trace(Marking target) {
        if (!visited.contains(target)) {
            return Optional.empty();
        }
        List<Transition> sequence = new ArrayList<>();
        Marking current = target;
        Edge edge;
        while ((edge = predecessors.get(current)) != null) {
            sequence.add(edge.transition());
            current = edge.source();
        }
        Collections.reverse(sequence);
        return Optional.of(sequence);
    }

    /**
     * A single firing {@code source --transition--> target}.
     */
    public static final class Edge {
        private final Marking source;
        private final Transition transition;
        private final Marking target;

        Edge(Marking source, Transition transition, Marking target) {
            this.source = source;
            this.transition = transition;
            this.target = target;
        }

        public Marking source() {
            return source;
        }

        public Transition transition() {
            return transition;
        }

        public Marking target() {
            return target;
        }

        @Override
        public String toString() {
            return source + " -" + transition.id() + "-> " + target;
        }
    }
}
