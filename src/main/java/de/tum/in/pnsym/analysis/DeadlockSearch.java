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

import static de.tum.in.pnsym.bdd.Util.checkState;

import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.net.ReachabilityOracle;
import de.tum.in.pnsym.net.Transition;
import de.tum.in.pnsym.solver.FeasibilityModel;
import de.tum.in.pnsym.solver.FeasibilitySolver;
import de.tum.in.pnsym.solver.LinearConstraint;
import de.tum.in.pnsym.solver.LinearTerm;
import de.tum.in.pnsym.solver.SolverResult;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Searches a reachable dead marking by guess and check. The solver proposes markings in which no
 * transition is enabled, the reachability oracle decides whether a proposal is reachable, and every
 * unreachable proposal is excluded from the model by a no-good constraint.
 *
 * <p>The oracle may be any {@link ReachabilityOracle}, in particular the symbolic {@link
 * ReachableSet} or the explicit enumeration.</p>
 */
public final class DeadlockSearch {
    private static final Logger logger = Logger.getLogger(DeadlockSearch.class.getName());

    private final FeasibilitySolver solver;
    private final DeadlockSearchConfiguration configuration;

    public DeadlockSearch(FeasibilitySolver solver, DeadlockSearchConfiguration configuration) {
        this.solver = solver;
        this.configuration = configuration;
    }

    public DeadlockSearch(FeasibilitySolver solver) {
        this(solver, ImmutableDeadlockSearchConfiguration.builder().build());
    }

    /**
     * Builds the model whose solutions are exactly the dead markings: for every transition, at least
     * one preset place is empty. A transition with empty preset is enabled everywhere, hence then no
     * dead marking exists at all and the model gets the constant constraint {@code 0 >= 1}.
     */
    public static FeasibilityModel deadMarkingModel(PetriNet net) {
        FeasibilityModel model = new FeasibilityModel(net.places());
        for (Transition transition : net.transitions()) {
            BitSet preset = transition.preset();
            if (preset.isEmpty()) {
                model.add(LinearConstraint.unsatisfiable());
                continue;
            }
            List<LinearTerm> terms = new ArrayList<>(preset.cardinality());
            for (int place = preset.nextSetBit(0); place >= 0; place = preset.nextSetBit(place + 1)) {
                terms.add(LinearTerm.complementOf(1, place));
            }
            model.add(LinearConstraint.atLeast(terms, 1));
        }
        return model;
    }

    public DeadlockResult search(PetriNet net, ReachabilityOracle oracle) {
        Run run = start(net, oracle);
        while (!run.state().isTerminal()) {
            run.advance();
        }
        return run.result();
    }

    /**
     * Prepares a search without executing any step.
     */
    public Run start(PetriNet net, ReachabilityOracle oracle) {
        return new Run(net, oracle);
    }

    /**
     * A single execution of the refinement loop. All state of the search lives here.
     */
    public final class Run {
        private final PetriNet net;
        private final ReachabilityOracle oracle;
        private final FeasibilityModel model;
        private final List<Marking> blocked = new ArrayList<>();

        private DeadlockSearchState state = DeadlockSearchState.SOLVING;
        private int solverCalls = 0;
        @Nullable
        private Marking candidate = null;

        Run(PetriNet net, ReachabilityOracle oracle) {
            this.net = net;
            this.oracle = oracle;
            this.model = deadMarkingModel(net);
        }

        public DeadlockSearchState state() {
            return state;
        }

        public int solverCalls() {
            return solverCalls;
        }

        public FeasibilityModel model() {
            return model;
        }

        /**
         * Performs one transition of the state machine and returns the new state.
         */
        public DeadlockSearchState advance() {
            checkState(!state.isTerminal(), "Search already finished in state %s", state);
            switch (state) {
                case SOLVING:
                    state = solve();
                    break;
                case CHECKING_REACHABILITY:
                    assert candidate != null;
                    state = oracle.isReachable(candidate) ? DeadlockSearchState.FOUND : DeadlockSearchState.BLOCKING;
                    break;
                case BLOCKING:
                    assert candidate != null;
                    logger.log(Level.FINE, "Excluding unreachable dead marking {0}", candidate.format(net));
                    model.add(LinearConstraint.excluding(candidate.bits(), net.placeCount()));
                    blocked.add(candidate);
                    candidate = null;
                    state = DeadlockSearchState.SOLVING;
                    break;
                default:
                    throw new AssertionError(state);
            }
            return state;
        }

        private DeadlockSearchState solve() {
            if (solverCalls >= configuration.iterationLimit()) {
                logger.log(Level.WARNING, "Deadlock search on {0} exceeded {1} iterations", new Object[] {
                    net, configuration.iterationLimit()
                });
                return DeadlockSearchState.LIMIT_EXCEEDED;
            }
            solverCalls += 1;
            SolverResult result = solver.solve(model, configuration.solverTimeLimit());
            switch (result.status()) {
                case OPTIMAL:
                    candidate = Marking.of(net.placeCount(), result.assignment().orElseThrow());
                    assert net.isDead(candidate) : "Solver proposed live marking " + candidate;
                    return DeadlockSearchState.CHECKING_REACHABILITY;
                case INFEASIBLE:
                    return DeadlockSearchState.INFEASIBLE;
                case INCONCLUSIVE:
                    logger.log(Level.WARNING, "Solver {0} was inconclusive: {1}", new Object[] {solver, result.detail()});
                    return DeadlockSearchState.UNKNOWN;
                default:
                    throw new AssertionError(result.status());
            }
        }

        public DeadlockResult result() {
            checkState(state.isTerminal(), "Search still running in state %s", state);
            return new DeadlockResult(
                    DeadlockStatus.of(state), state == DeadlockSearchState.FOUND ? candidate : null, solverCalls, blocked);
        }
    }
}
