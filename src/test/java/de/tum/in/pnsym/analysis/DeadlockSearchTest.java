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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.pnsym.bdd.BddFactory;
import de.tum.in.pnsym.net.ExplicitReachability;
import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.NetBuilder;
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.net.ReachabilityOracle;
import de.tum.in.pnsym.solver.EnumeratingSolver;
import de.tum.in.pnsym.solver.FeasibilityModel;
import de.tum.in.pnsym.solver.FeasibilitySolver;
import de.tum.in.pnsym.solver.Sat4jFeasibilitySolver;
import de.tum.in.pnsym.solver.SolverResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class DeadlockSearchTest {
    private static final ReachabilityOracle failingOracle = marking -> {
        throw new AssertionError("Oracle must not be consulted, asked for " + marking);
    };

    @Test
    public void testDeadMarkingModel() {
        PetriNet net = NetBuilder.philosophers(2);
        FeasibilityModel model = DeadlockSearch.deadMarkingModel(net);
        assertThat(model.variableCount(), is(net.placeCount()));
        assertThat(model.constraints().size(), is(net.transitions().size()));
        for (Marking marking : NetBuilder.allMarkings(net.placeCount())) {
            assertThat(model.isSatisfiedBy(marking.bits()), is(net.isDead(marking)));
        }
    }

    @Test
    public void testRefinementSteps() {
        // Dead markings are {} (unreachable) and {b} (reachable), the solver proposes {} first
        PetriNet net = NetBuilder.handOver();
        EnumeratingSolver solver = new EnumeratingSolver();
        DeadlockSearch.Run run = new DeadlockSearch(solver).start(net, ExplicitReachability.explore(net));

        List<DeadlockSearchState> states = new ArrayList<>();
        states.add(run.state());
        while (!run.state().isTerminal()) {
            states.add(run.advance());
        }
        assertThat(states, contains(
                DeadlockSearchState.SOLVING,
                DeadlockSearchState.CHECKING_REACHABILITY,
                DeadlockSearchState.BLOCKING,
                DeadlockSearchState.SOLVING,
                DeadlockSearchState.CHECKING_REACHABILITY,
                DeadlockSearchState.FOUND));

        DeadlockResult result = run.result();
        assertThat(result.status(), is(DeadlockStatus.FOUND));
        assertThat(result.deadlock().orElseThrow(), is(Marking.fromBitString("10")));
        assertThat(result.solverCalls(), is(2));
        assertThat(solver.calls(), is(2));
        assertThat(result.blockedCandidates(), contains(Marking.empty(2)));
        assertThrows(IllegalStateException.class, run::advance);
    }

    @Test
    public void testResultOnlyWhenFinished() {
        PetriNet net = NetBuilder.handOver();
        DeadlockSearch.Run run = new DeadlockSearch(new EnumeratingSolver()).start(net, failingOracle);
        assertThrows(IllegalStateException.class, run::result);
    }

    @Test
    public void testSymbolicOracle() {
        PetriNet net = NetBuilder.philosophers(3);
        ReachableSet reachable = new SymbolicReachability(BddFactory.buildBdd(), net).compute();
        DeadlockResult result = new DeadlockSearch(new Sat4jFeasibilitySolver()).search(net, reachable);

        assertThat(result.status(), is(DeadlockStatus.FOUND));
        assertThat(result.deadlock().orElseThrow(), is(Marking.fromPlaces(net, List.of("left0", "left1", "left2"))));
        assertThat(result.solverCalls(), is(result.blockedCandidates().size() + 1));
        for (Marking blocked : result.blockedCandidates()) {
            assertThat(net.isDead(blocked), is(true));
            assertThat(reachable.isReachable(blocked), is(false));
        }
    }

    @Test
    public void testProposalsAreNeverRepeated() {
        PetriNet net = NetBuilder.philosophers(2);
        FeasibilitySolver sat4j = new Sat4jFeasibilitySolver();
        List<BitSet> proposals = new ArrayList<>();
        FeasibilitySolver recording = (model, limit) -> {
            SolverResult result = sat4j.solve(model, limit);
            result.assignment().ifPresent(proposals::add);
            return result;
        };

        DeadlockResult result = new DeadlockSearch(recording).search(net, ExplicitReachability.explore(net));
        assertThat(result.status(), is(DeadlockStatus.FOUND));
        Set<BitSet> distinct = new HashSet<>(proposals);
        assertThat(distinct.size(), is(proposals.size()));
        assertThat(proposals.size(), is(result.solverCalls()));
    }

    @Test
    public void testSelfLoopHasNoDeadlock() {
        // The only dead marking {} is unreachable, blocking it leaves nothing
        PetriNet net = NetBuilder.selfLoop();
        DeadlockResult result = new DeadlockSearch(new Sat4jFeasibilitySolver())
                .search(net, ExplicitReachability.explore(net));
        assertThat(result.status(), is(DeadlockStatus.INFEASIBLE));
        assertThat(result.status().isConclusive(), is(true));
        assertThat(result.deadlock().isPresent(), is(false));
        assertThat(result.blockedCandidates(), contains(Marking.empty(1)));
    }

    @Test
    public void testSourceTransitionIsNeverDead() {
        PetriNet net = NetBuilder.builder()
                .place("p")
                .transition("produce", List.of(), List.of("p"))
                .build();
        DeadlockResult result = new DeadlockSearch(new Sat4jFeasibilitySolver()).search(net, failingOracle);
        assertThat(result.status(), is(DeadlockStatus.INFEASIBLE));
        assertThat(result.solverCalls(), is(1));
        assertThat(result.blockedCandidates(), is(empty()));
    }

    @Test
    public void testInconclusiveSolver() {
        PetriNet net = NetBuilder.handOver();
        DeadlockResult result = new DeadlockSearch((model, limit) -> SolverResult.inconclusive("gave up"))
                .search(net, failingOracle);
        assertThat(result.status(), is(DeadlockStatus.UNKNOWN));
        assertThat(result.status().isConclusive(), is(false));
        assertThat(result.deadlock().isPresent(), is(false));
    }

    @Test
    public void testTimeLimitIsPassed() {
        PetriNet net = NetBuilder.handOver();
        List<Duration> limits = new ArrayList<>();
        FeasibilitySolver solver = (model, limit) -> {
            limits.add(limit.orElseThrow());
            return SolverResult.infeasible();
        };
        DeadlockSearchConfiguration configuration = ImmutableDeadlockSearchConfiguration.builder()
                .solverTimeLimit(Duration.ofSeconds(3))
                .build();
        DeadlockResult result = new DeadlockSearch(solver, configuration).search(net, failingOracle);
        assertThat(result.status(), is(DeadlockStatus.INFEASIBLE));
        assertThat(limits, contains(Duration.ofSeconds(3)));
    }

    @Test
    public void testIterationLimit() {
        PetriNet net = NetBuilder.handOver();
        DeadlockSearchConfiguration configuration =
                ImmutableDeadlockSearchConfiguration.builder().iterationLimit(1).build();
        DeadlockResult result = new DeadlockSearch(new EnumeratingSolver(), configuration)
                .search(net, ExplicitReachability.explore(net));
        assertThat(result.status(), is(DeadlockStatus.LIMIT_EXCEEDED));
        assertThat(result.status().isConclusive(), is(false));
        assertThat(result.solverCalls(), is(1));
        assertThat(result.blockedCandidates(), contains(Marking.empty(2)));
    }

    @Test
    public void testConfigurationValidation() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ImmutableDeadlockSearchConfiguration.builder().iterationLimit(0).build());
        assertThrows(
                IllegalArgumentException.class,
                () -> ImmutableDeadlockSearchConfiguration.builder()
                        .solverTimeLimit(Duration.ZERO)
                        .build());
    }
}
