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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.pnsym.bdd.Bdd;
import de.tum.in.pnsym.bdd.BddFactory;
import de.tum.in.pnsym.net.ExplicitReachability;
import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.NetBuilder;
import de.tum.in.pnsym.net.PetriNet;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class OptimalMarkingExtractorTest {
    /**
     * Place {@code a} always holds its token, the places {@code x} and {@code y} can be filled and
     * emptied at will. The reachable set therefore only tests {@code a}.
     */
    private static PetriNet freePlaces() {
        return NetBuilder.builder()
                .place("x")
                .marked("a")
                .place("y")
                .transition("fillX", List.of(), List.of("x"))
                .transition("emptyX", List.of("x"), List.of())
                .transition("fillY", List.of(), List.of("y"))
                .transition("emptyY", List.of("y"), List.of())
                .build();
    }

    private static ReachableSet reachable(PetriNet net) {
        return new SymbolicReachability(BddFactory.buildBdd(), net).compute();
    }

    public static Stream<PetriNet> nets() {
        return Stream.of(
                NetBuilder.philosophers(2),
                NetBuilder.philosophers(3),
                NetBuilder.cycle(5),
                NetBuilder.handOver(),
                NetBuilder.selfLoop(),
                freePlaces());
    }

    @ParameterizedTest
    @MethodSource("nets")
    public void testMatchesBruteForce(PetriNet net) {
        ExplicitReachability explicit = ExplicitReachability.explore(net);
        ReachableSet reachable = reachable(net);
        for (long seed = 0; seed < 20; seed++) {
            WeightVector weights = WeightVector.random(net, seed, -5, 5);
            OptimalMarking optimum = OptimalMarkingExtractor.extract(reachable, weights).orElseThrow();

            long best = explicit.visited().stream().mapToLong(weights::valueOf).max().orElseThrow();
            assertThat(weights.toString(), optimum.objective(), is(best));
            assertThat(optimum.isVerified(), is(true));
            assertThat(optimum.verificationSum(), is(weights.valueOf(optimum.marking())));
            assertThat(explicit.isReachable(optimum.marking()), is(true));
        }
    }

    @Test
    public void testFreePlaceFollowsWeightSign() {
        PetriNet net = freePlaces();
        ReachableSet reachable = reachable(net);
        BitSet support = reachable.bdd().support(reachable.node());
        assertThat(support.cardinality(), is(1));

        OptimalMarking positive = OptimalMarkingExtractor.extract(
                        reachable, WeightVector.of(net, Map.of("x", 2, "a", 1, "y", -4)))
                .orElseThrow();
        assertThat(positive.marking(), is(Marking.fromPlaces(net, List.of("x", "a"))));
        assertThat(positive.objective(), is(3L));
        BitSet completed = new BitSet();
        completed.set(0);
        completed.set(2);
        assertThat(positive.completedPlaces(), is(completed));

        OptimalMarking negative = OptimalMarkingExtractor.extract(
                        reachable, WeightVector.of(net, Map.of("x", -2, "a", -1, "y", 4)))
                .orElseThrow();
        assertThat(negative.marking(), is(Marking.fromPlaces(net, List.of("a", "y"))));
        assertThat(negative.objective(), is(3L));
    }

    @Test
    public void testFixedPlaceIsKeptDespiteNegativeWeight() {
        PetriNet net = NetBuilder.selfLoop();
        OptimalMarking optimum = OptimalMarkingExtractor.extract(reachable(net), WeightVector.of(-7)).orElseThrow();
        assertThat(optimum.marking(), is(Marking.fromBitString("1")));
        assertThat(optimum.objective(), is(-7L));
        assertThat(optimum.completedPlaces().isEmpty(), is(true));
    }

    @Test
    public void testEmptySet() {
        PetriNet net = NetBuilder.handOver();
        Bdd bdd = BddFactory.buildBdd();
        VariableLayout layout = VariableLayout.declare(bdd, net);
        ReachableSet empty = new ReachableSet(layout, bdd.falseNode(), 0);
        assertThat(OptimalMarkingExtractor.extract(empty, WeightVector.of(1, 1)).isPresent(), is(false));
    }

    @Test
    public void testWeightCountMustMatch() {
        ReachableSet reachable = reachable(NetBuilder.handOver());
        assertThrows(
                IllegalArgumentException.class, () -> OptimalMarkingExtractor.extract(reachable, WeightVector.of(1)));
    }

    @Test
    public void testWeightVectors() {
        PetriNet net = NetBuilder.handOver();
        assertThat(WeightVector.of(net, Map.of("b", 3)), is(WeightVector.of(0, 3)));
        assertThat(WeightVector.random(net, 4L, -3, 3), is(WeightVector.random(net, 4L, -3, 3)));
        assertThat(WeightVector.of(2, -1).format(net), is("a:2, b:-1"));
        assertThrows(IllegalArgumentException.class, () -> WeightVector.of(net, Map.of("c", 1)));
    }
}
