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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class ExplicitReachabilityTest {
    @Test
    public void testPhilosopherCounts() {
        assertThat(ExplicitReachability.explore(NetBuilder.philosophers(2)).count(), is(6));
        assertThat(ExplicitReachability.explore(NetBuilder.philosophers(3)).count(), is(14));
    }

    @Test
    public void testCycle() {
        ExplicitReachability result = ExplicitReachability.explore(NetBuilder.cycle(5), true);
        assertThat(result.count(), is(5));
        assertThat(result.edges().size(), is(5));
        assertThat(result.isReachable(Marking.fromBitString("00000")), is(false));
        assertThat(result.isReachable(Marking.fromBitString("01000")), is(true));
    }

    @Test
    public void testEdgesOnlyWhenRequested() {
        assertThat(ExplicitReachability.explore(NetBuilder.cycle(3)).edges(), is(empty()));
    }

    @Test
    public void testTrace() {
        PetriNet net = NetBuilder.philosophers(2);
        ExplicitReachability result = ExplicitReachability.explore(net);
        Marking deadlock = Marking.fromPlaces(net, List.of("left0", "left1"));

        List<String> trace = result.trace(deadlock).orElseThrow().stream()
                .map(Transition::id)
                .collect(Collectors.toList());
        assertThat(trace, contains("takeLeft0", "takeLeft1"));
        assertThat(result.trace(net.initialMarking()).orElseThrow(), is(empty()));
        assertThat(result.trace(Marking.empty(net.placeCount())).isPresent(), is(false));

        Marking replayed = net.initialMarking();
        for (Transition transition : result.trace(deadlock).orElseThrow()) {
            replayed = transition.fire(replayed);
        }
        assertThat(replayed, is(deadlock));
        assertThat(net.isDead(replayed), is(true));
    }

    @Test
    public void testOnlyPhilosopherDeadlock() {
        PetriNet net = NetBuilder.philosophers(3);
        List<Marking> dead = ExplicitReachability.explore(net).visited().stream()
                .filter(net::isDead)
                .collect(Collectors.toList());
        assertThat(dead, contains(Marking.fromPlaces(net, List.of("left0", "left1", "left2"))));
    }
}
