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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class PetriNetTest {
    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int index : indices) {
            set.set(index);
        }
        return set;
    }

    private static final Transition move = Transition.of("t", bits(0), bits(1));

    @Test
    public void testFiring() {
        // p0 -> t -> p1, p2 untouched
        Marking marking = Marking.fromBitString("101");
        assertThat(move.isEnabled(marking), is(true));
        assertThat(move.fire(marking), is(Marking.fromBitString("110")));
        assertThrows(IllegalArgumentException.class, () -> move.fire(Marking.fromBitString("010")));
    }

    @Test
    public void testPlaceInPresetAndPostset() {
        Transition loop = Transition.of("loop", "keep", bits(0, 1), bits(1, 2));
        assertThat(loop.fire(Marking.fromBitString("011")), is(Marking.fromBitString("110")));
        assertThat(loop.toString(), is("loop (keep)"));
    }

    @Test
    public void testSourceTransitionIsAlwaysEnabled() {
        Transition source = Transition.of("source", new BitSet(), bits(0));
        assertThat(source.isPresetEmpty(), is(true));
        assertThat(source.isEnabled(Marking.empty(1)), is(true));
        // Producing onto a marked place keeps one token
        assertThat(source.fire(Marking.fromBitString("1")), is(Marking.fromBitString("1")));
    }

    @Test
    public void testDeadMarkings() {
        PetriNet net = NetBuilder.handOver();
        assertThat(net.isDead(Marking.fromBitString("01")), is(false));
        assertThat(net.isDead(Marking.fromBitString("10")), is(true));
        assertThat(net.isDead(Marking.fromBitString("00")), is(true));
    }

    @Test
    public void testValidation() {
        Marking initial = Marking.fromBitString("01");
        List<String> places = List.of("p0", "p1");

        ModelException noPlaces =
                assertThrows(ModelException.class, () -> PetriNet.create(List.of(), List.of(move), Marking.empty(0)));
        assertThat(noPlaces.getMessage(), containsString("no places"));
        assertThrows(ModelException.class, () -> PetriNet.create(places, List.of(), initial));
        assertThrows(ModelException.class, () -> PetriNet.create(List.of("p", "p"), List.of(move), initial));
        assertThrows(ModelException.class, () -> PetriNet.create(places, List.of(move, move), initial));
        assertThrows(
                ModelException.class,
                () -> PetriNet.create(places, List.of(Transition.of("p0", bits(0), bits(1))), initial));
        assertThrows(
                ModelException.class,
                () -> PetriNet.create(places, List.of(Transition.of("far", bits(0), bits(2))), initial));
        assertThrows(ModelException.class, () -> PetriNet.create(places, List.of(move), Marking.empty(3)));
    }

    @Test
    public void testAccessors() throws ModelException {
        PetriNet net = PetriNet.create(List.of("p0", "p1"), List.of(move), Marking.fromBitString("01"));
        assertThat(net.placeCount(), is(2));
        assertThat(net.placeIndex().get("p1"), is(1));
        assertThat(net.transitions().get(0).id(), is("t"));
        assertThat(net.toString(), is("PetriNet[2 places, 1 transitions]"));
    }
}
