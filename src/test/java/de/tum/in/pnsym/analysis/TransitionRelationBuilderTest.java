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

import de.tum.in.pnsym.bdd.Bdd;
import de.tum.in.pnsym.bdd.BddFactory;
import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.NetBuilder;
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.net.Transition;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TransitionRelationBuilderTest {
    /** Covers every combination of preset and postset membership. */
    private static PetriNet mixedNet() {
        return NetBuilder.builder()
                .marked("p0")
                .place("p1")
                .marked("p2")
                .place("p3")
                .transition("move", List.of("p0"), List.of("p1"))
                .transition("read", List.of("p1", "p2"), List.of("p2"))
                .transition("source", List.of(), List.of("p3"))
                .transition("sink", List.of("p3"), List.of())
                .build();
    }

    private static BitSet pairAssignment(VariableLayout layout, Marking current, Marking next) {
        BitSet assignment = layout.assignmentOf(current);
        for (int place = 0; place < layout.placeCount(); place++) {
            if (next.isMarked(place)) {
                assignment.set(layout.nextVariable(place));
            }
        }
        return assignment;
    }

    /** A 1-safe net never produces onto a marked place that it does not also consume from. */
    private static boolean contactFree(Transition transition, Marking marking) {
        BitSet produced = transition.postset();
        produced.andNot(transition.preset());
        return !produced.intersects(marking.bits());
    }

    @Test
    public void testLayout() {
        Bdd bdd = BddFactory.buildBdd();
        PetriNet net = mixedNet();
        VariableLayout layout = VariableLayout.declare(bdd, net);

        assertThat(bdd.numberOfVariables(), is(8));
        for (int place = 0; place < net.placeCount(); place++) {
            assertThat(layout.currentVariable(place), is(2 * place));
            assertThat(layout.nextVariable(place), is(2 * place + 1));
            assertThat(layout.placeOf(2 * place + 1), is(place));
            assertThat(layout.nextToCurrent()[2 * place + 1], is(2 * place));
            assertThat(layout.nextToCurrent()[2 * place], is(-1));
        }
        assertThat(bdd.variableName(2), is("cur.p1"));
        assertThat(layout.placeOf(42), is(-1));

        VariableLayout again = VariableLayout.declare(bdd, net);
        assertThat(again.currentVariables(), is(layout.currentVariables()));
        assertThat(bdd.numberOfVariables(), is(8));

        Marking marking = Marking.fromBitString("1010");
        assertThat(layout.markingOf(layout.assignmentOf(marking)), is(marking));
        assertThat(bdd.countSatisfyingAssignments(layout.cubeOf(marking), layout.currentVariables()).intValueExact(), is(1));
    }

    @Test
    public void testEncodingRoundTrip() {
        for (int width = 2; width <= 5; width++) {
            Bdd bdd = BddFactory.buildBdd();
            VariableLayout layout = VariableLayout.declare(bdd, NetBuilder.cycle(width));
            List<Marking> markings = NetBuilder.allMarkings(width);
            for (Marking marking : markings) {
                BitSet assignment = layout.assignmentOf(marking);
                assertThat(layout.markingOf(assignment), is(marking));
                assertThat(layout.nextVariables().intersects(assignment), is(false));

                int cube = layout.cubeOf(marking);
                for (Marking other : markings) {
                    assertThat(
                            marking + " against " + other,
                            bdd.evaluate(cube, layout.assignmentOf(other)),
                            is(other.equals(marking)));
                }
            }
        }
    }

    @Test
    public void testRelationMatchesFiring() {
        Bdd bdd = BddFactory.buildBdd();
        PetriNet net = mixedNet();
        VariableLayout layout = VariableLayout.declare(bdd, net);
        List<TransitionRelation> relations = new TransitionRelationBuilder(layout).buildAll(net);
        assertThat(relations.size(), is(net.transitions().size()));

        List<Marking> markings = NetBuilder.allMarkings(net.placeCount());
        for (TransitionRelation relation : relations) {
            Transition transition = relation.transition();
            for (Marking current : markings) {
                for (Marking next : markings) {
                    boolean expected = transition.isEnabled(current)
                            && contactFree(transition, current)
                            && transition.fire(current).equals(next);
                    assertThat(
                            transition + ": " + current + " -> " + next,
                            bdd.evaluate(relation.node(), pairAssignment(layout, current, next)),
                            is(expected));
                }
            }
        }
    }

    @Test
    public void testRelationSupport() {
        Bdd bdd = BddFactory.buildBdd();
        PetriNet net = mixedNet();
        VariableLayout layout = VariableLayout.declare(bdd, net);
        TransitionRelation move = new TransitionRelationBuilder(layout).build(net.transitions().get(0));

        // Untouched places still constrain the next state (frame condition)
        BitSet all = new BitSet();
        all.set(0, bdd.numberOfVariables());
        assertThat(bdd.support(move.node()), is(all));
        // p0 marked and p1 empty, p2 and p3 arbitrary
        assertThat(bdd.countSatisfyingAssignments(move.node()).intValueExact(), is(4));
    }
}
