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

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated 1-safe place/transition net: an ordered list of places, the transitions over them and
 * the initial marking. Every instance satisfies the model invariants, invalid input is rejected with
 * a {@link ModelException} on creation.
 */
public final class PetriNet {
    private final List<String> places;
    private final Map<String, Integer> placeIndex;
    private final List<Transition> transitions;
    private final Marking initialMarking;

    private PetriNet(
            List<String> places, Map<String, Integer> placeIndex, List<Transition> transitions, Marking initialMarking) {
        this.places = places;
        this.placeIndex = placeIndex;
        this.transitions = transitions;
        this.initialMarking = initialMarking;
    }

    public static PetriNet create(List<String> places, List<Transition> transitions, Marking initialMarking)
            throws ModelException {
        if (places.isEmpty()) {
            throw new ModelException("Net has no places");
        }
        if (transitions.isEmpty()) {
            throw new ModelException("Net has no transitions");
        }

        Map<String, Integer> placeIndex = new LinkedHashMap<>();
        for (String place : places) {
            if (placeIndex.putIfAbsent(place, placeIndex.size()) != null) {
                throw new ModelException("Duplicate place " + place);
            }
        }

        Set<String> transitionIds = new HashSet<>();
        for (Transition transition : transitions) {
            if (placeIndex.containsKey(transition.id()) || !transitionIds.add(transition.id())) {
                throw new ModelException("Duplicate node id " + transition.id());
            }
            if (transition.preset().length() > places.size() || transition.postset().length() > places.size()) {
                throw new ModelException("Transition " + transition.id() + " refers to a nonexistent place");
            }
        }

        if (initialMarking.width() != places.size()) {
            throw new ModelException(String.format(
                    "Initial marking has width %d, expected %d", initialMarking.width(), places.size()));
        }

        return new PetriNet(
                List.copyOf(places),
                Collections.unmodifiableMap(placeIndex),
                List.copyOf(transitions),
                initialMarking);
    }

    public List<String> places() {
        return places;
    }

    public Map<String, Integer> placeIndex() {
        return placeIndex;
    }

    public int placeCount() {
        return places.size();
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public Marking initialMarking() {
        return initialMarking;
    }

    /**
     * Determines whether no transition is enabled at {@code marking}.
     */
    public boolean isDead(Marking marking) {
        return transitions.stream().noneMatch(transition -> transition.isEnabled(marking));
    }

    @Override
    public String toString() {
        return String.format("PetriNet[%d places, %d transitions]", places.size(), transitions.size());
    }
}
