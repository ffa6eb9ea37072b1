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
import de.tum.in.pnsym.net.PetriNet;
import java.util.Arrays;
import java.util.BitSet;

/**
 * Assignment of diagram variables to places. Every place owns a current-state and a next-state
 * variable. They are declared in place order with the next-state variable of a place directly after
 * its current-state variable, i.e. on a fresh diagram place {@code i} gets the variables {@code 2i}
 * and {@code 2i + 1}.
 */
public final class VariableLayout {
    private static final String CURRENT_PREFIX = "cur.";
    private static final String NEXT_PREFIX = "next.";

    private final Bdd bdd;
    private final int placeCount;
    private final int[] currentVariables;
    private final int[] nextVariables;
    private final int[] placeOfVariable;
    private final BitSet currentSupport;
    private final BitSet nextSupport;

    private VariableLayout(Bdd bdd, int[] currentVariables, int[] nextVariables) {
        this.bdd = bdd;
        this.placeCount = currentVariables.length;
        this.currentVariables = currentVariables;
        this.nextVariables = nextVariables;

        placeOfVariable = new int[bdd.numberOfVariables()];
        Arrays.fill(placeOfVariable, -1);
        currentSupport = new BitSet(bdd.numberOfVariables());
        nextSupport = new BitSet(bdd.numberOfVariables());
        for (int place = 0; place < placeCount; place++) {
            placeOfVariable[currentVariables[place]] = place;
            placeOfVariable[nextVariables[place]] = place;
            currentSupport.set(currentVariables[place]);
            nextSupport.set(nextVariables[place]);
        }
    }

    /**
     * Declares the variables of all places of {@code net} on the given diagram. Declaring the same net
     * twice on one diagram yields the same layout.
     */
    public static VariableLayout declare(Bdd bdd, PetriNet net) {
        int places = net.placeCount();
        int[] current = new int[places];
        int[] next = new int[places];
        for (int place = 0; place < places; place++) {
            String name = net.places().get(place);
            current[place] = bdd.variableOf(bdd.createVariable(CURRENT_PREFIX + name));
            next[place] = bdd.variableOf(bdd.createVariable(NEXT_PREFIX + name));
            Util.checkState(
                    current[place] < next[place] && (place == 0 || next[place - 1] < current[place]),
                    "Variables of place %s violate the interleaved order",
                    name);
        }
        return new VariableLayout(bdd, current, next);
    }

    public Bdd bdd() {
        return bdd;
    }

    public int placeCount() {
        return placeCount;
    }

    public int currentVariable(int place) {
        return currentVariables[place];
    }

    public int nextVariable(int place) {
        return nextVariables[place];
    }

    /**
     * Returns the place owning the given variable or {@code -1} for variables of no place.
     */
    public int placeOf(int variable) {
        return variable < placeOfVariable.length ? placeOfVariable[variable] : -1;
    }

    public boolean isCurrentVariable(int variable) {
        return currentSupport.get(variable);
    }

    public BitSet currentVariables() {
        return (BitSet) currentSupport.clone();
    }

    public BitSet nextVariables() {
        return (BitSet) nextSupport.clone();
    }

    /**
     * The renaming moving every next-state variable onto the current-state variable of its place.
     */
    public int[] nextToCurrent() {
        int[] renaming = new int[bdd.numberOfVariables()];
        Arrays.fill(renaming, -1);
        for (int place = 0; place < placeCount; place++) {
            renaming[nextVariables[place]] = currentVariables[place];
        }
        return renaming;
    }

    /**
     * Encodes the marking as an assignment of the current-state variables.
     */
    public BitSet assignmentOf(Marking marking) {
        Util.checkArgument(marking.width() == placeCount, "Marking width %d, expected %d", marking.width(), placeCount);
        BitSet assignment = new BitSet(bdd.numberOfVariables());
        BitSet bits = marking.bits();
        for (int place = bits.nextSetBit(0); place >= 0; place = bits.nextSetBit(place + 1)) {
            assignment.set(currentVariables[place]);
        }
        return assignment;
    }

    /**
     * Decodes an assignment of the current-state variables. Other variables are ignored.
     */
    public Marking markingOf(BitSet assignment) {
        BitSet bits = new BitSet(placeCount);
        for (int place = 0; place < placeCount; place++) {
            if (assignment.get(currentVariables[place])) {
                bits.set(place);
            }
        }
        return Marking.of(placeCount, bits);
    }

    /**
     * The diagram satisfied exactly by {@code marking} over the current-state variables.
     */
    public int cubeOf(Marking marking) {
        return bdd.cube(currentSupport, assignmentOf(marking));
    }
}
