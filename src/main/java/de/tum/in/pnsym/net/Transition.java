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

import de.tum.in.pnsym.bdd.BitSets;
import de.tum.in.pnsym.bdd.Util;
import java.util.BitSet;

/**
 * A transition of a 1-safe net. All arcs have weight one, so a transition is fully described by its
 * preset (input places) and postset (output places), both given as place index masks.
 */
public final class Transition {
    private final String id;
    private final String name;
    private final BitSet preset;
    private final BitSet postset;

    private Transition(String id, String name, BitSet preset, BitSet postset) {
        this.id = id;
        this.name = name;
        this.preset = preset;
        this.postset = postset;
    }

    public static Transition of(String id, String name, BitSet preset, BitSet postset) {
        return new Transition(id, name, BitSets.copyOf(preset), BitSets.copyOf(postset));
    }

    public static Transition of(String id, BitSet preset, BitSet postset) {
        return of(id, id, preset, postset);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public BitSet preset() {
        return BitSets.copyOf(preset);
    }

    public BitSet postset() {
        return BitSets.copyOf(postset);
    }

    public boolean isPresetEmpty() {
        return preset.isEmpty();
    }

    /**
     * A transition is enabled iff every preset place holds a token.
     */
    public boolean isEnabled(Marking marking) {
        return marking.containsAll(preset);
    }

    /**
     * Fires this transition: tokens are removed from the preset and put onto the postset. Places in
     * both keep their token, all other places are unchanged.
     *
     * @throws IllegalArgumentException if the transition is not enabled at {@code marking}.
     */
    public Marking fire(Marking marking) {
        Util.checkArgument(isEnabled(marking), "%s is not enabled at %s", id, marking);
        return marking.update(preset, postset);
    }

    @Override
    public String toString() {
        return id.equals(name) ? id : id + " (" + name + ")";
    }
}
