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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;

/**
 * Token presence of every place of a net. Bit {@code i} is set iff place {@code i} (in place order)
 * holds a token. Instances are immutable and always exactly as wide as the place count.
 */
public final class Marking {
    private final int width;
    private final BitSet bits;

    private Marking(int width, BitSet bits) {
        this.width = width;
        this.bits = bits;
    }

    public static Marking of(int width, BitSet bits) {
        Util.checkArgument(width >= 0, "Negative width %d", width);
        Util.checkArgument(bits.length() <= width, "Bit %d exceeds width %d", bits.length() - 1, width);
        return new Marking(width, BitSets.copyOf(bits));
    }

    public static Marking empty(int width) {
        return of(width, new BitSet());
    }

    /**
     * Creates the marking in which exactly the given places hold a token.
     *
     * @throws IllegalArgumentException if a name is not a place of the net.
     */
    public static Marking fromPlaces(PetriNet net, Collection<String> markedPlaces) {
        BitSet bits = new BitSet(net.placeCount());
        for (String place : markedPlaces) {
            Integer index = net.placeIndex().get(place);
            Util.checkArgument(index != null, "Unknown place %s", place);
            bits.set(index);
        }
        return new Marking(net.placeCount(), bits);
    }

    /**
     * Parses the output of {@link #toBitString()}.
     */
    public static Marking fromBitString(String bitString) {
        int width = bitString.length();
        BitSet bits = new BitSet(width);
        for (int i = 0; i < width; i++) {
            char c = bitString.charAt(width - 1 - i);
            Util.checkArgument(c == '0' || c == '1', "Invalid character %s in %s", c, bitString);
            if (c == '1') {
                bits.set(i);
            }
        }
        return new Marking(width, bits);
    }

    public int width() {
        return width;
    }

    public boolean isMarked(int place) {
        Util.checkArgument(0 <= place && place < width, "Place %d out of range", place);
        return bits.get(place);
    }

    public int tokenCount() {
        return bits.cardinality();
    }

    public BitSet bits() {
        return BitSets.copyOf(bits);
    }

    /**
     * Returns whether all places of {@code places} are marked.
     */
    public boolean containsAll(BitSet places) {
        return BitSets.isSubset(places, bits);
    }

    /**
     * Returns {@code (this \ removed) ∪ added}.
     */
    public Marking update(BitSet removed, BitSet added) {
        BitSet result = BitSets.copyOf(bits);
        result.andNot(removed);
        result.or(added);
        return of(width, result);
    }

    public List<String> placeNames(PetriNet net) {
        Util.checkArgument(net.placeCount() == width, "Marking of width %d does not fit the net", width);
        List<String> names = new ArrayList<>(bits.cardinality());
        for (int place = bits.nextSetBit(0); place >= 0; place = bits.nextSetBit(place + 1)) {
            names.add(net.places().get(place));
        }
        return names;
    }

    /**
     * The bit vector as a binary numeral: the highest place index comes first, place 0 last.
     */
    public String toBitString() {
        StringBuilder builder = new StringBuilder(width);
        for (int place = width - 1; place >= 0; place--) {
            builder.append(bits.get(place) ? '1' : '0');
        }
        return builder.toString();
    }

    /**
     * Lists the marked places, e.g. {@code {p1, p3}}.
     */
    public String format(PetriNet net) {
        return "{" + String.join(", ", placeNames(net)) + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Marking)) {
            return false;
        }
        Marking other = (Marking) o;
        return width == other.width && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * width + bits.hashCode();
    }

    @Override
    public String toString() {
        return toBitString();
    }
}
