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

import de.tum.in.pnsym.bdd.Util;
import de.tum.in.pnsym.net.Marking;
import de.tum.in.pnsym.net.PetriNet;
import java.util.Arrays;
import java.util.Map;
import java.util.Random;

/**
 * An integer weight for every place of a net.
 */
public final class WeightVector {
    private final int[] weights;

    private WeightVector(int[] weights) {
        this.weights = weights;
    }

    public static WeightVector of(int... weights) {
        return new WeightVector(weights.clone());
    }

    /**
     * Weights by place name. Places without an entry get weight zero.
     */
    public static WeightVector of(PetriNet net, Map<String, Integer> weightsByPlace) {
        for (String place : weightsByPlace.keySet()) {
            Util.checkArgument(net.placeIndex().containsKey(place), "Unknown place %s", place);
        }
        int[] weights = new int[net.placeCount()];
        for (int place = 0; place < weights.length; place++) {
            weights[place] = weightsByPlace.getOrDefault(net.places().get(place), 0);
        }
        return new WeightVector(weights);
    }

    /**
     * Uniformly drawn weights in {@code [min, max]}, reproducible through the {@code seed}.
     */
    public static WeightVector random(PetriNet net, long seed, int min, int max) {
        Util.checkArgument(min <= max, "Empty range [%d, %d]", min, max);
        Random random = new Random(seed);
        int[] weights = new int[net.placeCount()];
        for (int place = 0; place < weights.length; place++) {
            weights[place] = min + random.nextInt(max - min + 1);
        }
        return new WeightVector(weights);
    }

    public int size() {
        return weights.length;
    }

    public int weight(int place) {
        return weights[place];
    }

    /**
     * The weighted sum over the marked places of {@code marking}.
     */
    public long valueOf(Marking marking) {
        Util.checkArgument(marking.width() == weights.length, "Marking width %d, expected %d", marking.width(), weights.length);
        long sum = 0L;
        for (int place = 0; place < weights.length; place++) {
            if (marking.isMarked(place)) {
                sum += weights[place];
            }
        }
        return sum;
    }

    public String format(PetriNet net) {
        StringBuilder builder = new StringBuilder();
        for (int place = 0; place < weights.length; place++) {
            if (place > 0) {
                builder.append(", ");
            }
            builder.append(net.places().get(place)).append(':').append(weights[place]);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof WeightVector && Arrays.equals(weights, ((WeightVector) o).weights));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return Arrays.toString(weights);
    }
}
