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

import de.tum.in.pnsym.net.Marking;
import java.util.BitSet;

/**
 * A reachable marking of maximal weight. The objective is the value found by the diagram search, the
 * verification sum is recomputed from the marking and the weights alone; both always agree.
 */
public final class OptimalMarking {
    private final Marking marking;
    private final long objective;
    private final long verificationSum;
    private final BitSet completedPlaces;

    OptimalMarking(Marking marking, long objective, long verificationSum, BitSet completedPlaces) {
        this.marking = marking;
        this.objective = objective;
        this.verificationSum = verificationSum;
        this.completedPlaces = completedPlaces;
    }

    public Marking marking() {
        return marking;
    }

    public long objective() {
        return objective;
    }

    public long verificationSum() {
        return verificationSum;
    }

    public boolean isVerified() {
        return objective == verificationSum;
    }

    /**
     * Places not decided by the chosen diagram path and set by the sign of their weight.
     */
    public BitSet completedPlaces() {
        return (BitSet) completedPlaces.clone();
    }

    @Override
    public String toString() {
        return String.format("OptimalMarking[%s, objective %d, verification %d]", marking, objective, verificationSum);
    }
}
