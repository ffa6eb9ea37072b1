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

import de.tum.in.pnsym.net.Transition;

/**
 * The diagram over current- and next-state variables satisfied exactly by the pairs {@code (M, M')}
 * with {@code M --transition--> M'}.
 */
public final class TransitionRelation {
    private final Transition transition;
    private final int node;

    TransitionRelation(Transition transition, int node) {
        this.transition = transition;
        this.node = node;
    }

    public Transition transition() {
        return transition;
    }

    public int node() {
        return node;
    }

    @Override
    public String toString() {
        return "Relation[" + transition.id() + " -> " + node + "]";
    }
}
