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
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.net.Transition;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes the firing semantics of single transitions as diagrams. Relations are kept per transition
 * and never merged.
 */
public final class TransitionRelationBuilder {
    private static final Logger logger = Logger.getLogger(TransitionRelationBuilder.class.getName());

    private final VariableLayout layout;
    private final Bdd bdd;

    public TransitionRelationBuilder(VariableLayout layout) {
        this.layout = layout;
        this.bdd = layout.bdd();
    }

    public List<TransitionRelation> buildAll(PetriNet net) {
        List<TransitionRelation> relations = new ArrayList<>(net.transitions().size());
        for (Transition transition : net.transitions()) {
            relations.add(build(transition));
        }
        return relations;
    }

    /**
     * Builds {@code enabled(t) ∧ effect_0 ∧ ... ∧ effect_n} where the effect of a place depends on
     * whether it is in the preset, the postset, both or neither (then the value is kept).
     */
    public TransitionRelation build(Transition transition) {
        BitSet preset = transition.preset();
        BitSet postset = transition.postset();

        int enabling = bdd.trueNode();
        for (int place = preset.nextSetBit(0); place >= 0; place = preset.nextSetBit(place + 1)) {
            enabling = bdd.and(enabling, currentNode(place));
        }

        // Conjoin from the bottom of the variable order upwards, every step then only adds nodes on top
        int effects = bdd.trueNode();
        for (int place = layout.placeCount() - 1; place >= 0; place--) {
            effects = bdd.and(placeEffect(place, preset.get(place), postset.get(place)), effects);
        }
        int relation = bdd.and(enabling, effects);
        logger.log(Level.FINER, "Relation of {0} has {1} nodes", new Object[] {transition, bdd.nodeCount(relation)});
        return new TransitionRelation(transition, relation);
    }

    private int placeEffect(int place, boolean inPreset, boolean inPostset) {
        int current = currentNode(place);
        int next = bdd.variableNode(layout.nextVariable(place));
        if (inPreset && !inPostset) {
            return bdd.and(current, bdd.not(next));
        }
        if (!inPreset && inPostset) {
            return bdd.and(bdd.not(current), next);
        }
        if (inPreset) {
            return bdd.and(current, next);
        }
        return bdd.equivalence(current, next);
    }

    private int currentNode(int place) {
        return bdd.variableNode(layout.currentVariable(place));
    }
}
