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
import de.tum.in.pnsym.bdd.BddConfiguration;
import de.tum.in.pnsym.bdd.BddFactory;
import de.tum.in.pnsym.bdd.ImmutableBddConfiguration;
import de.tum.in.pnsym.net.ExplicitReachability;
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.solver.FeasibilitySolver;
import de.tum.in.pnsym.solver.Sat4jFeasibilitySolver;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the complete analysis of a net: reachable set, deadlock search and weighted optimum. Every call
 * works on its own diagram, so calls do not influence each other.
 */
public final class PetriNetAnalyzer {
    private static final Logger logger = Logger.getLogger(PetriNetAnalyzer.class.getName());

    private final BddConfiguration bddConfiguration;
    private final DeadlockSearch deadlockSearch;

    public PetriNetAnalyzer(
            BddConfiguration bddConfiguration,
            FeasibilitySolver solver,
            DeadlockSearchConfiguration deadlockConfiguration) {
        this.bddConfiguration = bddConfiguration;
        this.deadlockSearch = new DeadlockSearch(solver, deadlockConfiguration);
    }

    public PetriNetAnalyzer() {
        this(
                ImmutableBddConfiguration.builder().build(),
                new Sat4jFeasibilitySolver(),
                ImmutableDeadlockSearchConfiguration.builder().build());
    }

    /**
     * Analyzes the given net.
     *
     * @param weights Weights of the optimisation.
     * @param explicit Whether the markings are enumerated explicitly as well.
     */
    public AnalysisReport analyze(PetriNet net, WeightVector weights, boolean explicit) {
        long start = System.nanoTime();
        ExplicitReachability enumeration = explicit ? ExplicitReachability.explore(net) : null;
        long explicitDone = System.nanoTime();

        Bdd bdd = BddFactory.buildBdd(bddConfiguration);
        ReachableSet reachable = new SymbolicReachability(bdd, net).compute();
        long symbolicDone = System.nanoTime();

        DeadlockResult deadlock = deadlockSearch.search(net, reachable);
        long deadlockDone = System.nanoTime();

        Optional<OptimalMarking> optimum = OptimalMarkingExtractor.extract(reachable, weights);
        long optimizationDone = System.nanoTime();

        AnalysisReport report = new AnalysisReport(
                net,
                enumeration,
                reachable,
                deadlock,
                optimum.orElse(null),
                explicitDone - start,
                symbolicDone - explicitDone,
                deadlockDone - symbolicDone,
                optimizationDone - deadlockDone);

        if (logger.isLoggable(Level.INFO)) {
            logger.log(Level.INFO, "Analysis of {0}:{1}{2}Timings: explicit {3}, symbolic {4}, deadlock {5}, optimum {6}",
                    new Object[] {
                        net,
                        System.lineSeparator(),
                        report.summary(),
                        report.explicitTime(),
                        report.symbolicTime(),
                        report.deadlockTime(),
                        report.optimizationTime()
                    });
        }
        logger.log(Level.FINER, bdd::statistics);
        return report;
    }
}
