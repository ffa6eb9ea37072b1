package de.tum.in.pnsym;

import de.tum.in.pnsym.analysis.DeadlockSearch;
import de.tum.in.pnsym.analysis.OptimalMarkingExtractor;
import de.tum.in.pnsym.analysis.ReachableSet;
import de.tum.in.pnsym.analysis.SymbolicReachability;
import de.tum.in.pnsym.analysis.WeightVector;
import de.tum.in.pnsym.solver.Sat4jFeasibilitySolver;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class ReachabilityBenchmark extends BaseAnalysisBenchmark {
    @Benchmark
    public static void symbolicReachability(AnalysisState state, Blackhole bh) {
        bh.consume(new SymbolicReachability(state.bdd(), state.net()).compute().count());
    }

    @Benchmark
    public static void deadlockSearch(AnalysisState state, Blackhole bh) {
        ReachableSet reachable = new SymbolicReachability(state.bdd(), state.net()).compute();
        bh.consume(new DeadlockSearch(new Sat4jFeasibilitySolver()).search(state.net(), reachable));
    }

    @Benchmark
    public static void optimalMarking(AnalysisState state, Blackhole bh) {
        ReachableSet reachable = new SymbolicReachability(state.bdd(), state.net()).compute();
        WeightVector weights = WeightVector.random(state.net(), 0L, -10, 10);
        bh.consume(OptimalMarkingExtractor.extract(reachable, weights));
    }
}
