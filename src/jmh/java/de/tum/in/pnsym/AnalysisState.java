package de.tum.in.pnsym;

import de.tum.in.pnsym.bdd.Bdd;
import de.tum.in.pnsym.bdd.BddConfiguration;
import de.tum.in.pnsym.bdd.BddFactory;
import de.tum.in.pnsym.bdd.ImmutableBddConfiguration;
import de.tum.in.pnsym.net.NetBuilder;
import de.tum.in.pnsym.net.PetriNet;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class AnalysisState {
    @Param({"8", "12"})
    private int philosophers;

    @Param({"1"})
    private float cacheSizeFactor;

    private PetriNet net;
    private Bdd bdd;

    @Setup(Level.Trial)
    public void setUpNet() {
        net = NetBuilder.philosophers(philosophers);
    }

    @SuppressWarnings("NumericCastThatLosesPrecision")
    @Setup(Level.Iteration)
    public void setUpBdd() {
        bdd = BddFactory.buildBdd(ImmutableBddConfiguration.builder()
                .initialCacheSize((int) (BddConfiguration.DEFAULT_INITIAL_CACHE_SIZE * cacheSizeFactor))
                .build());
    }

    public PetriNet net() {
        return net;
    }

    public Bdd bdd() {
        return bdd;
    }
}
