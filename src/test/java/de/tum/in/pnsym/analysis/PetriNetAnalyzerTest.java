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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import de.tum.in.pnsym.bdd.ImmutableBddConfiguration;
import de.tum.in.pnsym.net.NetBuilder;
import de.tum.in.pnsym.net.PetriNet;
import de.tum.in.pnsym.solver.EnumeratingSolver;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

public class PetriNetAnalyzerTest {
    @Test
    public void testPhilosophers() {
        PetriNet net = NetBuilder.philosophers(3);
        AnalysisReport report = new PetriNetAnalyzer().analyze(net, WeightVector.random(net, 0L, -3, 3), true);

        assertThat(report.reachableCount(), is(BigInteger.valueOf(14)));
        assertThat(report.explicit().orElseThrow().count(), is(14));
        assertThat(report.deadlock().status(), is(DeadlockStatus.FOUND));
        assertThat(report.optimum().orElseThrow().isVerified(), is(true));

        String summary = report.summary();
        assertThat(summary, containsString("Reachable markings (explicit): 14"));
        assertThat(summary, containsString("Deadlock: FOUND"));
        assertThat(summary, containsString("{left0, left1, left2}"));
        assertThat(report.symbolicTime().isNegative(), is(false));
    }

    @Test
    public void testWithoutExplicitEnumeration() {
        PetriNet net = NetBuilder.selfLoop();
        PetriNetAnalyzer analyzer = new PetriNetAnalyzer(
                ImmutableBddConfiguration.builder().initialSize(1).build(),
                new EnumeratingSolver(),
                ImmutableDeadlockSearchConfiguration.builder().build());
        AnalysisReport report = analyzer.analyze(net, WeightVector.of(5), false);

        assertThat(report.explicit().isPresent(), is(false));
        assertThat(report.reachableCount(), is(BigInteger.ONE));
        assertThat(report.deadlock().status(), is(DeadlockStatus.INFEASIBLE));
        assertThat(report.optimum().orElseThrow().objective(), is(5L));
        assertThat(report.summary().contains("explicit"), is(false));
    }
}
