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

import de.tum.in.pnsym.net.ExplicitReachability;
import de.tum.in.pnsym.net.PetriNet;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Everything computed for one net by {@link PetriNetAnalyzer}.
 */
public final class AnalysisReport {
    private final PetriNet net;
    @Nullable
    private final ExplicitReachability explicit;
    private final ReachableSet reachable;
    private final DeadlockResult deadlock;
    @Nullable
    private final OptimalMarking optimum;
    private final long explicitNanos;
    private final long symbolicNanos;
    private final long deadlockNanos;
    private final long optimizationNanos;

    AnalysisReport(
            PetriNet net,
            @Nullable ExplicitReachability explicit,
            ReachableSet reachable,
            DeadlockResult deadlock,
            @Nullable OptimalMarking optimum,
            long explicitNanos,
            long symbolicNanos,
            long deadlockNanos,
            long optimizationNanos) {
        this.net = net;
        this.explicit = explicit;
        this.reachable = reachable;
        this.deadlock = deadlock;
        this.optimum = optimum;
        this.explicitNanos = explicitNanos;
        this.symbolicNanos = symbolicNanos;
        this.deadlockNanos = deadlockNanos;
        this.optimizationNanos = optimizationNanos;
    }

    public PetriNet net() {
        return net;
    }

    /**
     * The explicit enumeration, present if it was requested.
     */
    public Optional<ExplicitReachability> explicit() {
        return Optional.ofNullable(explicit);
    }

    public ReachableSet reachable() {
        return reachable;
    }

    public BigInteger reachableCount() {
        return reachable.count();
    }

    public DeadlockResult deadlock() {
        return deadlock;
    }

    /**
     * The optimum, absent if no marking is reachable.
     */
    public Optional<OptimalMarking> optimum() {
        return Optional.ofNullable(optimum);
    }

    public Duration explicitTime() {
        return Duration.ofNanos(explicitNanos);
    }

    public Duration symbolicTime() {
        return Duration.ofNanos(symbolicNanos);
    }

    public Duration deadlockTime() {
        return Duration.ofNanos(deadlockNanos);
    }

    public Duration optimizationTime() {
        return Duration.ofNanos(optimizationNanos);
    }

    public String summary() {
        StringBuilder builder = new StringBuilder(256);
        String newline = System.lineSeparator();
        builder.append("Places: ").append(net.placeCount()).append(newline);
        builder.append("Initial marking: ").append(net.initialMarking().format(net)).append(newline);
        if (explicit != null) {
            builder.append("Reachable markings (explicit): ").append(explicit.count()).append(newline);
        }
        builder.append("Reachable markings (symbolic): ")
                .append(reachableCount())
                .append(" after ")
                .append(reachable.iterations())
                .append(" iterations")
                .append(newline);
        builder.append("Deadlock: ").append(deadlock.status());
        deadlock.deadlock().ifPresent(marking -> builder.append(' ')
                .append(marking.toBitString())
                .append(' ')
                .append(marking.format(net)));
        builder.append(newline);
        if (optimum == null) {
            builder.append("Optimum: no reachable marking").append(newline);
        } else {
            builder.append("Optimum: ")
                    .append(optimum.objective())
                    .append(" at ")
                    .append(optimum.marking().toBitString())
                    .append(' ')
                    .append(optimum.marking().format(net))
                    .append(", verification sum ")
                    .append(optimum.verificationSum())
                    .append(newline);
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return summary();
    }
}
