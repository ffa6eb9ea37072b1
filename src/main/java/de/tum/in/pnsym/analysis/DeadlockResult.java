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
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

public final class DeadlockResult {
    private final DeadlockStatus status;
    @Nullable
    private final Marking deadlock;
    private final int solverCalls;
    private final List<Marking> blockedCandidates;

    DeadlockResult(DeadlockStatus status, @Nullable Marking deadlock, int solverCalls, List<Marking> blockedCandidates) {
        assert (status == DeadlockStatus.FOUND) == (deadlock != null);
        this.status = status;
        this.deadlock = deadlock;
        this.solverCalls = solverCalls;
        this.blockedCandidates = List.copyOf(blockedCandidates);
    }

    public DeadlockStatus status() {
        return status;
    }

    /**
     * The reachable dead marking, present iff the status is {@link DeadlockStatus#FOUND}.
     */
    public Optional<Marking> deadlock() {
        return Optional.ofNullable(deadlock);
    }

    public int solverCalls() {
        return solverCalls;
    }

    /**
     * Dead but unreachable markings proposed by the solver, in the order they were excluded.
     */
    public List<Marking> blockedCandidates() {
        return blockedCandidates;
    }

    @Override
    public String toString() {
        return String.format(
                "DeadlockResult[%s%s, %d solver calls, %d blocked]",
                status, deadlock == null ? "" : " " + deadlock, solverCalls, blockedCandidates.size());
    }
}
