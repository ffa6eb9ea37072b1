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

/**
 * States of the deadlock refinement loop. The loop cycles {@code SOLVING -> CHECKING_REACHABILITY ->
 * BLOCKING -> SOLVING} until it reaches one of the terminal states.
 */
public enum DeadlockSearchState {
    SOLVING(false),
    CHECKING_REACHABILITY(false),
    BLOCKING(false),
    FOUND(true),
    INFEASIBLE(true),
    UNKNOWN(true),
    LIMIT_EXCEEDED(true);

    private final boolean terminal;

    DeadlockSearchState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
