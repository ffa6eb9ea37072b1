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
package de.tum.in.pnsym.solver;

import java.math.BigInteger;
import java.time.Duration;
import java.util.BitSet;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sat4j.core.Vec;
import org.sat4j.core.VecInt;
import org.sat4j.pb.IPBSolver;
import org.sat4j.pb.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.IVec;
import org.sat4j.specs.IVecInt;
import org.sat4j.specs.TimeoutException;

/**
 * Solves feasibility models with the Sat4j pseudo-boolean solver. Every call works on a fresh solver
 * instance. Model variable {@code i} is the Sat4j variable {@code i + 1}, a complemented term {@code
 * 1 - x} is the negative literal.
 */
public final class Sat4jFeasibilitySolver implements FeasibilitySolver {
    private static final Logger logger = Logger.getLogger(Sat4jFeasibilitySolver.class.getName());

    @Override
    public SolverResult solve(FeasibilityModel model, Optional<Duration> timeLimit) {
        // Constant constraints are decided here, the solver only sees proper ones
        for (LinearConstraint constraint : model.constraints()) {
            if (constraint.isConstant() && !constraint.isSatisfiedBy(new BitSet())) {
                logger.log(Level.FINER, "Constant constraint {0} is violated", constraint);
                return SolverResult.infeasible();
            }
        }

        IPBSolver solver = SolverFactory.newDefault();
        solver.newVar(model.variableCount());
        timeLimit.ifPresent(limit -> solver.setTimeoutMs(Math.max(1L, limit.toMillis())));

        try {
            for (LinearConstraint constraint : model.constraints()) {
                if (!constraint.isConstant()) {
                    addConstraint(solver, constraint);
                }
            }
        } catch (ContradictionException e) {
            logger.log(Level.FINER, "Contradiction while adding constraints: {0}", e.getMessage());
            return SolverResult.infeasible();
        }

        try {
            if (!solver.isSatisfiable()) {
                return SolverResult.infeasible();
            }
        } catch (TimeoutException e) {
            logger.log(Level.FINE, "Solver ran out of time on {0}", model);
            return SolverResult.inconclusive("timeout");
        }

        BitSet assignment = new BitSet(model.variableCount());
        for (int variable = 0; variable < model.variableCount(); variable++) {
            if (solver.model(variable + 1)) {
                assignment.set(variable);
            }
        }
        assert model.isSatisfiedBy(assignment) : "Solver returned an invalid assignment " + assignment;
        return SolverResult.optimal(assignment);
    }

    private static void addConstraint(IPBSolver solver, LinearConstraint constraint) throws ContradictionException {
        IVecInt literals = new VecInt(constraint.terms().size());
        IVec<BigInteger> coefficients = new Vec<>(constraint.terms().size());
        for (LinearTerm term : constraint.terms()) {
            int literal = term.variable() + 1;
            literals.push(term.isNegated() ? -literal : literal);
            coefficients.push(BigInteger.valueOf(term.coefficient()));
        }
        boolean atLeast = constraint.comparison() == LinearConstraint.Comparison.AT_LEAST;
        solver.addPseudoBoolean(literals, coefficients, atLeast, BigInteger.valueOf(constraint.bound()));
    }

    @Override
    public String toString() {
        return "Sat4j";
    }
}
