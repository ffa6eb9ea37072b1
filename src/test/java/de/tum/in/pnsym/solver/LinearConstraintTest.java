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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class LinearConstraintTest {
    @Test
    public void testExcludingForbidsExactlyOneAssignment() {
        int width = 4;
        BitSet blocked = BitSet.valueOf(new long[] {0b0110});
        LinearConstraint constraint = LinearConstraint.excluding(blocked, width);
        for (long value = 0; value < (1L << width); value++) {
            BitSet assignment = BitSet.valueOf(new long[] {value});
            assertThat(constraint.isSatisfiedBy(assignment), is(!assignment.equals(blocked)));
        }
    }

    @Test
    public void testUnsatisfiable() {
        LinearConstraint constraint = LinearConstraint.unsatisfiable();
        assertThat(constraint.isConstant(), is(true));
        assertThat(constraint.isSatisfiedBy(new BitSet()), is(false));
        assertThat(constraint.toString(), is("0 >= 1"));
    }

    @Test
    public void testTerms() {
        BitSet assignment = new BitSet();
        assignment.set(1);
        assertThat(LinearTerm.of(3, 1).valueUnder(assignment), is(3));
        assertThat(LinearTerm.complementOf(3, 1).valueUnder(assignment), is(0));
        assertThat(LinearTerm.complementOf(2, 0).valueUnder(assignment), is(2));

        LinearConstraint constraint = LinearConstraint.atMost(List.of(LinearTerm.of(2, 0), LinearTerm.complementOf(1, 1)), 1);
        assertThat(constraint.toString(), is("2*x0 + (1 - x1) <= 1"));
        assertThat(constraint, is(LinearConstraint.atMost(List.of(LinearTerm.of(2, 0), LinearTerm.complementOf(1, 1)), 1)));
    }

    @Test
    public void testModelChecksVariables() {
        FeasibilityModel model = new FeasibilityModel(List.of("x", "y"));
        assertThrows(
                IllegalArgumentException.class,
                () -> model.add(LinearConstraint.atLeast(List.of(LinearTerm.of(1, 2)), 1)));
        model.add(LinearConstraint.atLeast(List.of(LinearTerm.of(1, 1)), 1));
        assertThat(model.constraints().size(), is(1));
        assertThat(model.variableName(1), is("y"));
    }
}
