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
package de.tum.in.pnsym.bdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class HashTest {
    @Test
    public void testCollisionRate() {
        Random random = new Random(0);

        int iterations = 256;
        double[] rate = new double[iterations];
        for (int i = 0; i < iterations; i++) {
            int size = Primes.nextPrime(20_000);
            int[] count = new int[size];

            for (int n = 0; n < size; n++) {
                byte operation = (byte) (1 + random.nextInt(7));
                int hash = HashUtil.mod(
                        HashUtil.hash(operation, random.nextInt(size), random.nextInt(size), random.nextInt(size)),
                        size);
                count[hash] += 1;
            }

            rate[i] = Arrays.stream(count).filter(c -> c > 1).count() / (double) size;
        }
        double average = Arrays.stream(rate).average().orElseThrow();
        // Uniform hashing gives about 1 - 2/e
        assertThat(average, lessThan(0.27));
    }

    @Test
    public void testModIsNonNegative() {
        assertThat(HashUtil.mod(-1, 7), is(6));
        assertThat(HashUtil.mod(Integer.MIN_VALUE, 13) >= 0, is(true));
        assertThat(HashUtil.mod(20, 7), is(6));
    }

    @Test
    public void testPrimes() {
        int[] primes = {2, 3, 5, 7, 1_009, 7_919, 2_147_483_647};
        for (int prime : primes) {
            assertThat(Primes.isPrime(prime), is(true));
        }
        int[] composites = {1, 4, 9, 1_001, 25_326_001, 1_373_653};
        for (int composite : composites) {
            assertThat(Primes.isPrime(composite), is(false));
        }
        assertThat(Primes.nextPrime(1_000), is(1_009));
        assertThat(Primes.nextPrime(1_009), is(1_009));
    }
}
