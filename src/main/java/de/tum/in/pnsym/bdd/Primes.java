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

/**
 * Table sizes are kept prime so that the cheap additive hashes spread well.
 */
final class Primes {
    // Deterministic Miller-Rabin witnesses for all n < 4,759,123,141
    private static final long[] WITNESSES = {2L, 7L, 61L};

    private Primes() {}

    static int nextPrime(int lowerBound) {
        int candidate = Math.max(3, lowerBound | 1);
        while (!isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

    static boolean isPrime(int n) {
        if (n < 2) {
            return false;
        }
        if (n == 2 || n == 3 || n == 5 || n == 7) {
            return true;
        }
        if (n % 2 == 0 || n % 3 == 0 || n % 5 == 0) {
            return false;
        }
        for (long witness : WITNESSES) {
            if (witness % n == 0) {
                continue;
            }
            if (!testWitness(witness, n)) {
                return false;
            }
        }
        return true;
    }

    private static boolean testWitness(long base, long n) {
        int r = Long.numberOfTrailingZeros(n - 1L);
        long d = (n - 1L) >> r;
        long a = powMod(base % n, d, n);
        if (a == 1L || a == n - 1L) {
            return true;
        }
        for (int j = 1; j < r; j++) {
            a = (a * a) % n;
            if (a == n - 1L) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("AssignmentToMethodParameter")
    private static long powMod(long a, long p, long m) {
        // m < 2^31, so every product fits into a long
        long result = 1L;
        for (; p != 0L; p >>= 1L) {
            if ((p & 1L) != 0L) {
                result = (result * a) % m;
            }
            a = (a * a) % m;
        }
        return result;
    }
}
