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

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Memoization of BDD operations. Keys are {@code (operation, a, b, c)} tuples, stored with open
 * addressing and linear probing. Entries are never evicted or overwritten: once a result is stored
 * it stays valid for the lifetime of the diagram, since nodes are never freed. The table is grown
 * whenever the configured load is exceeded.
 *
 * <p>Quantification and composition results depend on the quantified set or the mapping, too. These
 * are registered as contexts, each distinct set or mapping gets its own id which becomes part of the
 * key.</p>
 */
final class OperationCache {
    static final byte NOT_AN_OPERATION = 0;
    static final byte AND = 1;
    static final byte OR = 2;
    static final byte XOR = 3;
    static final byte NOT = 4;
    static final byte ITE = 5;
    static final byte EXISTS = 6;
    static final byte COMPOSE = 7;

    private static final String[] OPERATION_NAMES = {"-", "and", "or", "xor", "not", "ite", "exists", "compose"};
    private static final int MINIMUM_CACHE_SIZE = 32;

    private static final Logger logger = Logger.getLogger(OperationCache.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<OperationCache> cacheShutdownHook = new ConcurrentLinkedDeque<>();

    private final NodeTable associatedBdd;
    private final double maximumLoad;
    private final CacheStatistics[] statistics = new CacheStatistics[OPERATION_NAMES.length];

    private byte[] operations;
    private int[] keys;
    private int[] results;
    private int entryCount = 0;
    private int growCount = 0;

    private final Map<Object, Integer> contexts = new HashMap<>();

    private int lookupResult;

    OperationCache(NodeTable associatedBdd, BddConfiguration configuration) {
        this.associatedBdd = associatedBdd;
        this.maximumLoad = configuration.cacheMaximumLoad();
        this.lookupResult = associatedBdd.placeholder();
        for (int i = 0; i < statistics.length; i++) {
            statistics[i] = new CacheStatistics();
        }
        allocate(Primes.nextPrime(Math.max(configuration.initialCacheSize(), MINIMUM_CACHE_SIZE)));

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(OperationCache cache) {
        ShutdownHookLazyHolder.init();
        cacheShutdownHook.add(cache);
    }

    private void allocate(int capacity) {
        operations = new byte[capacity];
        keys = new int[3 * capacity];
        results = new int[capacity];
    }

    boolean binarySymmetricWellOrdered(int node1, int node2) {
        int node1var = associatedBdd.variableOf(node1);
        int node2var = associatedBdd.variableOf(node2);
        return node1var < node2var || (node1var == node2var && node1 < node2);
    }

    int lookupResult() {
        return lookupResult;
    }

    int capacity() {
        return operations.length;
    }

    int entryCount() {
        return entryCount;
    }

    /**
     * Returns the id of the given quantification set or variable mapping. Equal keys always obtain the
     * same id. The key must not be modified afterwards.
     */
    int registerContext(Object key) {
        Integer existing = contexts.get(key);
        if (existing != null) {
            return existing;
        }
        int id = contexts.size() + 1;
        contexts.put(key, id);
        return id;
    }

    int contextCount() {
        return contexts.size();
    }

    /**
     * Searches the result of the given operation. If found, {@code true} is returned and the result
     * can be obtained by {@link #lookupResult()}.
     */
    boolean lookup(byte operation, int firstKey, int secondKey, int thirdKey) {
        assert operation != NOT_AN_OPERATION;
        int slot = findSlot(operation, firstKey, secondKey, thirdKey);
        if (operations[slot] == NOT_AN_OPERATION) {
            return false;
        }
        lookupResult = results[slot];
        statistics[operation].cacheHit();
        return true;
    }

    boolean lookup(byte operation, int firstKey, int secondKey) {
        return lookup(operation, firstKey, secondKey, 0);
    }

    boolean lookup(byte operation, int key) {
        return lookup(operation, key, 0, 0);
    }

    void put(byte operation, int firstKey, int secondKey, int thirdKey, int result) {
        assert operation != NOT_AN_OPERATION;
        assert associatedBdd.isNodeValidOrLeaf(result);
        // The table may have grown since the lookup, probe again.
        int slot = findSlot(operation, firstKey, secondKey, thirdKey);
        if (operations[slot] != NOT_AN_OPERATION) {
            assert results[slot] == result : "Conflicting results for the same key";
            return;
        }
        operations[slot] = operation;
        keys[3 * slot] = firstKey;
        keys[3 * slot + 1] = secondKey;
        keys[3 * slot + 2] = thirdKey;
        results[slot] = result;
        entryCount += 1;
        statistics[operation].put();

        if (entryCount > maximumLoad * capacity()) {
            grow();
        }
    }

    void put(byte operation, int firstKey, int secondKey, int result) {
        put(operation, firstKey, secondKey, 0, result);
    }

    void put(byte operation, int key, int result) {
        put(operation, key, 0, 0, result);
    }

    private int findSlot(byte operation, int firstKey, int secondKey, int thirdKey) {
        int capacity = capacity();
        int slot = HashUtil.mod(HashUtil.hash(operation, firstKey, secondKey, thirdKey), capacity);
        while (true) {
            byte slotOperation = operations[slot];
            if (slotOperation == NOT_AN_OPERATION) {
                return slot;
            }
            int keyOffset = 3 * slot;
            if (slotOperation == operation
                    && keys[keyOffset] == firstKey
                    && keys[keyOffset + 1] == secondKey
                    && keys[keyOffset + 2] == thirdKey) {
                return slot;
            }
            slot += 1;
            if (slot == capacity) {
                slot = 0;
            }
        }
    }

    private void grow() {
        growCount += 1;
        byte[] oldOperations = operations;
        int[] oldKeys = keys;
        int[] oldResults = results;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newCapacity = Primes.nextPrime((int) Math.ceil(oldOperations.length / maximumLoad * 1.5));
        logger.log(Level.FINE, "Growing operation cache from {0} to {1}", new Object[] {
            oldOperations.length, newCapacity
        });

        allocate(newCapacity);
        for (int i = 0; i < oldOperations.length; i++) {
            byte operation = oldOperations[i];
            if (operation == NOT_AN_OPERATION) {
                continue;
            }
            int slot = findSlot(operation, oldKeys[3 * i], oldKeys[3 * i + 1], oldKeys[3 * i + 2]);
            assert operations[slot] == NOT_AN_OPERATION;
            operations[slot] = operation;
            System.arraycopy(oldKeys, 3 * i, keys, 3 * slot, 3);
            results[slot] = oldResults[i];
        }
    }

    String getStatistics() {
        StringBuilder builder = new StringBuilder(256);
        builder.append(String.format(
                        "Operation cache: capacity %d, %d entries (load %.3f), %d grows, %d contexts",
                        capacity(), entryCount, (double) entryCount / capacity(), growCount, contexts.size()))
                .append(System.lineSeparator());
        for (int operation = AND; operation < OPERATION_NAMES.length; operation++) {
            builder.append(' ')
                    .append(OPERATION_NAMES[operation])
                    .append(": ")
                    .append(statistics[operation])
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return String.format("OperationCache[%d/%d]", entryCount, capacity());
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int putCount = 0;

        void cacheHit() {
            hitCount++;
        }

        void put() {
            putCount++;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format("put=%d, hit=%d, hit-to-put=%3.3f", putCount, hitCount, hitToPutRatio);
        }
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // forces static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (OperationCache cache : cacheShutdownHook) {
                logger.info(cache.associatedBdd.statistics());
                logger.info(cache.getStatistics());
            }
        }
    }
}
