/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.deciders.storage;

import com.google.common.base.Charsets;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private static byte[] bytes(String value) {
        return value.getBytes(Charsets.UTF_8);
    }

    @Test
    void testGetWhenEmpty() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        assertTrue(store.get(Key.of("nonexistent")).isEmpty());
    }

    @Test
    void testCommitMakesWritesVisible() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.put(Key.of("a"), bytes("1"));
            // own writes are visible inside the transaction
            assertArrayEquals(bytes("1"), transaction.get(Key.of("a")).orElseThrow());
            assertTrue(store.get(Key.of("a")).isEmpty());
            transaction.commit();
        }
        assertArrayEquals(bytes("1"), store.get(Key.of("a")).orElseThrow());
    }

    @Test
    void testCloseWithoutCommitRollsBack() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.put(Key.of("a"), bytes("1"));
        }
        assertTrue(store.get(Key.of("a")).isEmpty());
    }

    @Test
    void testDelete() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.put(Key.of("a"), bytes("1"));
            transaction.commit();
        }
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.delete(Key.of("a"));
            assertTrue(transaction.get(Key.of("a")).isEmpty());
            transaction.commit();
        }
        assertTrue(store.get(Key.of("a")).isEmpty());
    }

    @Test
    void testFinishedTransactionRejectsWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        KeyValueTransaction transaction = store.beginTransaction();
        transaction.commit();
        assertThrows(IllegalStateException.class, () -> transaction.put(Key.of("a"), bytes("1")));
    }

    @Test
    void testScanPrefixInOrder() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.put(Key.of("events", "a", "2"), bytes("a2"));
            transaction.put(Key.of("events", "a", "1"), bytes("a1"));
            transaction.put(Key.of("events", "ab", "1"), bytes("ab1"));
            transaction.put(Key.of("events", "a"), bytes("a"));
            transaction.put(Key.of("eventsX"), bytes("x"));
            transaction.commit();
        }
        List<KeyValueEntry> entries = store.scan(Key.of("events", "a"));
        assertEquals(List.of(Key.of("events", "a", "1"), Key.of("events", "a", "2")),
                entries.stream().map(KeyValueEntry::key).toList());
        assertEquals(4, store.scan(Key.of("events")).size());
    }

    @Test
    void testScanStartAfterAndLimit() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            for (int i = 1; i <= 5; i++) {
                transaction.put(Key.of("log", "0" + i), bytes(String.valueOf(i)));
            }
            transaction.commit();
        }
        List<KeyValueEntry> entries = store.scan(Key.of("log"), Key.of("log", "02"), 2);
        assertEquals(List.of("03", "04"), entries.stream().map(entry -> entry.key().lastPart()).toList());
    }

    @Test
    void testLockedKeyBlocksOtherTransaction() throws Exception {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(Duration.ofMillis(100));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.getForUpdate(Key.of("version"));
            Future<?> other = executor.submit(() -> {
                try (KeyValueTransaction competing = store.beginTransaction()) {
                    competing.getForUpdate(Key.of("version"));
                }
            });
            ExecutionException e = assertThrows(ExecutionException.class, () -> other.get(5, TimeUnit.SECONDS));
            assertInstanceOf(KeyValueStoreException.class, e.getCause());
            transaction.commit();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testLockIsReleasedOnCommit() throws Exception {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(Duration.ofSeconds(5));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            KeyValueTransaction transaction = store.beginTransaction();
            transaction.getForUpdate(Key.of("version"));
            transaction.put(Key.of("version"), bytes("1"));
            Future<byte[]> other = executor.submit(() -> {
                try (KeyValueTransaction competing = store.beginTransaction()) {
                    return competing.getForUpdate(Key.of("version")).orElse(null);
                }
            });
            transaction.commit();
            assertArrayEquals(bytes("1"), other.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testReturnedValuesAreCopies() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.put(Key.of("p", "a"), bytes("1"));
            transaction.commit();
        }
        store.get(Key.of("p", "a")).orElseThrow()[0] = 'x';
        store.scan(Key.of("p")).get(0).value()[0] = 'y';
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.get(Key.of("p", "a")).orElseThrow()[0] = 'z';
        }
        assertArrayEquals(bytes("1"), store.get(Key.of("p", "a")).orElseThrow());
    }
}
