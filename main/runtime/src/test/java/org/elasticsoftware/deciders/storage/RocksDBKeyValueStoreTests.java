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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class RocksDBKeyValueStoreTests {
    @TempDir
    Path baseDir;

    private static byte[] bytes(String value) {
        return value.getBytes(Charsets.UTF_8);
    }

    @Test
    public void testWriteInTransaction() {
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "write")) {
            try (KeyValueTransaction transaction = store.beginTransaction()) {
                transaction.put(Key.of("streamVersion", "s1"), bytes("v1"));
                assertTrue(store.get(Key.of("streamVersion", "s1")).isEmpty());
                transaction.commit();
            }
            assertArrayEquals(bytes("v1"), store.get(Key.of("streamVersion", "s1")).orElseThrow());
        }
    }

    @Test
    public void testRollbackDiscardsWrites() {
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "rollback")) {
            try (KeyValueTransaction transaction = store.beginTransaction()) {
                transaction.put(Key.of("a"), bytes("1"));
                transaction.rollback();
            }
            assertTrue(store.get(Key.of("a")).isEmpty());
        }
    }

    @Test
    public void testScanPrefixAndStartAfter() {
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "scan")) {
            try (KeyValueTransaction transaction = store.beginTransaction()) {
                transaction.put(Key.of("events", "a", "1"), bytes("a1"));
                transaction.put(Key.of("events", "a", "2"), bytes("a2"));
                transaction.put(Key.of("events", "a", "3"), bytes("a3"));
                transaction.put(Key.of("events", "ab", "1"), bytes("ab1"));
                transaction.commit();
            }
            List<KeyValueEntry> all = store.scan(Key.of("events", "a"));
            assertEquals(List.of("1", "2", "3"), all.stream().map(entry -> entry.key().lastPart()).toList());
            assertArrayEquals(bytes("a1"), all.get(0).value());

            List<KeyValueEntry> page = store.scan(Key.of("events", "a"), Key.of("events", "a", "1"), 1);
            assertEquals(List.of(Key.of("events", "a", "2")), page.stream().map(KeyValueEntry::key).toList());
        }
    }

    @Test
    public void testDataSurvivesReopen() {
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "reopen")) {
            try (KeyValueTransaction transaction = store.beginTransaction()) {
                transaction.put(Key.of("sequence"), bytes("42"));
                transaction.commit();
            }
        }
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "reopen")) {
            assertArrayEquals(bytes("42"), store.get(Key.of("sequence")).orElseThrow());
        }
    }

    @Test
    public void testGetForUpdateWaitsForCommit() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (RocksDBKeyValueStore store = new RocksDBKeyValueStore(baseDir.toString(), "locking")) {
            KeyValueTransaction transaction = store.beginTransaction();
            transaction.getForUpdate(Key.of("streamVersion", "s1"));
            transaction.put(Key.of("streamVersion", "s1"), bytes("v2"));
            Future<byte[]> competing = executor.submit(() -> {
                try (KeyValueTransaction other = store.beginTransaction()) {
                    return other.getForUpdate(Key.of("streamVersion", "s1")).orElse(null);
                }
            });
            Thread.sleep(100);
            transaction.commit();
            assertArrayEquals(bytes("v2"), competing.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
