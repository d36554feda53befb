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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap backed store for tests and single process use. Transactions that lock keys serialize on one store wide
 * lock, which is held from the first {@code getForUpdate} (or the commit) until the transaction ends. A commit
 * publishes all of its writes at once: reads never see part of a transaction.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);
    private final ConcurrentSkipListMap<Key, byte[]> data = new ConcurrentSkipListMap<>();
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final ReentrantReadWriteLock visibilityLock = new ReentrantReadWriteLock();
    private final Duration lockTimeout;

    public InMemoryKeyValueStore() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryKeyValueStore(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    @Override
    public Optional<byte[]> get(Key key) {
        visibilityLock.readLock().lock();
        try {
            return Optional.ofNullable(data.get(key)).map(byte[]::clone);
        } finally {
            visibilityLock.readLock().unlock();
        }
    }

    @Override
    public List<KeyValueEntry> scan(Key prefix, Key startAfter, int limit) {
        Key from = startAfter != null && startAfter.compareTo(prefix) > 0 ? startAfter : prefix;
        List<KeyValueEntry> entries = new ArrayList<>();
        visibilityLock.readLock().lock();
        try {
            // extensions of a key sort directly after it, the first non matching key ends the range
            for (Map.Entry<Key, byte[]> entry : data.tailMap(from, false).entrySet()) {
                if (entries.size() >= limit || !prefix.isPrefixOf(entry.getKey())) {
                    break;
                }
                entries.add(new KeyValueEntry(entry.getKey(), entry.getValue().clone()));
            }
        } finally {
            visibilityLock.readLock().unlock();
        }
        return entries;
    }

    @Override
    public KeyValueTransaction beginTransaction() {
        return new InMemoryTransaction();
    }

    @Override
    public void close() {
        log.debug("Closing InMemoryKeyValueStore with {} keys", data.size());
        visibilityLock.writeLock().lock();
        try {
            data.clear();
        } finally {
            visibilityLock.writeLock().unlock();
        }
    }

    private final class InMemoryTransaction implements KeyValueTransaction {
        // a null value marks a delete
        private final Map<Key, byte[]> writes = new LinkedHashMap<>();
        private boolean locked = false;
        private boolean finished = false;

        @Override
        public Optional<byte[]> get(Key key) {
            checkActive();
            if (writes.containsKey(key)) {
                return Optional.ofNullable(writes.get(key)).map(byte[]::clone);
            }
            return InMemoryKeyValueStore.this.get(key);
        }

        @Override
        public Optional<byte[]> getForUpdate(Key key) {
            checkActive();
            lock();
            return get(key);
        }

        @Override
        public void put(Key key, byte[] value) {
            checkActive();
            writes.put(key, value.clone());
        }

        @Override
        public void delete(Key key) {
            checkActive();
            writes.put(key, null);
        }

        @Override
        public void commit() {
            checkActive();
            lock();
            try {
                visibilityLock.writeLock().lock();
                try {
                    writes.forEach((key, value) -> {
                        if (value != null) {
                            data.put(key, value);
                        } else {
                            data.remove(key);
                        }
                    });
                } finally {
                    visibilityLock.writeLock().unlock();
                }
                log.trace("Committed {} writes", writes.size());
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (!finished) {
                finish();
            }
        }

        @Override
        public void close() {
            rollback();
        }

        private void lock() {
            if (!locked) {
                try {
                    if (!writeLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        throw new KeyValueStoreException("Timed out waiting for lock after " + lockTimeout);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new KeyValueStoreException("Interrupted while waiting for lock", e);
                }
                locked = true;
            }
        }

        private void finish() {
            writes.clear();
            finished = true;
            if (locked) {
                locked = false;
                writeLock.unlock();
            }
        }

        private void checkActive() {
            if (finished) {
                throw new IllegalStateException("Transaction already finished");
            }
        }
    }
}
