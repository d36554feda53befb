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

import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} on a RocksDB {@link TransactionDB}. Keys read with {@code getForUpdate} are locked
 * pessimistically by RocksDB until the owning transaction commits or rolls back.
 */
public class RocksDBKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDBKeyValueStore.class);
    private static final long DEFAULT_LOCK_TIMEOUT_MS = 5000L;
    private final Options options;
    private final TransactionDBOptions transactionDBOptions;
    private final WriteOptions writeOptions;
    private final ReadOptions readOptions;
    private final TransactionDB db;
    private final File baseDir;

    public RocksDBKeyValueStore(String baseDir, String name) {
        RocksDB.loadLibrary();
        this.options = new Options();
        this.transactionDBOptions = new TransactionDBOptions();
        this.writeOptions = new WriteOptions();
        this.readOptions = new ReadOptions();
        options.setCreateIfMissing(true);
        transactionDBOptions.setTransactionLockTimeout(DEFAULT_LOCK_TIMEOUT_MS);
        this.baseDir = new File(baseDir, name);
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            log.info("RocksDB store {} initialized in folder {}", name, this.baseDir.getAbsolutePath());
        } catch (IOException | RocksDBException e) {
            closeOptions();
            throw new KeyValueStoreException("Error initializing RocksDB", e);
        }
    }

    @Override
    public Optional<byte[]> get(Key key) {
        try {
            return Optional.ofNullable(db.get(readOptions, key.toBytes()));
        } catch (RocksDBException e) {
            throw new KeyValueStoreException("Problem reading key " + key, e);
        }
    }

    @Override
    public List<KeyValueEntry> scan(Key prefix, Key startAfter, int limit) {
        byte[] prefixBytes = prefix.prefixBytes();
        List<KeyValueEntry> entries = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator(readOptions)) {
            if (startAfter != null && startAfter.compareTo(prefix) > 0) {
                iterator.seek(startAfter.toBytes());
                if (iterator.isValid() && Arrays.equals(iterator.key(), startAfter.toBytes())) {
                    iterator.next();
                }
            } else {
                iterator.seek(prefixBytes);
            }
            while (iterator.isValid() && entries.size() < limit) {
                byte[] key = iterator.key();
                if (key.length <= prefixBytes.length
                        || !Arrays.equals(prefixBytes, 0, prefixBytes.length, key, 0, prefixBytes.length)) {
                    break;
                }
                entries.add(new KeyValueEntry(Key.fromBytes(key), iterator.value()));
                iterator.next();
            }
            iterator.status();
        } catch (RocksDBException e) {
            throw new KeyValueStoreException("Problem scanning prefix " + prefix, e);
        }
        return entries;
    }

    @Override
    public KeyValueTransaction beginTransaction() {
        return new RocksDBTransaction(db.beginTransaction(writeOptions));
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
        closeOptions();
        log.info("RocksDB store in folder {} closed", baseDir.getAbsolutePath());
    }

    private void closeOptions() {
        readOptions.close();
        writeOptions.close();
        transactionDBOptions.close();
        options.close();
    }

    private final class RocksDBTransaction implements KeyValueTransaction {
        private final Transaction transaction;
        private boolean finished = false;

        private RocksDBTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public Optional<byte[]> get(Key key) {
            try {
                return Optional.ofNullable(transaction.get(readOptions, key.toBytes()));
            } catch (RocksDBException e) {
                throw new KeyValueStoreException("Problem reading key " + key, e);
            }
        }

        @Override
        public Optional<byte[]> getForUpdate(Key key) {
            try {
                return Optional.ofNullable(transaction.getForUpdate(readOptions, key.toBytes(), true));
            } catch (RocksDBException e) {
                throw new KeyValueStoreException("Problem locking key " + key, e);
            }
        }

        @Override
        public void put(Key key, byte[] value) {
            try {
                transaction.put(key.toBytes(), value);
            } catch (RocksDBException e) {
                throw new KeyValueStoreException("Problem writing key " + key, e);
            }
        }

        @Override
        public void delete(Key key) {
            try {
                transaction.delete(key.toBytes());
            } catch (RocksDBException e) {
                throw new KeyValueStoreException("Problem deleting key " + key, e);
            }
        }

        @Override
        public void commit() {
            try {
                transaction.commit();
            } catch (RocksDBException e) {
                throw new KeyValueStoreException("Error committing transaction", e);
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (!finished) {
                try {
                    transaction.rollback();
                } catch (RocksDBException e) {
                    throw new KeyValueStoreException("Error rolling back transaction", e);
                } finally {
                    finish();
                }
            }
        }

        @Override
        public void close() {
            rollback();
        }

        private void finish() {
            finished = true;
            transaction.close();
        }
    }
}
