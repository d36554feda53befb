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
import jakarta.validation.constraints.NotNull;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tuple key made of string parts. Parts are encoded as UTF-8 and separated by a zero byte, keys sort by their
 * encoded bytes (unsigned). A prefix scan on a key matches all keys that have at least one more part.
 */
public final class Key implements Comparable<Key> {
    private static final byte SEPARATOR = 0x00;
    private final List<String> parts;
    private final byte[] bytes;

    private Key(List<String> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Key needs at least one part");
        }
        for (String part : parts) {
            if (part == null || part.indexOf('\u0000') >= 0) {
                throw new IllegalArgumentException("Invalid key part: " + part);
            }
        }
        this.parts = List.copyOf(parts);
        this.bytes = encode(this.parts);
    }

    public static Key of(@NotNull String... parts) {
        return new Key(Arrays.asList(parts));
    }

    public static Key fromBytes(@NotNull byte[] bytes) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= bytes.length; i++) {
            if (i == bytes.length || bytes[i] == SEPARATOR) {
                parts.add(new String(bytes, start, i - start, Charsets.UTF_8));
                start = i + 1;
            }
        }
        return new Key(parts);
    }

    public Key append(@NotNull String part) {
        List<String> extended = new ArrayList<>(parts);
        extended.add(part);
        return new Key(extended);
    }

    public List<String> parts() {
        return parts;
    }

    public String lastPart() {
        return parts.get(parts.size() - 1);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * Encoded prefix matching every key that extends this one.
     */
    public byte[] prefixBytes() {
        byte[] prefix = Arrays.copyOf(bytes, bytes.length + 1);
        prefix[bytes.length] = SEPARATOR;
        return prefix;
    }

    public boolean isPrefixOf(@NotNull Key other) {
        byte[] prefix = prefixBytes();
        return other.bytes.length > prefix.length
                && Arrays.equals(prefix, 0, prefix.length, other.bytes, 0, prefix.length);
    }

    private static byte[] encode(List<String> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                out.write(SEPARATOR);
            }
            out.writeBytes(parts.get(i).getBytes(Charsets.UTF_8));
        }
        return out.toByteArray();
    }

    @Override
    public int compareTo(Key other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Key key)) return false;
        return Arrays.equals(bytes, key.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return String.join("/", parts);
    }
}
