/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.reachcheck.chain;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Hex quantity and ABI helpers for the handful of shapes the market contract returns.
 */
public final class AbiCodec {

    private static final int WORD = 32;

    private AbiCodec() {}

    public static Long parseQuantity(String hex) {
        if (hex == null) {
            return null;
        }
        String normalized = strip0x(hex.trim());
        if (normalized.isBlank()) {
            return null;
        }
        return new BigInteger(normalized, 16).longValue();
    }

    public static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Indexed address topics are left-padded to 32 bytes; the address is the low 20 bytes.
     */
    public static String addressFromTopic(String topic) {
        String normalized = strip0x(topic == null ? "" : topic.trim()).toLowerCase(Locale.ROOT);
        if (normalized.length() < 40) {
            throw new IllegalArgumentException("Topic too short for an address: " + topic);
        }
        return "0x" + normalized.substring(normalized.length() - 40);
    }

    public static String normalizeBytes32(String topic) {
        String normalized = strip0x(topic == null ? "" : topic.trim()).toLowerCase(Locale.ROOT);
        if (normalized.length() != 64) {
            throw new IllegalArgumentException("Expected 32 bytes, got: " + topic);
        }
        return "0x" + normalized;
    }

    public static String encodeAddress(String address) {
        String normalized = strip0x(address == null ? "" : address.trim()).toLowerCase(Locale.ROOT);
        if (normalized.length() != 40) {
            throw new IllegalArgumentException("Not an address: " + address);
        }
        return "0".repeat(24) + normalized;
    }

    /**
     * Decodes the dynamic {@code string} whose head slot is {@code argIndex} in ABI-encoded data.
     */
    public static String decodeString(String dataHex, int argIndex) {
        byte[] data = decodeHex(dataHex);
        int offset = readInt(data, argIndex * WORD);
        int length = readInt(data, offset);
        int start = offset + WORD;
        if (start + length > data.length) {
            throw new IllegalArgumentException("String runs past end of data");
        }
        return new String(data, start, length, StandardCharsets.UTF_8);
    }

    public static byte[] decodeHex(String hex) {
        String normalized = strip0x(hex == null ? "" : hex.trim());
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd-length hex string");
        }
        byte[] bytes = new byte[normalized.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int high = Character.digit(normalized.charAt(i * 2), 16);
            int low = Character.digit(normalized.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("Invalid hex character at " + (i * 2));
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }

    private static int readInt(byte[] data, int position) {
        if (position < 0 || position + WORD > data.length) {
            throw new IllegalArgumentException("ABI word at " + position + " is out of bounds");
        }
        byte[] word = new byte[WORD];
        System.arraycopy(data, position, word, 0, WORD);
        BigInteger value = new BigInteger(1, word);
        if (value.bitLength() > 31) {
            throw new IllegalArgumentException("ABI offset or length too large: " + value);
        }
        return value.intValue();
    }

    private static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
