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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AbiCodec Tests")
class AbiCodecTest {

    @Test
    @DisplayName("hex quantities parse with or without prefix")
    void parsesQuantities() {
        assertEquals(436L, AbiCodec.parseQuantity("0x1b4"));
        assertEquals(436L, AbiCodec.parseQuantity("1B4"));
        assertEquals(0L, AbiCodec.parseQuantity("0x0"));
        assertNull(AbiCodec.parseQuantity("0x"));
        assertNull(AbiCodec.parseQuantity(null));
        assertEquals("0x65", AbiCodec.toQuantity(101));
    }

    @Test
    @DisplayName("address is the low 20 bytes of an indexed topic, lowercased")
    void addressFromTopic() {
        String topic = "0x000000000000000000000000AbCdEf0123456789aBcDeF0123456789AbCdEf01";

        assertEquals("0xabcdef0123456789abcdef0123456789abcdef01", AbiCodec.addressFromTopic(topic));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.addressFromTopic("0x1234"));
    }

    @Test
    @DisplayName("bytes32 job ids keep all 32 bytes")
    void normalizesBytes32() {
        String id = "0x" + "0".repeat(58) + "ABC123";

        assertEquals("0x" + "0".repeat(58) + "abc123", AbiCodec.normalizeBytes32(id));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.normalizeBytes32("0xabc123"));
    }

    @Test
    @DisplayName("address argument is left-padded to one word")
    void encodesAddress() {
        assertEquals("0".repeat(24) + "00000000000000000000000000000000000000aa",
                AbiCodec.encodeAddress("0x00000000000000000000000000000000000000AA"));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.encodeAddress("0xaa"));
    }

    @Test
    @DisplayName("dynamic string is decoded from its head offset")
    void decodesString() {
        String metadata = "{\"url\":\"https://artifacts.marlin.org/oyster/eifs/base-blue_v3.0.0_linux_amd64.eif\",\"region\":\"us-east\"}";

        assertEquals(metadata, AbiCodec.decodeString(AbiFixtures.jobOpenedData(metadata, 1, 2, 3), 0));
        assertEquals("http://cp.example:8080", AbiCodec.decodeString(AbiFixtures.stringReturn("http://cp.example:8080"), 0));
        assertEquals("", AbiCodec.decodeString(AbiFixtures.stringReturn(""), 0));
    }

    @Test
    @DisplayName("truncated or malformed data is rejected")
    void rejectsMalformedData() {
        String data = AbiFixtures.stringReturn("hello world");

        assertThrows(IllegalArgumentException.class, () -> AbiCodec.decodeString(data.substring(0, 2 + 64 + 64 + 4), 0));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.decodeString("0x", 0));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.decodeString("0xzz", 0));
        assertThrows(IllegalArgumentException.class, () -> AbiCodec.decodeString("0x" + "f".repeat(64), 0));
    }
}
