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
package de.makibytes.reachcheck.verify;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.support.StubHttpServer;
import de.makibytes.reachcheck.support.StubHttpServer.Reply;

@DisplayName("ControlPlaneIpResolver Tests")
class ControlPlaneIpResolverTest {

    private static final String JOB = "0x00000000000000000000000000000000000000000000000000000000000abc12";

    @Test
    @DisplayName("keeps polling until the control plane reports an ip")
    void pollsUntilIpAvailable() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (StubHttpServer server = StubHttpServer.start(request -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                return new Reply(404, "{\"error\":\"job not found\"}");
            }
            if (call == 2) {
                return Reply.json("{}");
            }
            return Reply.json("{\"ip\":\"3.4.5.6\"}");
        })) {
            ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(20, 2000));

            String ip = resolver.resolve(server.baseUrl() + "/", JOB, "us-east");

            assertEquals("3.4.5.6", ip);
            assertEquals(3, calls.get());
            assertEquals("/ip?id=" + JOB + "&region=us-east", server.requests().get(0).uri());
        }
    }

    @Test
    @DisplayName("gives up with the last reason once the timeout is spent")
    void failsAfterTimeout() throws Exception {
        try (StubHttpServer server = StubHttpServer.start(request -> new Reply(503, "unavailable"))) {
            ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(20, 150));

            long start = System.nanoTime();
            ResolutionException ex = assertThrows(ResolutionException.class,
                    () -> resolver.resolve(server.baseUrl(), JOB, ""));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(ex.getMessage().contains("HTTP 503"), ex.getMessage());
            assertTrue(ex.getAttempts() >= 2, "attempts: " + ex.getAttempts());
            assertTrue(elapsedMs < 2000, "elapsed " + elapsedMs + " ms");
        }
    }

    @Test
    @DisplayName("non-JSON body counts as not ready")
    void nonJsonBodyIsRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (StubHttpServer server = StubHttpServer.start(request -> calls.incrementAndGet() == 1
                ? Reply.json("<html>starting</html>")
                : Reply.json("{\"ip\":\" 10.0.0.7 \"}"))) {
            ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(10, 2000));

            assertEquals("10.0.0.7", resolver.resolve(server.baseUrl(), JOB, "eu-west"));
        }
    }

    @Test
    @DisplayName("invalid control plane URL fails without any request")
    void invalidUrlFailsFast() {
        ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(10, 1000));

        ResolutionException blank = assertThrows(ResolutionException.class, () -> resolver.resolve("  ", JOB, ""));
        assertEquals(0, blank.getAttempts());
        assertThrows(ResolutionException.class, () -> resolver.resolve("not a url", JOB, ""));
    }

    @Test
    @DisplayName("control plane URL must be http or https")
    void nonHttpSchemeFailsFast() {
        ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(10, 1000));

        ResolutionException ftp = assertThrows(ResolutionException.class, () -> resolver.resolve("ftp://1.2.3.4", JOB, ""));
        assertEquals(0, ftp.getAttempts());
        assertTrue(ftp.getMessage().contains("unsupported scheme ftp"), ftp.getMessage());
        assertThrows(ResolutionException.class, () -> resolver.resolve("ws://1.2.3.4:8080", JOB, ""));
        assertEquals("https", resolver.buildUri("HTTPS://cp.example", JOB, "").getScheme().toLowerCase());
    }

    @Test
    @DisplayName("region and job are URL-encoded into the query")
    void queryIsEncoded() {
        ControlPlaneIpResolver resolver = new ControlPlaneIpResolver(properties(10, 1000));

        assertEquals("http://cp.example:8080/ip?id=" + JOB + "&region=us+east%2F1",
                resolver.buildUri("http://cp.example:8080", JOB, "us east/1").toString());
    }

    private static ReachCheckProperties properties(long retryIntervalMs, long timeoutMs) {
        ReachCheckProperties properties = new ReachCheckProperties();
        properties.getResolver().setRetryIntervalMs(retryIntervalMs);
        properties.getResolver().setTimeoutMs(timeoutMs);
        properties.getResolver().setRequestTimeoutMs(1000);
        return properties;
    }
}
