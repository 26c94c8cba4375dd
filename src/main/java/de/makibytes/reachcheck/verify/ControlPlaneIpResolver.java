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

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.reachcheck.config.ReachCheckProperties;

/**
 * Asks the operator's control plane for a job's public IP, retrying at a fixed interval until an
 * address shows up or the overall timeout runs out.
 */
@Component
public class ControlPlaneIpResolver implements IpResolver {

    private static final Logger logger = LoggerFactory.getLogger(ControlPlaneIpResolver.class);

    private final String path;
    private final long retryIntervalMs;
    private final long timeoutMs;
    private final long requestTimeoutMs;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public ControlPlaneIpResolver(ReachCheckProperties properties) {
        ReachCheckProperties.Resolver resolver = properties.getResolver();
        this.path = sanitizePath(resolver.getPath());
        this.retryIntervalMs = Math.max(1, resolver.getRetryIntervalMs());
        this.timeoutMs = Math.max(0, resolver.getTimeoutMs());
        this.requestTimeoutMs = Math.max(100, resolver.getRequestTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(requestTimeoutMs))
                .build();
    }

    @Override
    public String resolve(String controlPlaneUrl, String jobId, String region) throws ResolutionException, InterruptedException {
        URI uri;
        try {
            uri = buildUri(controlPlaneUrl, jobId, region);
        } catch (IllegalArgumentException ex) {
            throw new ResolutionException("Invalid control plane URL '" + controlPlaneUrl + "': " + ex.getMessage(), 0);
        }
        long deadline = System.nanoTime() + Duration.ofMillis(timeoutMs).toNanos();
        String lastReason = "no attempt made";
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                String ip = fetchIp(uri);
                if (ip != null) {
                    logger.info("Resolved IP {} for job {} after {} attempt(s)", ip, jobId, attempt);
                    return ip;
                }
                lastReason = "no ip in control plane response";
            } catch (IOException ex) {
                lastReason = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            }
            logger.debug("IP for job {} not available yet (attempt {}): {}", jobId, attempt, lastReason);
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos < Duration.ofMillis(retryIntervalMs).toNanos()) {
                break;
            }
            Thread.sleep(retryIntervalMs);
        }
        throw new ResolutionException(String.format("No IP address after %d attempt(s) over %d s: %s",
                attempt, Duration.ofMillis(timeoutMs).toSeconds(), lastReason), attempt);
    }

    URI buildUri(String controlPlaneUrl, String jobId, String region) {
        if (controlPlaneUrl == null || controlPlaneUrl.isBlank()) {
            throw new IllegalArgumentException("empty");
        }
        String base = controlPlaneUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String query = "id=" + URLEncoder.encode(jobId, StandardCharsets.UTF_8)
                + "&region=" + URLEncoder.encode(region == null ? "" : region, StandardCharsets.UTF_8);
        URI uri = URI.create(base + path + "?" + query);
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("unsupported scheme " + uri.getScheme());
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host");
        }
        return uri;
    }

    private String fetchIp(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " from " + uri.getHost());
        }
        JsonNode json;
        try {
            json = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new IOException("unparseable control plane response: " + ex.getOriginalMessage(), ex);
        }
        String ip = json == null ? null : json.path("ip").asText(null);
        if (ip == null || ip.isBlank()) {
            return null;
        }
        return ip.trim();
    }

    private static String sanitizePath(String path) {
        if (path == null || path.isBlank()) {
            return "/ip";
        }
        String trimmed = path.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
