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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.reachcheck.config.ReachCheckProperties;

/**
 * Calls the externally hosted refresh endpoint for a job and expects an {@code ip} field back.
 */
@Component
public class GatewayEndpointCrossChecker implements EndpointCrossChecker {

    static final String IP_FIELD = "ip";
    private static final Logger logger = LoggerFactory.getLogger(GatewayEndpointCrossChecker.class);

    private final String urlTemplate;
    private final long timeoutMs;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public GatewayEndpointCrossChecker(ReachCheckProperties properties) {
        this.urlTemplate = properties.getCrossCheck().getUrlTemplate();
        this.timeoutMs = Math.max(100, properties.getCrossCheck().getTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    @Override
    public CrossCheckResult check(String jobId) throws InterruptedException {
        String url = refreshUrl(jobId);
        logger.info("Calling refresh API: {}", url);
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException | IllegalArgumentException ex) {
            return CrossCheckResult.failed(CrossCheckResult.Failure.TRANSPORT,
                    "Failed to call refresh API: " + describe(ex));
        }

        JsonNode json;
        try {
            json = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            return CrossCheckResult.failed(CrossCheckResult.Failure.DECODE,
                    "Failed to parse refresh API response" + statusSuffix(response.statusCode()) + ": " + ex.getOriginalMessage());
        }
        if (json == null || json.isMissingNode()) {
            return CrossCheckResult.failed(CrossCheckResult.Failure.DECODE,
                    "Failed to parse refresh API response" + statusSuffix(response.statusCode()) + ": empty body");
        }

        // arrays and scalars parse fine but never carry the key
        JsonNode ip = json.isObject() ? json.get(IP_FIELD) : null;
        if (ip == null || ip.isNull() || !ip.isValueNode() || ip.asText().isBlank()) {
            return CrossCheckResult.failed(CrossCheckResult.Failure.MISSING_FIELD,
                    "IP key NOT found in refresh API response" + statusSuffix(response.statusCode()));
        }
        return CrossCheckResult.ok(ip.asText().trim());
    }

    String refreshUrl(String jobId) {
        return urlTemplate.replace("{job}", URLEncoder.encode(jobId, StandardCharsets.UTF_8));
    }

    private static String statusSuffix(int statusCode) {
        return statusCode == 200 ? "" : " (HTTP " + statusCode + ")";
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
