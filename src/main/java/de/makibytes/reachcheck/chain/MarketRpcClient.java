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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.JobEvent;

/**
 * JSON-RPC client for the market contract: head height, {@code JobOpened} logs and operator lookup.
 */
@Component
public class MarketRpcClient implements EventSource, OperatorDirectory {

    private static final String JSONRPC_VERSION = "2.0";
    private static final Logger logger = LoggerFactory.getLogger(MarketRpcClient.class);

    private final ReachCheckProperties.Chain chain;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public MarketRpcClient(ReachCheckProperties properties) {
        this.chain = properties.getChain();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, chain.getConnectTimeoutMs())))
                .build();
    }

    @Override
    public long headBlockNumber() throws IOException, InterruptedException {
        JsonNode result = call("eth_blockNumber", mapper.createArrayNode());
        Long blockNumber = AbiCodec.parseQuantity(result.asText(null));
        if (blockNumber == null) {
            throw new IOException("eth_blockNumber returned no block number");
        }
        return blockNumber;
    }

    @Override
    public List<JobEvent> jobOpenedEvents(long fromBlock, long toBlock) throws IOException, InterruptedException {
        ObjectNode filter = mapper.createObjectNode()
                .put("address", chain.getContractAddress())
                .put("fromBlock", AbiCodec.toQuantity(fromBlock))
                .put("toBlock", AbiCodec.toQuantity(toBlock));
        filter.putArray("topics").add(chain.getJobOpenedTopic());
        JsonNode result = call("eth_getLogs", mapper.createArrayNode().add(filter));
        if (!result.isArray()) {
            throw new IOException("eth_getLogs returned " + result.getNodeType() + " instead of an array");
        }
        List<JobEvent> events = new ArrayList<>();
        for (JsonNode log : result) {
            if (log.path("removed").asBoolean(false)) {
                continue;
            }
            JobEvent event = decodeJobOpened(log);
            if (event != null) {
                events.add(event);
            }
        }
        events.sort(Comparator.comparingLong(JobEvent::blockNumber).thenComparingLong(JobEvent::logIndex));
        return events;
    }

    @Override
    public String controlPlaneUrl(String operator) throws IOException, InterruptedException {
        String data = chain.getProvidersSelector() + AbiCodec.encodeAddress(operator);
        ObjectNode callObject = mapper.createObjectNode()
                .put("to", chain.getContractAddress())
                .put("data", data);
        JsonNode result;
        try {
            result = call("eth_call", mapper.createArrayNode().add(callObject).add("latest"));
        } catch (RpcErrorException ex) {
            if (ex.isReverted()) {
                throw new OperatorRecordException(operator, "providers(" + operator + ") reverted: " + ex.getMessage(), ex);
            }
            throw ex;
        }
        String url;
        try {
            url = AbiCodec.decodeString(result.asText(""), 0);
        } catch (IllegalArgumentException ex) {
            throw new OperatorRecordException(operator,
                    "Undecodable providers() result for " + operator + ": " + ex.getMessage(), ex);
        }
        if (url.isBlank()) {
            throw new OperatorRecordException(operator, "Operator " + operator + " has no control plane URL registered");
        }
        return url;
    }

    JobEvent decodeJobOpened(JsonNode log) {
        JsonNode topics = log.path("topics");
        if (!topics.isArray() || topics.size() < 4) {
            logger.error("Skipping JobOpened log with {} topics (tx {})", topics.size(), log.path("transactionHash").asText("?"));
            return null;
        }
        try {
            String jobId = AbiCodec.normalizeBytes32(topics.get(1).asText());
            String owner = AbiCodec.addressFromTopic(topics.get(2).asText());
            String operator = AbiCodec.addressFromTopic(topics.get(3).asText());
            String metadata = AbiCodec.decodeString(log.path("data").asText(""), 0);
            Long blockNumber = AbiCodec.parseQuantity(log.path("blockNumber").asText(null));
            Long logIndex = AbiCodec.parseQuantity(log.path("logIndex").asText(null));
            return new JobEvent(jobId, owner, operator, metadata,
                    blockNumber == null ? 0 : blockNumber,
                    logIndex == null ? 0 : logIndex);
        } catch (IllegalArgumentException ex) {
            logger.error("Skipping undecodable JobOpened log (tx {}): {}", log.path("transactionHash").asText("?"), ex.getMessage());
            return null;
        }
    }

    private JsonNode call(String method, ArrayNode params) throws IOException, InterruptedException {
        JsonNode response = sendRpcWithRetry(method, params);
        if (response.has("error")) {
            throw new RpcErrorException(method, response.get("error"));
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            throw new IOException(method + " returned no result");
        }
        return result;
    }

    private JsonNode sendRpcWithRetry(String method, JsonNode params) throws IOException, InterruptedException {
        int attempts = Math.max(0, chain.getMaxRetries());
        for (int attempt = 0; ; attempt++) {
            try {
                return sendRpcOnce(method, params);
            } catch (HttpStatusException statusEx) {
                if (!shouldRetryStatus(statusEx.getStatusCode()) || attempt >= attempts) {
                    throw statusEx;
                }
                logger.warn("{} returned HTTP {}, retrying ({}/{})", method, statusEx.getStatusCode(), attempt + 1, attempts);
            } catch (IOException ioEx) {
                if (attempt >= attempts) {
                    throw ioEx;
                }
                logger.warn("{} failed: {}, retrying ({}/{})", method, ioEx.getMessage(), attempt + 1, attempts);
            }
            sleepBackoff(chain.getRetryBackoffMs(), attempt);
        }
    }

    private void sleepBackoff(long backoffMs, int attempt) throws InterruptedException {
        long delay = Math.max(0, backoffMs) * (attempt + 1);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    private boolean shouldRetryStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500;
    }

    private JsonNode sendRpcOnce(String method, JsonNode params) throws IOException, InterruptedException {
        if (chain.getRpcUrl() == null || chain.getRpcUrl().isBlank()) {
            throw new IOException("No RPC URL configured");
        }
        JsonNode body = mapper.createObjectNode()
                .put("jsonrpc", JSONRPC_VERSION)
                .put("id", 1)
                .put("method", method)
                .set("params", params);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(chain.getRpcUrl()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (chain.getReadTimeoutMs() > 0) {
            builder.timeout(Duration.ofMillis(chain.getReadTimeoutMs()));
        }
        Map<String, String> headers = chain.getHeaders();
        if (headers != null) {
            headers.forEach(builder::header);
        }
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new HttpStatusException(response.statusCode(), chain.getRpcUrl());
        }
        return mapper.readTree(response.body());
    }

    static class HttpStatusException extends IOException {
        private final int statusCode;

        HttpStatusException(int statusCode, String url) {
            super("HTTP " + statusCode + " from " + url);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    static class RpcErrorException extends IOException {
        // geth and most providers report a reverted eth_call with code 3
        private static final int EXECUTION_REVERTED = 3;

        private final int code;
        private final String rpcMessage;

        RpcErrorException(String method, JsonNode error) {
            super(method + " failed: " + error.toString());
            this.code = error.path("code").asInt(0);
            this.rpcMessage = error.path("message").asText("");
        }

        public int getCode() {
            return code;
        }

        boolean isReverted() {
            return code == EXECUTION_REVERTED || rpcMessage.toLowerCase(Locale.ROOT).contains("revert");
        }
    }
}
