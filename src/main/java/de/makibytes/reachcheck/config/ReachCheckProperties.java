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
package de.makibytes.reachcheck.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reachcheck")
public class ReachCheckProperties {

    private Chain chain = new Chain();
    private Poller poller = new Poller();
    private Verification verification = new Verification();
    private Resolver resolver = new Resolver();
    private Probe probe = new Probe();
    private CrossCheck crossCheck = new CrossCheck();
    private Persistence persistence = new Persistence();

    public Chain getChain() {
        return chain;
    }

    public void setChain(Chain chain) {
        this.chain = chain;
    }

    public Poller getPoller() {
        return poller;
    }

    public void setPoller(Poller poller) {
        this.poller = poller;
    }

    public Verification getVerification() {
        return verification;
    }

    public void setVerification(Verification verification) {
        this.verification = verification;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public CrossCheck getCrossCheck() {
        return crossCheck;
    }

    public void setCrossCheck(CrossCheck crossCheck) {
        this.crossCheck = crossCheck;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public static class Chain {
        private String rpcUrl;
        private String contractAddress;
        private long connectTimeoutMs = 2000;
        private long readTimeoutMs = 10000;
        private int maxRetries = 1;
        private long retryBackoffMs = 500;
        // keccak256("JobOpened(bytes32,string,address,address,uint256,uint256,uint256)")
        private String jobOpenedTopic = "0xcaf4e46d4e6467895056ca2f41d879c0cd4f68875400a55b8e9b24c9904931b4";
        // providers(address)
        private String providersSelector = "0x0787bc27";
        private Map<String, String> headers = new HashMap<>();

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public String getContractAddress() {
            return contractAddress;
        }

        public void setContractAddress(String contractAddress) {
            this.contractAddress = contractAddress;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public String getJobOpenedTopic() {
            return jobOpenedTopic;
        }

        public void setJobOpenedTopic(String jobOpenedTopic) {
            this.jobOpenedTopic = jobOpenedTopic;
        }

        public String getProvidersSelector() {
            return providersSelector;
        }

        public void setProvidersSelector(String providersSelector) {
            this.providersSelector = providersSelector;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class Poller {
        private long intervalMs = 10000;
        private long maxBlockRange = 2000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getMaxBlockRange() {
            return maxBlockRange;
        }

        public void setMaxBlockRange(long maxBlockRange) {
            this.maxBlockRange = maxBlockRange;
        }
    }

    public static class Verification {
        private long startupDelayMs = 180000;
        private int maxConcurrentJobs = 64;
        private int queueCapacity = 1024;
        private List<String> allowedImageUrls = new ArrayList<>(List.of(
                "https://artifacts.marlin.org/oyster/eifs/base-blue_v3.0.0_linux_amd64.eif",
                "https://artifacts.marlin.org/oyster/eifs/base-blue_v3.0.0_linux_arm64.eif"));

        public long getStartupDelayMs() {
            return startupDelayMs;
        }

        public void setStartupDelayMs(long startupDelayMs) {
            this.startupDelayMs = startupDelayMs;
        }

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public List<String> getAllowedImageUrls() {
            return allowedImageUrls;
        }

        public void setAllowedImageUrls(List<String> allowedImageUrls) {
            this.allowedImageUrls = allowedImageUrls;
        }
    }

    public static class Resolver {
        private String path = "/ip";
        private long retryIntervalMs = 10000;
        private long timeoutMs = 300000;
        private long requestTimeoutMs = 5000;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public long getRetryIntervalMs() {
            return retryIntervalMs;
        }

        public void setRetryIntervalMs(long retryIntervalMs) {
            this.retryIntervalMs = retryIntervalMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    public static class Probe {
        private int port = 1300;
        private long connectTimeoutMs = 5000;

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }

    public static class CrossCheck {
        private String urlTemplate = "https://sk.arb1.marlin.org/operators/jobs/refresh/ArbOne/{job}";
        private long timeoutMs = 10000;

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Persistence {
        private String tablePrefix = "arbone";

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }
    }
}
