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
import java.net.InetSocketAddress;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.reachcheck.config.ReachCheckProperties;

/**
 * Reachable means a TCP connection to the instance's service port completes within the timeout.
 */
@Component
public class TcpReachabilityProbe implements ReachabilityProbe {

    private static final Logger logger = LoggerFactory.getLogger(TcpReachabilityProbe.class);

    private final int port;
    private final int connectTimeoutMs;

    public TcpReachabilityProbe(ReachCheckProperties properties) {
        this.port = properties.getProbe().getPort();
        this.connectTimeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, properties.getProbe().getConnectTimeoutMs()));
    }

    @Override
    public boolean probe(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address.trim(), port), connectTimeoutMs);
            return true;
        } catch (IOException | IllegalArgumentException ex) {
            logger.info("Connect to {}:{} failed: {}", address, port, ex.getMessage());
            return false;
        }
    }
}
