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
package de.makibytes.reachcheck.monitor;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import de.makibytes.reachcheck.chain.EventSource;
import de.makibytes.reachcheck.chain.OperatorDirectory;
import de.makibytes.reachcheck.chain.OperatorRecordException;
import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.JobEvent;
import de.makibytes.reachcheck.model.JobVerificationTask;
import de.makibytes.reachcheck.model.Metadata;

/**
 * Walks the chain in block ranges behind an in-memory watermark and dispatches one verification
 * per in-scope {@code JobOpened} event.
 *
 * <p>The watermark is the last block whose events have all been dispatched. It starts at the chain
 * head seen on the first successful tick, only moves forward, and is not persisted: blocks mined
 * while the process is down are never looked at. A failed RPC call leaves it where it is, so the
 * same range is queried again on the next tick and an event may be dispatched more than once.
 */
@Service
public class BlockWatermarkPoller {

    private static final Logger logger = LoggerFactory.getLogger(BlockWatermarkPoller.class);

    private final EventSource eventSource;
    private final OperatorDirectory operatorDirectory;
    private final MetadataFilter metadataFilter;
    private final JobDispatcher dispatcher;
    private final long maxBlockRange;
    private volatile Long watermark;
    private volatile Instant lastTickAt;

    public BlockWatermarkPoller(EventSource eventSource,
                                OperatorDirectory operatorDirectory,
                                MetadataFilter metadataFilter,
                                JobDispatcher dispatcher,
                                ReachCheckProperties properties) {
        this.eventSource = eventSource;
        this.operatorDirectory = operatorDirectory;
        this.metadataFilter = metadataFilter;
        this.dispatcher = dispatcher;
        this.maxBlockRange = Math.max(1, properties.getPoller().getMaxBlockRange());
    }

    @Scheduled(fixedDelayString = "${reachcheck.poller.interval-ms:10000}", initialDelay = 1000)
    public void poll() {
        try {
            tick();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Poller interrupted");
        } catch (RuntimeException ex) {
            logger.error("Poller tick failed: {}", ex.getMessage(), ex);
        }
    }

    void tick() throws InterruptedException {
        long head;
        try {
            head = eventSource.headBlockNumber();
        } catch (IOException ex) {
            logger.error("Failed to get current block number: {}", ex.getMessage());
            return;
        }
        lastTickAt = Instant.now();

        Long current = watermark;
        if (current == null) {
            watermark = head;
            logger.info("Starting from block number: {}", head);
            return;
        }
        if (head <= current) {
            logger.debug("No new blocks. Current block: {}", head);
            return;
        }

        logger.info("New blocks detected. Checking from {} to {}", current + 1, head);
        long from = current + 1;
        while (from <= head) {
            long to = Math.min(head, from + maxBlockRange - 1);
            List<JobEvent> events;
            try {
                events = eventSource.jobOpenedEvents(from, to);
            } catch (IOException ex) {
                logger.error("Failed to query events in blocks {} to {}: {}", from, to, ex.getMessage());
                return;
            }
            logger.info("Found {} JobOpened events in blocks {} to {}", events.size(), from, to);

            Long stalledBlock = dispatchAll(events);
            if (stalledBlock != null) {
                advanceTo(stalledBlock - 1);
                return;
            }
            advanceTo(to);
            from = to + 1;
        }
    }

    /**
     * Returns the block of the first event that could not be dispatched, or null if all were.
     * Events whose operator has no usable control-plane URL are dropped, not retried.
     */
    private Long dispatchAll(List<JobEvent> events) throws InterruptedException {
        for (JobEvent event : events) {
            Optional<Metadata> metadata = metadataFilter.inScope(event);
            if (metadata.isEmpty()) {
                continue;
            }
            String controlPlaneUrl;
            try {
                controlPlaneUrl = operatorDirectory.controlPlaneUrl(event.operator());
            } catch (OperatorRecordException ex) {
                logger.error("Skipping job {}: {}", event.jobId(), ex.getMessage());
                continue;
            } catch (IOException ex) {
                logger.error("Failed to get control plane URL of operator {} for job {}: {}",
                        event.operator(), event.jobId(), ex.getMessage());
                return event.blockNumber();
            }
            JobVerificationTask task = new JobVerificationTask(
                    event.jobId(),
                    event.owner(),
                    event.operator(),
                    controlPlaneUrl,
                    metadata.get().region(),
                    metadata.get().instanceLabel());
            try {
                dispatcher.dispatch(task);
            } catch (RejectedExecutionException ex) {
                logger.error("No verification capacity left for job {} (block {}), retrying next tick",
                        event.jobId(), event.blockNumber());
                return event.blockNumber();
            }
        }
        return null;
    }

    private void advanceTo(long block) {
        Long current = watermark;
        if (current == null || block > current) {
            watermark = block;
        }
    }

    public Long getWatermark() {
        return watermark;
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }
}
