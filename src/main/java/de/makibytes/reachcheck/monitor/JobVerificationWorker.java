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

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.reachcheck.model.FailureKind;
import de.makibytes.reachcheck.model.FailureRecord;
import de.makibytes.reachcheck.model.JobVerificationTask;
import de.makibytes.reachcheck.model.VerificationStage;
import de.makibytes.reachcheck.store.FailureRecorder;
import de.makibytes.reachcheck.verify.CrossCheckResult;
import de.makibytes.reachcheck.verify.EndpointCrossChecker;
import de.makibytes.reachcheck.verify.IpResolver;
import de.makibytes.reachcheck.verify.ReachabilityProbe;
import de.makibytes.reachcheck.verify.ResolutionException;

/**
 * Verifies one job: startup grace period, address resolution, reachability probe, endpoint
 * cross-check. A failed resolution ends the job; a failed probe does not stop the cross-check.
 * Every path ends in {@link VerificationStage#DONE}.
 */
public class JobVerificationWorker implements Runnable {

    static final String PROBE_FAILED_MESSAGE = "Instance reachability test failed";
    private static final Logger logger = LoggerFactory.getLogger(JobVerificationWorker.class);

    private final JobVerificationTask task;
    private final Duration startupDelay;
    private final IpResolver resolver;
    private final ReachabilityProbe probe;
    private final EndpointCrossChecker crossChecker;
    private final FailureRecorder recorder;
    private volatile VerificationStage stage = VerificationStage.CREATED;

    public JobVerificationWorker(JobVerificationTask task,
                                 Duration startupDelay,
                                 IpResolver resolver,
                                 ReachabilityProbe probe,
                                 EndpointCrossChecker crossChecker,
                                 FailureRecorder recorder) {
        this.task = task;
        this.startupDelay = startupDelay;
        this.resolver = resolver;
        this.probe = probe;
        this.crossChecker = crossChecker;
        this.recorder = recorder;
    }

    @Override
    public void run() {
        logger.info("Verifying job {} (owner {}, operator {}, control plane {}{})",
                task.jobId(), task.owner(), task.operator(), task.controlPlaneUrl(),
                task.instanceLabel() == null ? "" : ", instance " + task.instanceLabel());
        try {
            verify();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Verification of job {} interrupted during {}", task.jobId(), stage);
        } catch (RuntimeException ex) {
            logger.error("Verification of job {} aborted during {}: {}", task.jobId(), stage, ex.getMessage(), ex);
        } finally {
            stage = VerificationStage.DONE;
        }
    }

    private void verify() throws InterruptedException {
        stage = VerificationStage.AWAITING_STARTUP;
        if (!startupDelay.isZero() && !startupDelay.isNegative()) {
            logger.info("Waiting {} s for the enclave of job {} to start", startupDelay.toSeconds(), task.jobId());
            Thread.sleep(startupDelay.toMillis());
        }

        stage = VerificationStage.RESOLVING_ADDRESS;
        String address;
        try {
            address = resolver.resolve(task.controlPlaneUrl(), task.jobId(), task.regionOrEmpty());
        } catch (ResolutionException | RuntimeException ex) {
            fail(FailureKind.REACHABILITY, FailureRecord.UNKNOWN_ADDRESS, "Failed to get IP address: " + ex.getMessage());
            return;
        }
        logger.info("Instance IP of job {}: {}", task.jobId(), address);

        stage = VerificationStage.PROBING_REACHABILITY;
        if (probe.probe(address)) {
            logger.info("Instance of job {} is reachable", task.jobId());
        } else {
            fail(FailureKind.REACHABILITY, address, PROBE_FAILED_MESSAGE);
        }

        stage = VerificationStage.CROSS_CHECKING;
        CrossCheckResult result = crossChecker.check(task.jobId());
        if (result.isOk()) {
            if (!address.equals(result.addressSeen())) {
                logger.warn("Refresh API reports IP {} for job {}, control plane resolved {}",
                        result.addressSeen(), task.jobId(), address);
            } else {
                logger.info("IP key found in refresh API response for job {}", task.jobId());
            }
        } else {
            fail(FailureKind.ENDPOINT, address, result.message());
        }
    }

    private void fail(FailureKind kind, String address, String message) {
        logger.error("Job {} ({}): {}", task.jobId(), stage, message);
        recorder.record(kind, task.jobId(), task.operator(), address, message);
    }

    public VerificationStage getStage() {
        return stage;
    }
}
