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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.FailureKind;
import de.makibytes.reachcheck.model.FailureRecord;
import de.makibytes.reachcheck.model.JobVerificationTask;
import de.makibytes.reachcheck.model.VerificationStage;
import de.makibytes.reachcheck.store.RecordingFailureRecorder;
import de.makibytes.reachcheck.verify.ControlPlaneIpResolver;
import de.makibytes.reachcheck.verify.CrossCheckResult;
import de.makibytes.reachcheck.verify.ResolutionException;

@DisplayName("JobVerificationWorker Tests")
class JobVerificationWorkerTest {

    private static final String JOB = "0x00000000000000000000000000000000000000000000000000000000000abc123";
    private static final String OPERATOR = "0x00000000000000000000000000000000000000aa";

    private final JobVerificationTask task = new JobVerificationTask(
            JOB, "0x00000000000000000000000000000000000000bb", OPERATOR, "http://cp.example", "us-east", null);

    private RecordingFailureRecorder recorder;
    private AtomicReference<JobVerificationWorker> current;
    private List<VerificationStage> stagesSeen;
    private AtomicInteger probeCalls;
    private AtomicInteger crossCheckCalls;

    @BeforeEach
    void setUp() {
        recorder = new RecordingFailureRecorder();
        current = new AtomicReference<>();
        stagesSeen = new ArrayList<>();
        probeCalls = new AtomicInteger();
        crossCheckCalls = new AtomicInteger();
    }

    private JobVerificationWorker worker(boolean resolves, boolean reachable, CrossCheckResult crossCheck) {
        return worker(task, Duration.ZERO, resolves, reachable, crossCheck);
    }

    private JobVerificationWorker worker(JobVerificationTask job, Duration delay, boolean resolves, boolean reachable,
                                         CrossCheckResult crossCheck) {
        JobVerificationWorker worker = new JobVerificationWorker(
                job,
                delay,
                (url, jobId, region) -> {
                    stagesSeen.add(current.get().getStage());
                    if (!resolves) {
                        throw new ResolutionException("No IP address after 3 attempt(s) over 0 s: HTTP 404", 3);
                    }
                    return "3.4.5.6";
                },
                address -> {
                    stagesSeen.add(current.get().getStage());
                    probeCalls.incrementAndGet();
                    return reachable;
                },
                jobId -> {
                    stagesSeen.add(current.get().getStage());
                    crossCheckCalls.incrementAndGet();
                    return crossCheck;
                },
                recorder);
        current.set(worker);
        return worker;
    }

    @Test
    @DisplayName("passing job walks every stage and records nothing")
    void passingJobRecordsNothing() {
        JobVerificationWorker worker = worker(true, true, CrossCheckResult.ok("3.4.5.6"));
        assertEquals(VerificationStage.CREATED, worker.getStage());

        worker.run();

        assertTrue(recorder.records().isEmpty());
        assertEquals(List.of(VerificationStage.RESOLVING_ADDRESS, VerificationStage.PROBING_REACHABILITY,
                VerificationStage.CROSS_CHECKING), stagesSeen);
        assertEquals(VerificationStage.DONE, worker.getStage());
    }

    @Test
    @DisplayName("resolution failure records one reachability failure with unknown address and skips the rest")
    void resolutionFailureSkipsLaterStages() {
        JobVerificationWorker worker = worker(false, true, CrossCheckResult.ok("3.4.5.6"));

        worker.run();

        assertEquals(1, recorder.records().size());
        FailureRecord record = recorder.records().get(0);
        assertEquals(FailureKind.REACHABILITY, record.kind());
        assertEquals(FailureRecord.UNKNOWN_ADDRESS, record.ip());
        assertEquals(JOB, record.job());
        assertEquals(OPERATOR, record.operator());
        assertTrue(record.error().startsWith("Failed to get IP address: "), record.error());
        assertEquals(0, probeCalls.get());
        assertEquals(0, crossCheckCalls.get());
        assertEquals(VerificationStage.DONE, worker.getStage());
    }

    @Test
    @DisplayName("probe failure still runs the cross-check; both failures are recorded once")
    void probeAndCrossCheckFailuresAreBothRecorded() {
        JobVerificationWorker worker = worker(true, false,
                CrossCheckResult.failed(CrossCheckResult.Failure.MISSING_FIELD, "IP key NOT found in refresh API response"));

        worker.run();

        List<FailureRecord> reachability = recorder.records(FailureKind.REACHABILITY);
        List<FailureRecord> endpoint = recorder.records(FailureKind.ENDPOINT);
        assertEquals(1, reachability.size());
        assertEquals(1, endpoint.size());
        assertEquals("3.4.5.6", reachability.get(0).ip());
        assertEquals(JobVerificationWorker.PROBE_FAILED_MESSAGE, reachability.get(0).error());
        assertEquals("3.4.5.6", endpoint.get(0).ip());
        assertEquals("IP key NOT found in refresh API response", endpoint.get(0).error());
    }

    @Test
    @DisplayName("unreachable instance with a healthy endpoint records only the reachability failure")
    void probeFailureOnly() {
        worker(true, false, CrossCheckResult.ok("3.4.5.6")).run();

        assertEquals(1, recorder.records().size());
        assertEquals(FailureKind.REACHABILITY, recorder.records().get(0).kind());
        assertEquals(1, crossCheckCalls.get());
    }

    @Test
    @DisplayName("endpoint failure alone records one endpoint failure with the transport reason")
    void endpointFailureOnly() {
        worker(true, true,
                CrossCheckResult.failed(CrossCheckResult.Failure.TRANSPORT, "Failed to call refresh API: connect timed out")).run();

        assertEquals(1, recorder.records().size());
        FailureRecord record = recorder.records().get(0);
        assertEquals(FailureKind.ENDPOINT, record.kind());
        assertEquals("Failed to call refresh API: connect timed out", record.error());
    }

    @Test
    @DisplayName("missing region is passed to the resolver as an empty string")
    void missingRegionIsEmpty() {
        AtomicReference<String> regionSeen = new AtomicReference<>();
        JobVerificationTask noRegion = new JobVerificationTask(JOB, OPERATOR, OPERATOR, "http://cp.example", null, null);
        new JobVerificationWorker(noRegion, Duration.ZERO,
                (url, jobId, region) -> {
                    regionSeen.set(region);
                    return "3.4.5.6";
                },
                address -> true,
                jobId -> CrossCheckResult.ok("3.4.5.6"),
                recorder).run();

        assertEquals("", regionSeen.get());
    }

    @Test
    @DisplayName("unexpected resolver exception is recorded as a resolution failure")
    void resolverRuntimeExceptionIsRecorded() {
        JobVerificationWorker worker = new JobVerificationWorker(task, Duration.ZERO,
                (url, jobId, region) -> {
                    throw new IllegalArgumentException("invalid URI scheme ftp");
                },
                address -> true,
                jobId -> CrossCheckResult.ok("3.4.5.6"),
                recorder);

        worker.run();

        assertEquals(VerificationStage.DONE, worker.getStage());
        assertEquals(1, recorder.records().size());
        FailureRecord record = recorder.records().get(0);
        assertEquals(FailureKind.REACHABILITY, record.kind());
        assertEquals(FailureRecord.UNKNOWN_ADDRESS, record.ip());
        assertEquals("Failed to get IP address: invalid URI scheme ftp", record.error());
    }

    @Test
    @DisplayName("control plane URL with a non-http scheme is recorded as a resolution failure")
    void nonHttpControlPlaneIsRecorded() {
        JobVerificationTask ftpTask = new JobVerificationTask(
                JOB, "0x00000000000000000000000000000000000000bb", OPERATOR, "ftp://1.2.3.4", "us-east", null);
        JobVerificationWorker worker = new JobVerificationWorker(ftpTask, Duration.ZERO,
                new ControlPlaneIpResolver(new ReachCheckProperties()),
                address -> true,
                jobId -> CrossCheckResult.ok("3.4.5.6"),
                recorder);

        worker.run();

        assertEquals(VerificationStage.DONE, worker.getStage());
        assertEquals(1, recorder.records(FailureKind.REACHABILITY).size());
        assertEquals(FailureRecord.UNKNOWN_ADDRESS, recorder.records().get(0).ip());
        assertTrue(recorder.records().get(0).error().contains("ftp"), recorder.records().get(0).error());
        assertTrue(recorder.records(FailureKind.ENDPOINT).isEmpty());
    }

    @Test
    @DisplayName("unexpected exception still ends in DONE")
    void unexpectedExceptionEndsInDone() {
        JobVerificationWorker worker = new JobVerificationWorker(task, Duration.ZERO,
                (url, jobId, region) -> "3.4.5.6",
                address -> {
                    throw new IllegalStateException("boom");
                },
                jobId -> CrossCheckResult.ok("3.4.5.6"),
                recorder);

        worker.run();

        assertEquals(VerificationStage.DONE, worker.getStage());
        assertTrue(recorder.records().isEmpty());
    }

    @Test
    @DisplayName("startup delay elapses before the address is resolved")
    void startupDelayRunsFirst() {
        long[] resolvedAfterMs = new long[1];
        long start = System.nanoTime();
        new JobVerificationWorker(task, Duration.ofMillis(150),
                (url, jobId, region) -> {
                    resolvedAfterMs[0] = (System.nanoTime() - start) / 1_000_000;
                    return "3.4.5.6";
                },
                address -> true,
                jobId -> CrossCheckResult.ok("3.4.5.6"),
                recorder).run();

        assertTrue(resolvedAfterMs[0] >= 150, "resolved after " + resolvedAfterMs[0] + " ms");
    }
}
