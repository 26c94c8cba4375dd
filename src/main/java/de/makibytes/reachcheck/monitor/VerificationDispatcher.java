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
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.JobVerificationTask;
import de.makibytes.reachcheck.store.FailureRecorder;
import de.makibytes.reachcheck.verify.EndpointCrossChecker;
import de.makibytes.reachcheck.verify.IpResolver;
import de.makibytes.reachcheck.verify.ReachabilityProbe;
import jakarta.annotation.PreDestroy;

/**
 * Runs verification workers on a bounded pool: {@code max-concurrent-jobs} threads and a queue of
 * {@code queue-capacity} waiting tasks. Anything beyond that is rejected back to the poller.
 */
@Component
public class VerificationDispatcher implements JobDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(VerificationDispatcher.class);

    private final Duration startupDelay;
    private final IpResolver resolver;
    private final ReachabilityProbe probe;
    private final EndpointCrossChecker crossChecker;
    private final FailureRecorder recorder;
    private final ThreadPoolExecutor executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public VerificationDispatcher(ReachCheckProperties properties,
                                  IpResolver resolver,
                                  ReachabilityProbe probe,
                                  EndpointCrossChecker crossChecker,
                                  FailureRecorder recorder) {
        ReachCheckProperties.Verification verification = properties.getVerification();
        this.startupDelay = Duration.ofMillis(Math.max(0, verification.getStartupDelayMs()));
        this.resolver = resolver;
        this.probe = probe;
        this.crossChecker = crossChecker;
        this.recorder = recorder;
        int threads = Math.max(1, verification.getMaxConcurrentJobs());
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, verification.getQueueCapacity())),
                new WorkerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);
    }

    @Override
    public void dispatch(JobVerificationTask task) {
        JobVerificationWorker worker = new JobVerificationWorker(task, startupDelay, resolver, probe, crossChecker, recorder);
        inFlight.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    worker.run();
                } finally {
                    inFlight.decrementAndGet();
                    completed.incrementAndGet();
                }
            });
        } catch (RejectedExecutionException ex) {
            inFlight.decrementAndGet();
            rejected.incrementAndGet();
            throw ex;
        }
        logger.debug("Dispatched job {} ({} in flight)", task.jobId(), inFlight.get());
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    @PreDestroy
    public void shutdown() {
        int pending = inFlight.get();
        if (pending > 0) {
            logger.info("Stopping with {} verification(s) still in flight", pending);
        }
        executor.shutdownNow();
    }

    boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "job-verify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
