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
package de.makibytes.reachcheck.web;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.reachcheck.model.FailureKind;
import de.makibytes.reachcheck.model.FailureRecord;
import de.makibytes.reachcheck.monitor.BlockWatermarkPoller;
import de.makibytes.reachcheck.monitor.VerificationDispatcher;
import de.makibytes.reachcheck.store.FailureRecordRepository;

@Controller
public class FailureController {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final FailureRecordRepository repository;
    private final BlockWatermarkPoller poller;
    private final VerificationDispatcher dispatcher;

    public FailureController(FailureRecordRepository repository,
                             BlockWatermarkPoller poller,
                             VerificationDispatcher dispatcher) {
        this.repository = repository;
        this.poller = poller;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/api/status")
    @ResponseBody
    public PipelineStatus status() {
        return new PipelineStatus(
                poller.getWatermark(),
                poller.getLastTickAt(),
                dispatcher.getInFlight(),
                dispatcher.getCompleted(),
                dispatcher.getRejected());
    }

    @GetMapping("/api/failures")
    @ResponseBody
    public ResponseEntity<List<FailureRecord>> failures(@RequestParam(name = "kind", required = false) String kindKey,
                                                        @RequestParam(name = "limit", required = false) Integer limit) {
        FailureKind kind = kindKey == null ? FailureKind.REACHABILITY : FailureKind.fromKey(kindKey);
        if (kind == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(repository.findRecent(kind, clampLimit(limit)));
    }

    @GetMapping("/api/failures/jobs/{jobId}")
    @ResponseBody
    public List<FailureRecord> jobFailures(@PathVariable("jobId") String jobId) {
        return repository.findByJob(jobId.toLowerCase());
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
