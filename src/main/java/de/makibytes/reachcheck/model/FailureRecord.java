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
package de.makibytes.reachcheck.model;

import java.time.Instant;

/**
 * One persisted verification failure. {@code id} is null until the row has been inserted.
 */
public record FailureRecord(Long id,
                            FailureKind kind,
                            String job,
                            String operator,
                            String ip,
                            String error,
                            long timestamp) {

    public static final String UNKNOWN_ADDRESS = "unknown";

    public static FailureRecord create(FailureKind kind, String job, String operator, String ip, String error) {
        return new FailureRecord(null, kind, job, operator, ip == null ? UNKNOWN_ADDRESS : ip, error,
                Instant.now().getEpochSecond());
    }
}
