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
package de.makibytes.reachcheck.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import de.makibytes.reachcheck.model.FailureKind;
import de.makibytes.reachcheck.model.FailureRecord;

@Repository
public class FailureRecordRepository {

    private final JdbcTemplate jdbcTemplate;
    private final FailureTables tables;

    public FailureRecordRepository(JdbcTemplate jdbcTemplate, FailureTables tables) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
    }

    public List<FailureRecord> findRecent(FailureKind kind, int limit) {
        String sql = "SELECT id, job, operator, ip, error, timestamp FROM " + tables.table(kind)
                + " ORDER BY timestamp DESC, id DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper(kind), limit);
    }

    public List<FailureRecord> findByJob(String jobId) {
        List<FailureRecord> records = new ArrayList<>();
        for (FailureKind kind : FailureKind.values()) {
            String sql = "SELECT id, job, operator, ip, error, timestamp FROM " + tables.table(kind)
                    + " WHERE job = ? ORDER BY id";
            records.addAll(jdbcTemplate.query(sql, rowMapper(kind), jobId));
        }
        records.sort(Comparator.comparingLong(FailureRecord::timestamp));
        return records;
    }

    private static RowMapper<FailureRecord> rowMapper(FailureKind kind) {
        return (rs, rowNum) -> new FailureRecord(
                rs.getLong("id"),
                kind,
                rs.getString("job"),
                rs.getString("operator"),
                rs.getString("ip"),
                rs.getString("error"),
                rs.getLong("timestamp"));
    }
}
