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

import java.sql.PreparedStatement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import de.makibytes.reachcheck.model.FailureKind;
import de.makibytes.reachcheck.model.FailureRecord;

@Component
public class JdbcFailureRecorder implements FailureRecorder {

    private static final Logger logger = LoggerFactory.getLogger(JdbcFailureRecorder.class);

    private final JdbcTemplate jdbcTemplate;
    private final FailureTables tables;

    public JdbcFailureRecorder(JdbcTemplate jdbcTemplate, FailureTables tables) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
    }

    @Override
    public void record(FailureKind kind, String jobId, String operator, String address, String message) {
        FailureRecord failure = FailureRecord.create(kind, jobId, operator, address, message);
        try {
            Long id = insert(failure);
            logger.debug("Stored {} failure {} for job {}", kind, id, jobId);
        } catch (RuntimeException ex) {
            logger.error("Failed to insert {} failure for job {} into database: {}", kind, jobId, ex.getMessage());
        }
    }

    Long insert(FailureRecord failure) {
        String sql = "INSERT INTO " + tables.table(failure.kind())
                + " (job, operator, ip, error, timestamp) VALUES (?, ?, ?, ?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(sql, new String[] {"id"});
            statement.setString(1, failure.job());
            statement.setString(2, failure.operator());
            statement.setString(3, failure.ip());
            statement.setString(4, failure.error());
            statement.setLong(5, failure.timestamp());
            return statement;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return key == null ? null : key.longValue();
    }
}
