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

import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.FailureKind;

@Component
public class FailureTables {

    private static final Pattern PREFIX = Pattern.compile("[a-z][a-z0-9_]*");

    private final String prefix;

    @Autowired
    public FailureTables(ReachCheckProperties properties) {
        this(properties.getPersistence().getTablePrefix());
    }

    public FailureTables(String prefix) {
        String normalized = prefix == null ? "" : prefix.trim();
        // spliced into SQL as a table name
        if (!normalized.isEmpty() && !PREFIX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid table prefix: " + prefix);
        }
        this.prefix = normalized;
    }

    public String table(FailureKind kind) {
        return kind.tableName(prefix);
    }
}
