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
package de.makibytes.reachcheck.chain;

import java.io.IOException;

/**
 * The contract answered, but it holds no usable control-plane URL for the operator. Asking again
 * gives the same answer.
 */
public class OperatorRecordException extends IOException {

    private final String operator;

    public OperatorRecordException(String operator, String message) {
        super(message);
        this.operator = operator;
    }

    public OperatorRecordException(String operator, String message, Throwable cause) {
        super(message, cause);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
