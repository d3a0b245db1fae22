package me.golemcore.orchestrator.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.domain.model.ErrorSource;

/**
 * A single model-backend call failed, either with a backend error response or
 * a transport failure.
 */
public class LlmCallFailedException extends OrchestratorException {

    private final ErrorSource source;

    public LlmCallFailedException(ErrorSource source, String message) {
        super(message);
        this.source = source;
    }

    public LlmCallFailedException(ErrorSource source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public ErrorSource getSource() {
        return source;
    }
}
