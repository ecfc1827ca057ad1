/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
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
 */
package org.pkisession.internal.retry;

import java.io.IOException;
import org.pkisession.HttpResponse;

public interface RetryLogic {
    /**
     * Executes the attempt until it yields a response that is not retryable or no retries are left.
     *
     * @param method the HTTP method, for logging
     * @param url the URL, for logging
     * @param attempt one execution of the request
     * @return the final response
     * @throws IOException the failure of the last attempt, earlier failures attached as suppressed
     * @throws org.pkisession.exceptions.RetriesExhaustedException if the last attempt still had a retryable status
     */
    HttpResponse retry(String method, String url, Attempt attempt) throws IOException;

    @FunctionalInterface
    interface Attempt {
        HttpResponse execute() throws IOException;
    }
}
