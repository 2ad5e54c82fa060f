/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.retry.error;

/**
 * Reasons for which a retry session ends without a successful result.
 * Every reason except a cancellation before the first attempt comes with the last observed operation failure.
 */
public enum FailureReason {
    /**
     * The backoff policy ran out of attempts or of total time.
     * Severity: ERROR
     */
    POLICY_EXHAUSTED,

    /**
     * The retry predicate classified the last failure as permanent, the remaining policy budget is ignored.
     * Severity: WARN
     */
    PREDICATE_REJECTED,

    /**
     * The cancellation signal was raised while waiting between attempts, or before the first attempt.
     * Severity: INFO
     */
    CANCELLED
}
