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
package org.tarik.retry.backoff;

/**
 * The way the delay between two consecutive attempts evolves.
 */
public enum BackoffStrategy {
    /**
     * The same delay before every retry.
     */
    FIXED,

    /**
     * The delay grows by a constant step after every failed attempt.
     */
    LINEAR,

    /**
     * The delay is multiplied by a constant factor after every failed attempt.
     */
    EXPONENTIAL
}
