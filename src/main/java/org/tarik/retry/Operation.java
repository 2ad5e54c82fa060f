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
package org.tarik.retry;

/**
 * A fallible unit of work retried by {@link RetryExecutor}.
 *
 * @param <V> type of the success value
 * @param <E> type of the failure the operation signals
 */
@FunctionalInterface
public interface Operation<V, E extends Exception> {
    V call() throws E;
}
