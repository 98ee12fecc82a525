package me.golemcore.recall.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * File-level persistence used for store snapshots and the message log.
 */
public interface StoragePort {

    /**
     * Read text content from file, {@code null} when absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Append text to a file (JSONL logs).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically replace a file: the content goes to a {@code .tmp} sibling,
     * is synced, and is then renamed over the target. With {@code backup} the
     * previous version is kept as {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
