/*
 Licensed to Diennea S.r.l. under one
 or more contributor license agreements. See the NOTICE file
 distributed with this work for additional information
 regarding copyright ownership. Diennea S.r.l. licenses this file
 to you under the Apache License, Version 2.0 (the
 "License"); you may not use this file except in compliance
 with the License.  You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing,
 software distributed under the License is distributed on an
 "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 KIND, either express or implied.  See the License for the
 specific language governing permissions and limitations
 under the License.

 */
package org.certkeeper.storage;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Key/value store shared by cooperating processes.
 * <p>
 * Keys are {@code /}-separated paths. A key may be a leaf holding a value or a prefix grouping other keys
 * (a "folder"). Writes of a single key are atomic; nothing is atomic across keys.
 */
public interface Storage {

    /**
     * Load the value of a key.
     *
     * @param key the key
     * @return the stored bytes
     * @throws KeyNotFoundException if the key does not exist
     * @throws IOException on any other failure
     */
    byte[] load(String key) throws IOException;

    /**
     * Store a value, replacing any previous one.
     *
     * @param key the key
     * @param value the bytes to store
     * @throws IOException if the value cannot be stored
     */
    void store(String key, byte[] value) throws IOException;

    /**
     * Never fails: any backend error is reported as "not existing".
     *
     * @param key a leaf or prefix key
     * @return whether the key exists
     */
    boolean exists(String key);

    /**
     * Delete a key. A prefix key is deleted only if it is empty. Deleting a missing key does nothing.
     *
     * @param key the key
     * @throws IOException if the key exists and cannot be deleted
     */
    void delete(String key) throws IOException;

    /**
     * List the keys under a prefix.
     *
     * @param prefix the prefix
     * @param recursive whether to descend into nested prefixes
     * @return full keys, sorted
     * @throws KeyNotFoundException if the prefix does not exist
     * @throws IOException on any other failure
     */
    List<String> list(String prefix, boolean recursive) throws IOException;

    /**
     * Acquire the exclusive lock named {@code key}, shared by every process using the same backend.
     *
     * @param key name of the lock
     * @param timeout maximum time to wait
     * @param unit unit of timeout
     * @return false if the lock was not acquired in time
     * @throws IOException on backend failure
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean lock(String key, long timeout, TimeUnit unit) throws IOException, InterruptedException;

    /**
     * Release a lock acquired with {@link #lock(String, long, TimeUnit)}.
     *
     * @param key name of the lock
     * @throws IOException on backend failure
     */
    void unlock(String key) throws IOException;
}
