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

import static java.nio.charset.StandardCharsets.UTF_8;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Storage} on the local (or a shared network) file system.
 * <p>
 * Every key is a path relative to the root directory. Values are written to a temporary sibling file and then
 * moved in place, so readers never see a half written value. Locks are files under {@code locks/} holding the
 * instant their lease expires: an expired lock is considered abandoned and is broken by the next contender.
 */
public class FileStorage implements LeaseRenewableStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileStorage.class);

    public static final Duration DEFAULT_LOCK_LEASE = Duration.ofMinutes(5);
    static final String LOCKS_FOLDER = "locks";
    private static final long LOCK_POLL_INTERVAL_MS = 250;

    private final Path root;
    private final Duration initialLease;
    private final Clock clock;

    public FileStorage(Path root) {
        this(root, DEFAULT_LOCK_LEASE, Clock.systemUTC());
    }

    public FileStorage(Path root, Duration initialLease, Clock clock) {
        this.root = root.toAbsolutePath();
        this.initialLease = initialLease;
        this.clock = clock;
    }

    public Path getRoot() {
        return root;
    }

    @VisibleForTesting
    Path filename(String key) {
        Path path = root;
        for (String part : key.split("/")) {
            if (!part.isEmpty()) {
                path = path.resolve(part);
            }
        }
        return path;
    }

    @Override
    public byte[] load(String key) throws IOException {
        try {
            return Files.readAllBytes(filename(key));
        } catch (NoSuchFileException err) {
            throw new KeyNotFoundException(key, err);
        }
    }

    @Override
    public void store(String key, byte[] value) throws IOException {
        writeAtomically(filename(key), value);
    }

    private static void writeAtomically(Path file, byte[] value) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".tmp");
        try {
            Files.write(tmp, value);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(filename(key));
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            Files.deleteIfExists(filename(key));
        } catch (DirectoryNotEmptyException err) {
            throw new IOException("cannot delete " + key + ": not empty", err);
        }
    }

    @Override
    public List<String> list(String prefix, boolean recursive) throws IOException {
        Path dir = filename(prefix);
        if (!Files.isDirectory(dir)) {
            throw new KeyNotFoundException(prefix);
        }
        try (Stream<Path> entries = recursive ? Files.walk(dir).skip(1) : Files.list(dir)) {
            return entries
                    .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                    .map(p -> toKey(prefix, dir.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String toKey(String prefix, Path relative) {
        StringBuilder key = new StringBuilder(prefix);
        for (Path part : relative) {
            key.append('/').append(part);
        }
        return key.toString();
    }

    @VisibleForTesting
    Path lockFilename(String key) {
        return root.resolve(LOCKS_FOLDER).resolve(key.replaceAll("[^\\w@.-]", "_") + ".lock");
    }

    @Override
    public boolean lock(String key, long timeout, TimeUnit unit) throws IOException, InterruptedException {
        Path lockFile = lockFilename(key);
        Files.createDirectories(lockFile.getParent());
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            try {
                Files.createFile(lockFile);
                writeExpiry(lockFile, clock.instant().plus(initialLease));
                LOG.debug("acquired lock {}", key);
                return true;
            } catch (FileAlreadyExistsException held) {
                if (isStale(lockFile)) {
                    LOG.info("breaking expired lock {}", key);
                    Files.deleteIfExists(lockFile);
                    continue;
                }
            }
            if (System.nanoTime() >= deadline) {
                LOG.debug("timed out waiting for lock {}", key);
                return false;
            }
            if (Thread.interrupted()) {
                throw new InterruptedException("interrupted while waiting for lock " + key);
            }
            Thread.sleep(LOCK_POLL_INTERVAL_MS);
        }
    }

    private boolean isStale(Path lockFile) throws IOException {
        Instant expiry;
        try {
            String content = Files.readString(lockFile, UTF_8).trim();
            if (content.isEmpty()) {
                // the holder has created the file but not yet written its lease
                expiry = Files.getLastModifiedTime(lockFile).toInstant().plus(initialLease);
            } else {
                expiry = Instant.ofEpochMilli(Long.parseLong(content));
            }
        } catch (NoSuchFileException released) {
            return false;
        } catch (NumberFormatException err) {
            LOG.warn("unreadable lock file {}, treating it as expired", lockFile);
            return true;
        }
        return clock.instant().isAfter(expiry);
    }

    private static void writeExpiry(Path lockFile, Instant expiry) throws IOException {
        writeAtomically(lockFile, Long.toString(expiry.toEpochMilli()).getBytes(UTF_8));
    }

    @Override
    public void unlock(String key) throws IOException {
        Files.deleteIfExists(lockFilename(key));
        LOG.debug("released lock {}", key);
    }

    @Override
    public void renewLockLease(String lockKey, Duration leaseDuration) throws IOException {
        Path lockFile = lockFilename(lockKey);
        if (!Files.exists(lockFile)) {
            throw new KeyNotFoundException(lockKey);
        }
        Instant expiry = clock.instant().plus(leaseDuration);
        // rewritten in place, a released lock must never be re-created
        try {
            Files.write(lockFile, Long.toString(expiry.toEpochMilli()).getBytes(UTF_8),
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (NoSuchFileException err) {
            throw new KeyNotFoundException(lockKey, err);
        }
    }

    /**
     * @param lockKey name of the lock
     * @return the instant the current lease expires
     * @throws IOException if the lock is not held or unreadable
     */
    public Instant getLockExpiry(String lockKey) throws IOException {
        Path lockFile = lockFilename(lockKey);
        try {
            return Instant.ofEpochMilli(Long.parseLong(Files.readString(lockFile, UTF_8).trim()));
        } catch (NoSuchFileException err) {
            throw new KeyNotFoundException(lockKey, err);
        } catch (NumberFormatException err) {
            throw new IOException("unreadable lock file " + lockFile, err);
        }
    }

    @Override
    public String toString() {
        return "FileStorage:" + root;
    }
}
