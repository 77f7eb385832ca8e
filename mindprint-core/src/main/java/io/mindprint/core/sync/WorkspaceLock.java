package io.mindprint.core.sync;

import io.mindprint.core.error.WorkspaceBusyException;
import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes syncs of one workspace: a JVM-wide lock per workspace path plus an OS file lock
 * on {@code <workspace>/<outputDir>/.sync.lock} for other processes. Different workspaces never block each other.
 */
public final class WorkspaceLock {
    public static final String LOCK_FILE = ".sync.lock";

    // Entries live only while some thread holds or waits for the workspace.
    private static final Map<Path, LocalLock> IN_PROCESS = new ConcurrentHashMap<>();
    private static final long POLL_MILLIS = 50;

    private final String outputDirName;
    private final Duration timeout;

    public WorkspaceLock(String outputDirName, Duration timeout) {
        this.outputDirName = Objects.requireNonNull(outputDirName, "outputDirName must not be null");
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        this.timeout = timeout;
    }

    public Lease acquire(Path workspace) throws WorkspaceBusyException, IOException {
        Path key = workspace.toAbsolutePath().normalize();
        LocalLock local = retain(key);
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!local.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                release(key);
                throw new WorkspaceBusyException(key);
            }
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            throw new WorkspaceBusyException(key);
        }

        FileChannel channel = null;
        try {
            Path lockFile = key.resolve(outputDirName).resolve(LOCK_FILE);
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = awaitFileLock(channel, deadline, key);
            return new Lease(key, local.lock, channel, fileLock);
        } catch (IOException | WorkspaceBusyException | RuntimeException e) {
            closeOnFailure(channel, e);
            local.lock.unlock();
            release(key);
            throw e;
        }
    }

    static int trackedWorkspaces() {
        return IN_PROCESS.size();
    }

    private static LocalLock retain(Path key) {
        return IN_PROCESS.compute(key, (ignored, existing) -> {
            LocalLock local = existing == null ? new LocalLock() : existing;
            local.users++;
            return local;
        });
    }

    private static void release(Path key) {
        IN_PROCESS.computeIfPresent(key, (ignored, local) -> --local.users == 0 ? null : local);
    }

    private FileLock awaitFileLock(FileChannel channel, long deadline, Path key) throws IOException, WorkspaceBusyException {
        while (true) {
            FileLock fileLock = channel.tryLock();
            if (fileLock != null) {
                return fileLock;
            }
            if (System.nanoTime() >= deadline) {
                throw new WorkspaceBusyException(key);
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkspaceBusyException(key);
            }
        }
    }

    private void closeOnFailure(FileChannel channel, Exception failure) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Held workspace lock; closing it releases the file lock and then the in-process lock.
     */
    public static final class Lease implements Closeable {
        private final Path key;
        private final ReentrantLock local;
        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released;

        private Lease(Path key, ReentrantLock local, FileChannel channel, FileLock fileLock) {
            this.key = key;
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() throws IOException {
            if (released) {
                return;
            }
            released = true;
            try {
                fileLock.release();
            } finally {
                try {
                    channel.close();
                } finally {
                    local.unlock();
                    release(key);
                }
            }
        }
    }

    // Users are counted under the map's per-key lock.
    private static final class LocalLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
