package io.stsguard.runtime;

import io.stsguard.config.StsGuardConfig;
import io.stsguard.model.WorkloadIdentity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One holder per workload identity, across threads of this process and across processes sharing
 * the same state root. Acquisition never waits.
 */
public final class IdentityLocks {
    private final StsGuardConfig config;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public IdentityLocks(StsGuardConfig config) {
        this.config = config;
    }

    public Optional<Lease> tryAcquire(WorkloadIdentity identity) {
        ReentrantLock lock = locks.computeIfAbsent(identity.key(), key -> new ReentrantLock());
        if (lock.isHeldByCurrentThread() || !lock.tryLock()) {
            return Optional.empty();
        }
        FileChannel channel = null;
        try {
            Path lockFile = config.lockFile(identity);
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                lock.unlock();
                return Optional.empty();
            }
            return Optional.of(new Lease(identity, lock, channel, fileLock));
        } catch (OverlappingFileLockException e) {
            closeAfterFailure(channel, e);
            lock.unlock();
            return Optional.empty();
        } catch (IOException e) {
            closeAfterFailure(channel, e);
            lock.unlock();
            throw new UncheckedIOException("Failed to lock " + identity.key(), e);
        } catch (RuntimeException e) {
            closeAfterFailure(channel, e);
            lock.unlock();
            throw e;
        }
    }

    private static void closeAfterFailure(FileChannel channel, Exception primary) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException closeFailure) {
            primary.addSuppressed(closeFailure);
        }
    }

    public static final class Lease implements AutoCloseable {
        private final WorkloadIdentity identity;
        private final ReentrantLock lock;
        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released;

        Lease(WorkloadIdentity identity, ReentrantLock lock, FileChannel channel, FileLock fileLock) {
            this.identity = identity;
            this.lock = lock;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        public WorkloadIdentity identity() {
            return identity;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try (FileChannel ignored = channel) {
                fileLock.release();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release lock on " + identity.key(), e);
            } finally {
                lock.unlock();
            }
        }
    }
}
