package com.tubearchive.archiver.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-wide mutual exclusion between runs. Holds an OS advisory lock on
 * the lock file, which the OS drops if the process dies, so a file left
 * behind by a crashed run does not block the next one. The file records the
 * owner's PID and start time for operators.
 */
public final class RunLock implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunLock.class);

    static final int MAX_ACQUIRE_ATTEMPTS = 5;

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * The holder deletes the file before releasing the OS lock, so a
     * contender that opened the old file may be granted a lock on an unlinked
     * inode. Such a lock is dropped and acquisition retried on whatever file
     * the path names now.
     *
     * @return empty if another run holds the lock
     */
    public static Optional<RunLock> tryAcquire(Path lockFile) throws IOException {
        Files.createDirectories(lockFile.getParent());

        for (int attempt = 1; attempt <= MAX_ACQUIRE_ATTEMPTS; attempt++) {
            BasicFileAttributes opened;
            FileChannel channel;
            try {
                opened = createAndReadAttributes(lockFile);
                channel = FileChannel.open(lockFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
            } catch (NoSuchFileException e) {
                logger.debug("Lock file {} vanished before open; retrying", lockFile);
                continue;
            }

            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            if (lock == null) {
                channel.close();
                return Optional.empty();
            }

            boolean current;
            try {
                current = refersTo(lockFile, opened);
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            if (!current) {
                logger.debug("Lock file {} was replaced while acquiring; retrying", lockFile);
                lock.release();
                channel.close();
                continue;
            }

            String owner = "pid=" + ProcessHandle.current().pid() + "\nstarted=" + Instant.now() + "\n";
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(owner.getBytes(StandardCharsets.UTF_8)), 0);
            channel.force(true);
            logger.debug("Acquired run lock {}", lockFile);
            return Optional.of(new RunLock(lockFile, channel, lock));
        }

        logger.warn("Lock file {} kept changing while acquiring; treating it as held", lockFile);
        return Optional.empty();
    }

    private static BasicFileAttributes createAndReadAttributes(Path lockFile) throws IOException {
        try {
            Files.createFile(lockFile);
        } catch (FileAlreadyExistsException e) {
            logger.debug("Reusing existing lock file {}", lockFile);
        }
        return Files.readAttributes(lockFile, BasicFileAttributes.class);
    }

    /**
     * @return true if the path still names the file described by {@code opened}
     */
    static boolean refersTo(Path lockFile, BasicFileAttributes opened) throws IOException {
        BasicFileAttributes current;
        try {
            current = Files.readAttributes(lockFile, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return false;
        }
        if (opened.fileKey() == null || current.fileKey() == null) {
            return true;
        }
        return opened.fileKey().equals(current.fileKey());
    }

    /**
     * Deletes the lock file while still holding the OS lock, then releases it.
     */
    @Override
    public void close() {
        try {
            Files.deleteIfExists(lockFile);
        } catch (IOException e) {
            logger.warn("Could not delete lock file {}: {}", lockFile, e.getMessage());
        }
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            logger.warn("Could not release run lock {}: {}", lockFile, e.getMessage());
        }
    }
}
