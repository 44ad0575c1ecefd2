package com.delta.casetracker.tracker.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;

/**
 * Exclusive advisory lock over the history location, held for the lifetime of a run.
 */
public final class HistoryLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HistoryLock.class);

    private final Path lockPath;
    private final FileChannel channel;
    private final FileLock lock;

    HistoryLock(Path lockPath, FileChannel channel, FileLock lock) {
        this.lockPath = lockPath;
        this.channel = channel;
        this.lock = lock;
    }

    public Path lockPath() {
        return lockPath;
    }

    public boolean isValid() {
        return lock.isValid();
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            log.warn("Failed to release history lock {}", lockPath, e);
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close history lock channel {}", lockPath, e);
            }
        }
    }
}
