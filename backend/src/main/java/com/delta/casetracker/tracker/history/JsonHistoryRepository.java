package com.delta.casetracker.tracker.history;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.service.ActiveTrackerRunException;
import com.delta.casetracker.tracker.util.PathUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Durable history kept as a single JSON document. Writes go to a temp file in the same directory which is
 * flushed and then renamed over the previous document, so readers only ever see a complete old or new store.
 */
@Repository
public class JsonHistoryRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonHistoryRepository.class);
    static final String TEMP_SUFFIX = ".tmp";
    static final String LOCK_SUFFIX = ".lock";

    private final Path historyPath;
    private final ObjectMapper objectMapper;

    public JsonHistoryRepository(TrackerProperties properties, ObjectMapper objectMapper) {
        this.historyPath = PathUtils.resolve(properties.getHistory().getPath());
        this.objectMapper = objectMapper;
    }

    public Path historyPath() {
        return historyPath;
    }

    public Path lockPath() {
        return historyPath.resolveSibling(historyPath.getFileName() + LOCK_SUFFIX);
    }

    public boolean exists() {
        return Files.exists(historyPath);
    }

    public CaseHistory load() {
        if (!Files.exists(historyPath)) {
            log.info("No history file at {}; treating history as empty", historyPath);
            return CaseHistory.empty();
        }
        HistoryDocument document;
        try (InputStream in = Files.newInputStream(historyPath)) {
            document = objectMapper.readValue(in, HistoryDocument.class);
        } catch (IOException e) {
            throw new HistoryStoreException("History file is unreadable or corrupt: " + historyPath, e);
        }
        if (document == null || document.formatVersion() <= 0) {
            throw new HistoryStoreException("History file has no format version marker: " + historyPath);
        }
        if (document.formatVersion() > HistoryDocument.CURRENT_FORMAT_VERSION) {
            log.warn(
                "History file {} has format version {} (supported {}); reading known fields only",
                historyPath,
                document.formatVersion(),
                HistoryDocument.CURRENT_FORMAT_VERSION
            );
        }
        try {
            CaseHistory history = CaseHistory.of(document.entries());
            log.info("Loaded history with {} entries from {}", history.size(), historyPath);
            return history;
        } catch (IllegalArgumentException e) {
            throw new HistoryStoreException("History file is inconsistent: " + historyPath, e);
        }
    }

    /**
     * Atomically replaces the durable history with {@code history}. On failure the previous document is untouched.
     */
    public void replace(CaseHistory history) {
        Path directory = historyPath.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(HistoryDocument.of(history));
            temp = Files.createTempFile(directory, historyPath.getFileName() + ".", TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp);
            temp = null;
            log.info("Persisted history with {} entries to {}", history.size(), historyPath);
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to persist history to " + historyPath, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    public HistoryLock acquireLock() {
        Path lockPath = lockPath();
        FileChannel channel;
        try {
            Files.createDirectories(lockPath.toAbsolutePath().getParent());
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new HistoryStoreException("Unable to open history lock " + lockPath, e);
        }
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new ActiveTrackerRunException("Another tracker run holds the history lock " + lockPath, e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new HistoryStoreException("Unable to lock history " + lockPath, e);
        }
        if (lock == null) {
            closeQuietly(channel);
            throw new ActiveTrackerRunException("Another tracker run holds the history lock " + lockPath);
        }
        return new HistoryLock(lockPath, channel, lock);
    }

    /**
     * Deletes temp files left behind by writes that died before the rename. Caller must hold the history lock.
     */
    public int deleteOrphanTempFiles() {
        Path directory = historyPath.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return 0;
        }
        String prefix = historyPath.getFileName() + ".";
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, prefix + "*" + TEMP_SUFFIX)) {
            for (Path candidate : stream) {
                if (Files.deleteIfExists(candidate)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan {} for orphaned history temp files", directory, e);
        }
        return deleted;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, historyPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; falling back to replace", historyPath);
            Files.move(temp, historyPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temp history file {}", path, e);
        }
    }

    private void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close history lock channel", e);
        }
    }
}
