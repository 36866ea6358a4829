package com.columncascade.core.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Workbook store backed by one JSON document.
 *
 * <p>Exclusive access is an OS file lock on {@code <file>.lock}, held for the lifetime
 * of the session. Commits write a temporary sibling file and move it over the document.
 */
public class JsonWorkbookStore implements WorkbookStore {

    private static final Logger log = LoggerFactory.getLogger(JsonWorkbookStore.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final Path file;

    public JsonWorkbookStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath().normalize();
    }

    public Path file() {
        return file;
    }

    public Path lockFile() {
        return file.resolveSibling(file.getFileName() + ".lock");
    }

    @Override
    public WorkbookSession openExclusive() throws StoreUnavailableException {
        Lock lock = acquire();
        try {
            if (!Files.exists(file)) {
                throw new StoreUnavailableException("Workbook not found: " + file);
            }
            WorkbookDocument document = JSON_MAPPER.readValue(file.toFile(), WorkbookDocument.class);
            log.debug("Opened workbook {}: {} artifacts, {} columns",
                file, document.artifacts().size(), document.columns().size());
            return new Session(Workbook.fromDocument(document), lock);
        } catch (StoreUnavailableException e) {
            lock.release();
            throw e;
        } catch (IOException e) {
            lock.release();
            throw new StoreUnavailableException("Failed to read workbook " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public WorkbookSession create(Workbook initial) throws StoreUnavailableException {
        Lock lock = acquire();
        if (Files.exists(file)) {
            lock.release();
            throw new StoreUnavailableException("Workbook already exists: " + file);
        }
        return new Session(initial, lock);
    }

    @Override
    public String describe() {
        return file.toString();
    }

    private Lock acquire() throws StoreUnavailableException {
        Path lockFile = lockFile();
        FileChannel channel;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot open lock file " + lockFile + ": " + e.getMessage(), e);
        }
        FileLock fileLock;
        try {
            fileLock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            fileLock = null;
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw new StoreUnavailableException("Cannot lock workbook " + file + ": " + e.getMessage(), e);
        }
        if (fileLock == null) {
            StoreUnavailableException locked = new StoreUnavailableException("Workbook is locked by another process: " + file);
            closeQuietly(channel, locked);
            throw locked;
        }
        log.debug("Acquired lock {}", lockFile);
        return new Lock(channel, fileLock);
    }

    private static void closeQuietly(FileChannel channel, Exception primary) {
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    private void write(Workbook workbook) throws StoreUnavailableException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            JSON_MAPPER.writeValue(temp.toFile(), workbook.toDocument());
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote workbook {}", file);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write workbook " + file + ": " + e.getMessage(), e);
        }
    }

    private record Lock(FileChannel channel, FileLock fileLock) {

        void release() throws StoreUnavailableException {
            try {
                if (fileLock.isValid()) {
                    fileLock.release();
                }
                channel.close();
            } catch (IOException e) {
                throw new StoreUnavailableException("Failed to release workbook lock: " + e.getMessage(), e);
            }
        }
    }

    private final class Session implements WorkbookSession {
        private final Workbook workbook;
        private final Lock lock;
        private boolean closed;

        private Session(Workbook workbook, Lock lock) {
            this.workbook = workbook;
            this.lock = lock;
        }

        @Override
        public Workbook workbook() {
            return workbook;
        }

        @Override
        public void commit() throws StoreUnavailableException {
            if (closed) {
                throw new IllegalStateException("Session already closed");
            }
            write(workbook);
        }

        @Override
        public void close() throws StoreUnavailableException {
            if (closed) {
                return;
            }
            closed = true;
            lock.release();
            log.debug("Released lock {}", lockFile());
        }
    }
}
