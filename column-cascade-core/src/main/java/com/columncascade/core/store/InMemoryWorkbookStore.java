package com.columncascade.core.store;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Workbook store held in memory, for tests and embedding.
 *
 * <p>Sessions work on a copy; {@link WorkbookSession#commit()} replaces the stored workbook.
 */
public class InMemoryWorkbookStore implements WorkbookStore {

    private final AtomicBoolean open = new AtomicBoolean(false);
    private Workbook stored;

    public InMemoryWorkbookStore() {
        this(null);
    }

    /**
     * Creates a store holding the given workbook.
     *
     * @param initial stored workbook, or null for a store that does not exist yet
     */
    public InMemoryWorkbookStore(Workbook initial) {
        this.stored = initial == null ? null : initial.copy();
    }

    @Override
    public WorkbookSession openExclusive() throws StoreUnavailableException {
        acquire();
        if (stored == null) {
            open.set(false);
            throw new StoreUnavailableException("Workbook not found: " + describe());
        }
        return new Session(stored.copy());
    }

    @Override
    public WorkbookSession create(Workbook initial) throws StoreUnavailableException {
        acquire();
        if (stored != null) {
            open.set(false);
            throw new StoreUnavailableException("Workbook already exists: " + describe());
        }
        return new Session(initial.copy());
    }

    @Override
    public String describe() {
        return "in-memory workbook";
    }

    /**
     * Returns a copy of the last committed workbook.
     *
     * @return committed workbook, or null if nothing was stored
     */
    public Workbook snapshot() {
        return stored == null ? null : stored.copy();
    }

    public boolean isOpen() {
        return open.get();
    }

    private void acquire() throws StoreUnavailableException {
        if (!open.compareAndSet(false, true)) {
            throw new StoreUnavailableException("Workbook is locked by another session: " + describe());
        }
    }

    private final class Session implements WorkbookSession {
        private final Workbook workbook;
        private boolean closed;

        private Session(Workbook workbook) {
            this.workbook = workbook;
        }

        @Override
        public Workbook workbook() {
            return workbook;
        }

        @Override
        public void commit() {
            if (closed) {
                throw new IllegalStateException("Session already closed");
            }
            stored = workbook.copy();
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                open.set(false);
            }
        }
    }
}
