package com.columncascade.core.store;

/**
 * Exclusive access to a workbook store.
 *
 * <p>Changes to {@link #workbook()} are persisted only by {@link #commit()}. Closing
 * releases the lock; uncommitted changes are discarded.
 *
 * <pre>{@code
 * try (WorkbookSession session = store.openExclusive()) {
 *     new CascadeEngine(session.workbook(), config).cascadeAll();
 *     session.commit();
 * }
 * }</pre>
 */
public interface WorkbookSession extends AutoCloseable {

    /**
     * Returns the working copy held by this session.
     *
     * @return workbook
     */
    Workbook workbook();

    /**
     * Persists the working copy.
     *
     * @throws StoreUnavailableException if the store cannot be written
     */
    void commit() throws StoreUnavailableException;

    /**
     * Releases the exclusive lock.
     *
     * @throws StoreUnavailableException if the lock cannot be released
     */
    @Override
    void close() throws StoreUnavailableException;
}
