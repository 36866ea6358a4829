package com.columncascade.core.store;

/**
 * Persisted store of stages, artifacts, columns and data type mappings.
 *
 * <p>A store hands out at most one session at a time. Opening never waits: if another
 * session holds the store, {@link StoreUnavailableException} is thrown immediately.
 *
 * @see JsonWorkbookStore
 * @see InMemoryWorkbookStore
 */
public interface WorkbookStore {

    /**
     * Opens the existing store exclusively.
     *
     * @return session holding the lock
     * @throws StoreUnavailableException if the store is locked, missing or unreadable
     */
    WorkbookSession openExclusive() throws StoreUnavailableException;

    /**
     * Creates the store with an initial workbook and opens it exclusively.
     *
     * @param initial initial content, persisted on {@link WorkbookSession#commit()}
     * @return session holding the lock
     * @throws StoreUnavailableException if the store already exists or is locked
     */
    WorkbookSession create(Workbook initial) throws StoreUnavailableException;

    /**
     * Returns a human-readable location for messages.
     *
     * @return store location
     */
    String describe();
}
