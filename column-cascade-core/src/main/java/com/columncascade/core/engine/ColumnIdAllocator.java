package com.columncascade.core.engine;

import com.columncascade.core.model.Column;
import com.columncascade.core.store.Workbook;

import java.util.Objects;

/**
 * Hands out store-wide unique column identifiers.
 *
 * <p>The counter starts above both the workbook's high-water mark and the largest
 * existing id, so an id is never reissued, even after the column holding it was deleted.
 * Every issued id raises the workbook's high-water mark.
 */
public class ColumnIdAllocator {

    private final Workbook workbook;
    private long last;

    /**
     * Creates an allocator, scanning the workbook's ids once.
     *
     * @param workbook workbook whose ids are allocated
     */
    public ColumnIdAllocator(Workbook workbook) {
        this.workbook = Objects.requireNonNull(workbook, "workbook must not be null");
        long maxExisting = workbook.columns().stream().mapToLong(Column::columnId).max().orElse(0L);
        this.last = Math.max(workbook.columnIdHighWaterMark(), maxExisting);
    }

    /**
     * Returns the next identifier.
     *
     * @return fresh id, greater than every id issued before
     */
    public long next() {
        last++;
        workbook.raiseColumnIdHighWaterMark(last);
        return last;
    }

    /**
     * Returns the largest identifier issued or observed so far.
     *
     * @return high-water mark
     */
    public long highWaterMark() {
        return last;
    }
}
