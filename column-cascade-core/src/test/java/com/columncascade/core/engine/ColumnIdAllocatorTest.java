package com.columncascade.core.engine;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ColumnIdAllocator}.
 */
class ColumnIdAllocatorTest extends CascadeTestBase {

    @Test
    void next_emptyWorkbook_startsAtOne() {
        ColumnIdAllocator allocator = new ColumnIdAllocator(workbook);

        assertThat(allocator.next()).isEqualTo(1L);
        assertThat(allocator.next()).isEqualTo(2L);
        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(2L);
    }

    @Test
    void next_existingColumns_continuesAfterLargestId() {
        artifact("dim_customer", "s2");
        column("dim_customer", 1, "a", 1, "INT", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 5, "b", 2, "INT", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 2, "c", 3, "INT", ColumnGroup.ATTRIBUTE);

        assertThat(new ColumnIdAllocator(workbook).next()).isEqualTo(6L);
    }

    @Test
    void next_highWaterMarkAboveIds_continuesAfterMark() {
        artifact("dim_customer", "s2");
        column("dim_customer", 3, "a", 1, "INT", ColumnGroup.ATTRIBUTE);
        workbook.raiseColumnIdHighWaterMark(10);

        assertThat(new ColumnIdAllocator(workbook).next()).isEqualTo(11L);
    }

    @Test
    void next_afterDeletingNewestColumn_neverReissuesItsId() {
        artifact("dim_customer", "s2");
        column("dim_customer", 1, "a", 1, "INT", ColumnGroup.ATTRIBUTE);
        Column newest = column("dim_customer", 7, "b", 2, "INT", ColumnGroup.ATTRIBUTE);
        workbook.replaceColumns(workbook.columns().stream().filter(column -> column != newest).toList());

        assertThat(new ColumnIdAllocator(workbook).next()).isEqualTo(8L);
    }

    @Test
    void next_manyCalls_areStrictlyIncreasing() {
        ColumnIdAllocator allocator = new ColumnIdAllocator(workbook);

        List<Long> ids = List.of(allocator.next(), allocator.next(), allocator.next(), allocator.next());

        assertThat(ids).isSorted().doesNotHaveDuplicates();
        assertThat(allocator.highWaterMark()).isEqualTo(4L);
    }
}
