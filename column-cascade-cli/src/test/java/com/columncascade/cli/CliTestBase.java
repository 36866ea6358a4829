package com.columncascade.cli;

import com.columncascade.ColumnCascadeCLI;
import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.StageSide;
import com.columncascade.core.store.JsonWorkbookStore;
import com.columncascade.core.store.StoreUnavailableException;
import com.columncascade.core.store.Workbook;
import com.columncascade.core.store.WorkbookSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for command tests.
 *
 * <p>Provides a temporary workbook file and helpers to seed and read it.
 */
public abstract class CliTestBase {

    @TempDir
    protected Path tempDir;

    protected Path workbookFile;

    @BeforeEach
    void setUpWorkbookFile() {
        workbookFile = tempDir.resolve("workbook.json");
    }

    /**
     * Runs the command line with the given arguments.
     */
    protected int run(String... args) {
        return ColumnCascadeCLI.commandLine().execute(args);
    }

    /**
     * Creates a bronze customer table and a silver table cascading from it with {@code main}.
     */
    protected Workbook customerPipeline() {
        return new Workbook()
            .addStage(new Stage("s1", "1_bronze", "databricks", StageSide.SOURCE))
            .addStage(new Stage("s2", "2_silver", "databricks", StageSide.BUSINESS))
            .addArtifact(new Artifact("customer_bronze", null, "s1", null, null, null))
            .addArtifact(new Artifact("customer_silver", null, "s2", null, "customer_bronze", "main"))
            .addColumn(Column.of("customer_bronze", 1, "customer_bk", 1, "STRING", ColumnGroup.BUSINESS_KEY))
            .addColumn(Column.of("customer_bronze", 2, "customer_name", 2, "STRING", ColumnGroup.ATTRIBUTE));
    }

    protected void writeWorkbook(Workbook workbook) throws StoreUnavailableException {
        try (WorkbookSession session = new JsonWorkbookStore(workbookFile).create(workbook)) {
            session.commit();
        }
    }

    protected Workbook readWorkbook() throws StoreUnavailableException {
        try (WorkbookSession session = new JsonWorkbookStore(workbookFile).openExclusive()) {
            return session.workbook();
        }
    }

    protected List<String> columnNames(Workbook workbook, String artifactId) {
        List<String> names = new ArrayList<>();
        workbook.columnsOf(artifactId).forEach(column -> names.add(column.columnName()));
        return names;
    }
}
