package com.columncascade.cli;

import com.columncascade.core.engine.CleanupReport;
import com.columncascade.core.engine.ColumnCleanup;
import com.columncascade.core.store.JsonWorkbookStore;
import com.columncascade.core.store.StoreUnavailableException;
import com.columncascade.core.store.WorkbookSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to remove duplicate columns and optionally renumber column ids.
 */
@Command(
    name = "cleanup",
    description = "Remove duplicate columns; optionally renumber column ids 1..N",
    mixinStandardHelpOptions = true
)
public class CleanupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanupCommand.class);

    @Option(names = {"-w", "--workbook"}, description = "Workbook file (default: workbook.json)")
    private Path workbookPath = Paths.get("workbook.json");

    @Option(names = {"--reenumerate"}, description = "Renumber column ids 1..N after removing duplicates")
    private boolean reenumerate;

    @Override
    public Integer call() {
        try (WorkbookSession session = new JsonWorkbookStore(workbookPath).openExclusive()) {
            ColumnCleanup cleanup = new ColumnCleanup(session.workbook());
            CleanupReport report = cleanup.removeDuplicateColumns();
            System.out.println("✓ Removed " + report.duplicatesRemoved() + " duplicate columns");
            report.removed().forEach(column -> System.out.println("    - " + column));
            if (reenumerate) {
                int changed = cleanup.reenumerateIds();
                System.out.println("✓ Renumbered column ids (" + changed + " changed)");
            }
            session.commit();
            return ExitCodes.OK;
        } catch (StoreUnavailableException e) {
            log.error("Workbook unavailable: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.STORE_UNAVAILABLE;
        }
    }
}
