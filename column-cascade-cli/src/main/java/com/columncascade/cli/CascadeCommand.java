package com.columncascade.cli;

import com.columncascade.core.config.CascadeConfig;
import com.columncascade.core.config.ConfigLoader;
import com.columncascade.core.engine.ArtifactCascadeResult;
import com.columncascade.core.engine.CascadeEngine;
import com.columncascade.core.engine.CascadeException;
import com.columncascade.core.engine.CascadeReport;
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
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to cascade columns from upstream artifacts.
 *
 * <p>Runs, in order:
 * <ol>
 *   <li>Open the workbook exclusively (fails immediately if it is locked)</li>
 *   <li>Cascade one artifact ({@code -a}) or every artifact with upstream references</li>
 *   <li>Optionally remove duplicates and renumber column ids</li>
 *   <li>Commit, unless {@code --dry-run} is given</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * column-cascade cascade -w workbook.json
 * column-cascade cascade -w workbook.json -a fact_sales_gold --cleanup
 * column-cascade cascade -w workbook.json --dry-run
 * }</pre>
 */
@Command(
    name = "cascade",
    description = "Derive downstream columns from upstream artifacts",
    mixinStandardHelpOptions = true
)
public class CascadeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CascadeCommand.class);

    @Option(names = {"-w", "--workbook"}, description = "Workbook file (default: workbook.json)")
    private Path workbookPath = Paths.get("workbook.json");

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: cascade.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-a", "--artifact"}, description = "Cascade only this target artifact")
    private String artifactId;

    @Option(names = {"--cleanup"}, description = "Remove duplicate columns after cascading")
    private boolean cleanup;

    @Option(names = {"--reenumerate"}, description = "Renumber column ids 1..N after cascading")
    private boolean reenumerate;

    @Option(names = {"--dry-run"}, description = "Cascade but do not write the workbook")
    private boolean dryRun;

    @Override
    public Integer call() {
        CascadeConfig config = ConfigLoader.load(configPath);
        log.info("Cascading workbook: {}", workbookPath.toAbsolutePath());

        try (WorkbookSession session = new JsonWorkbookStore(workbookPath).openExclusive()) {
            CascadeEngine engine = new CascadeEngine(session.workbook(), config);
            boolean failed;
            if (artifactId != null) {
                ArtifactCascadeResult result = engine.cascadeArtifact(artifactId);
                printArtifactResult(result);
                failed = false;
            } else {
                CascadeReport report = engine.cascadeAll();
                printReport(report);
                failed = report.hasFailures();
            }

            if (cleanup || reenumerate) {
                ColumnCleanup columnCleanup = new ColumnCleanup(session.workbook());
                CleanupReport cleanupReport = columnCleanup.removeDuplicateColumns();
                System.out.println("✓ Removed " + cleanupReport.duplicatesRemoved() + " duplicate columns");
                if (reenumerate) {
                    int changed = columnCleanup.reenumerateIds();
                    System.out.println("✓ Renumbered column ids (" + changed + " changed)");
                }
            }

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: workbook not written");
            } else {
                session.commit();
                System.out.println("✓ Wrote " + workbookPath);
            }
            return failed ? ExitCodes.FAILURE : ExitCodes.OK;
        } catch (StoreUnavailableException e) {
            log.error("Workbook unavailable: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.STORE_UNAVAILABLE;
        } catch (CascadeException e) {
            log.error("Cascade failed: {}", e.getMessage());
            System.err.println("✗ Cascade failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private void printArtifactResult(ArtifactCascadeResult result) {
        System.out.println("✓ " + result.artifactId() + ": " + result.addedColumns().size() + " columns added, "
            + result.duplicatesSkipped() + " duplicates skipped");
        printWarnings(result.warnings());
    }

    private void printReport(CascadeReport report) {
        System.out.println();
        System.out.println("Cascade Summary:");
        System.out.println("  Processed:      " + report.processed());
        System.out.println("  Skipped:        " + report.skipped());
        System.out.println("  Failed:         " + report.failed());
        System.out.println("  Columns added:  " + report.columnsAdded());
        System.out.println();
        report.failures().forEach(failure -> System.err.println("✗ " + failure));
        printWarnings(report.warnings());
    }

    private void printWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        System.err.println("⚠ " + warnings.size() + " warnings:");
        warnings.forEach(warning -> System.err.println("    - " + warning));
    }
}
