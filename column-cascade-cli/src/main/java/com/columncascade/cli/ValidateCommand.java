package com.columncascade.cli;

import com.columncascade.core.store.JsonWorkbookStore;
import com.columncascade.core.store.StoreUnavailableException;
import com.columncascade.core.store.WorkbookSession;
import com.columncascade.core.validation.InvariantViolation;
import com.columncascade.core.validation.WorkbookValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check the workbook invariants. Exits with 1 when any error is found.
 */
@Command(
    name = "validate",
    description = "Check column ids, names, ordering and artifact references",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"-w", "--workbook"}, description = "Workbook file (default: workbook.json)")
    private Path workbookPath = Paths.get("workbook.json");

    @Override
    public Integer call() {
        log.info("Validating workbook: {}", workbookPath);
        List<InvariantViolation> violations;
        try (WorkbookSession session = new JsonWorkbookStore(workbookPath).openExclusive()) {
            violations = new WorkbookValidator().validate(session.workbook());
        } catch (StoreUnavailableException e) {
            log.error("Workbook unavailable: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.STORE_UNAVAILABLE;
        }

        if (violations.isEmpty()) {
            System.out.println("✓ Workbook is valid");
            return ExitCodes.OK;
        }
        for (InvariantViolation violation : violations) {
            String marker = violation.isError() ? "✗" : "⚠";
            String location = violation.artifactId() == null ? "" : violation.artifactId()
                + (violation.columnName() == null ? "" : "." + violation.columnName()) + ": ";
            System.out.printf("%s [%s] %s%s%n", marker, violation.rule(), location, violation.message());
        }
        long errors = violations.stream().filter(InvariantViolation::isError).count();
        System.out.println();
        System.out.println(errors + " errors, " + (violations.size() - errors) + " warnings");
        return errors > 0 ? ExitCodes.FAILURE : ExitCodes.OK;
    }
}
