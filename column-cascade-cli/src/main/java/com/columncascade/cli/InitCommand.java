package com.columncascade.cli;

import com.columncascade.core.config.CascadeConfig;
import com.columncascade.core.config.ConfigLoader;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.StageSide;
import com.columncascade.core.store.JsonWorkbookStore;
import com.columncascade.core.store.StoreUnavailableException;
import com.columncascade.core.store.Workbook;
import com.columncascade.core.store.WorkbookSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to create a starter configuration and workbook.
 *
 * <p>The workbook is seeded with the six pipeline stages. Existing files are left untouched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * column-cascade init
 * column-cascade init my-pipeline -w model.json
 * }</pre>
 */
@Command(
    name = "init",
    description = "Create cascade.yaml and an empty workbook with the default stages",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Parameters(index = "0", description = "Target directory (default: current directory)", defaultValue = ".")
    private Path directory;

    @Option(names = {"-w", "--workbook"}, description = "Workbook file name (default: workbook.json)")
    private String workbookName = "workbook.json";

    @Override
    public Integer call() {
        try {
            Files.createDirectories(directory);

            Path configFile = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
            if (Files.exists(configFile)) {
                System.out.println("• " + configFile + " already exists, left unchanged");
            } else {
                ConfigLoader.write(CascadeConfig.defaults(), configFile);
                System.out.println("✓ Created " + configFile);
            }

            Path workbookFile = directory.resolve(workbookName);
            if (Files.exists(workbookFile)) {
                System.out.println("• " + workbookFile + " already exists, left unchanged");
            } else {
                try (WorkbookSession session = new JsonWorkbookStore(workbookFile).create(starterWorkbook())) {
                    session.commit();
                }
                System.out.println("✓ Created " + workbookFile);
            }
            return ExitCodes.OK;
        } catch (StoreUnavailableException e) {
            log.error("Workbook unavailable: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.STORE_UNAVAILABLE;
        } catch (IOException e) {
            log.error("Init failed", e);
            System.err.println("✗ Init failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    /**
     * Creates a workbook holding the default pipeline stages.
     *
     * @return starter workbook
     */
    static Workbook starterWorkbook() {
        return new Workbook()
            .addStage(new Stage("s0", "0_drop_zone", "", StageSide.SOURCE))
            .addStage(new Stage("s1", "1_bronze", "", StageSide.SOURCE))
            .addStage(new Stage("s2", "2_silver", "", StageSide.BUSINESS))
            .addStage(new Stage("s3", "3_gold", "", StageSide.BUSINESS))
            .addStage(new Stage("s4", "4_mart", "", StageSide.BUSINESS))
            .addStage(new Stage("s5", "5_pbi_model", "", StageSide.BUSINESS));
    }
}
