package com.columncascade.cli;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.PipelineLayer;
import com.columncascade.core.model.Stage;
import com.columncascade.core.relation.RelationProcessor;
import com.columncascade.core.relation.RelationStrategy;
import com.columncascade.core.store.JsonWorkbookStore;
import com.columncascade.core.store.StoreUnavailableException;
import com.columncascade.core.store.Workbook;
import com.columncascade.core.store.WorkbookSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Command to list relation kinds, or the stages and artifacts of a workbook.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * column-cascade list relations
 * column-cascade list stages -w workbook.json
 * column-cascade list artifacts -w workbook.json
 * }</pre>
 */
@Command(
    name = "list",
    description = "List relation kinds, stages or artifacts",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: relations, stages, or artifacts")
    private String type;

    @Option(names = {"-w", "--workbook"}, description = "Workbook file (default: workbook.json)")
    private Path workbookPath = Paths.get("workbook.json");

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "relations", "relation" -> listRelations();
            case "stages", "stage" -> withWorkbook(this::listStages);
            case "artifacts", "artifact" -> withWorkbook(this::listArtifacts);
            default -> {
                log.error("Unknown type: {}. Use: relations, stages, or artifacts", type);
                yield ExitCodes.FAILURE;
            }
        };
    }

    private int listRelations() {
        System.out.println("Relation Kinds:");
        System.out.println();
        for (RelationStrategy strategy : new RelationProcessor().strategies()) {
            System.out.printf("  • %s%n", strategy.getKind().value());
            System.out.printf("    %s%n", strategy.getDescription());
        }
        return ExitCodes.OK;
    }

    private int withWorkbook(Consumer<Workbook> printer) {
        try (WorkbookSession session = new JsonWorkbookStore(workbookPath).openExclusive()) {
            printer.accept(session.workbook());
            return ExitCodes.OK;
        } catch (StoreUnavailableException e) {
            log.error("Workbook unavailable: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.STORE_UNAVAILABLE;
        }
    }

    private void listStages(Workbook workbook) {
        System.out.println("Stages:");
        System.out.println();
        for (Stage stage : workbook.stages()) {
            PipelineLayer layer = stage.layer();
            System.out.printf("  • %s (ID: %s)%n", stage.stageName(), stage.stageId());
            System.out.printf("    Layer: %s, Side: %s, Platform: %s%n",
                layer == null ? "unknown" : layer.configName(), stage.side().value(),
                stage.platform().isBlank() ? "-" : stage.platform());
        }
        if (workbook.stages().isEmpty()) {
            System.out.println("  No stages found.");
        }
    }

    private void listArtifacts(Workbook workbook) {
        System.out.println("Artifacts:");
        System.out.println();
        for (Artifact artifact : workbook.artifacts()) {
            System.out.printf("  • %s (ID: %s, stage %s, %s)%n", artifact.artifactName(), artifact.artifactId(),
                artifact.stageId(), artifact.resolvedType().value());
            System.out.printf("    Columns: %d%n", workbook.columnsOf(artifact.artifactId()).size());
            if (artifact.hasUpstream()) {
                System.out.printf("    Upstream: %s (%s)%n", artifact.upstreamArtifact(), artifact.relationType());
            }
        }
        if (workbook.artifacts().isEmpty()) {
            System.out.println("  No artifacts found.");
        }
    }
}
