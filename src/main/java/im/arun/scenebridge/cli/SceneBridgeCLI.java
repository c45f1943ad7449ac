package im.arun.scenebridge.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.scenebridge.backup.BackupProvider;
import im.arun.scenebridge.backup.InMemoryBackupProvider;
import im.arun.scenebridge.backup.JsonDirectoryBackupProvider;
import im.arun.scenebridge.config.ConfigLoader;
import im.arun.scenebridge.config.SceneBridgeConfig;
import im.arun.scenebridge.image.DirectoryImageProvider;
import im.arun.scenebridge.image.RenderedImageProvider;
import im.arun.scenebridge.model.DesignDocument;
import im.arun.scenebridge.model.PlanAction;
import im.arun.scenebridge.service.ImportResult;
import im.arun.scenebridge.service.SceneBridgeService;
import im.arun.scenebridge.util.ClassificationPool;
import im.arun.scenebridge.util.ImportDiagnostics;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: imports a design document JSON file and prints or writes the
 * reconciled scene as JSON.
 */
@Command(
    name = "scenebridge",
    description = "Reconcile a design document into generated scene trees, preserving manual edits from backups",
    mixinStandardHelpOptions = true,
    version = "SceneBridge 1.0"
)
public class SceneBridgeCLI implements Callable<Integer> {

    @Option(names = {"--document"}, description = "Path to the design document JSON file", required = true)
    private String documentPath;

    @Option(names = {"--backup-dir"}, description = "Directory holding backups of previous imports")
    private String backupDir;

    @Option(names = {"--images-dir"}, description = "Directory of server rendered images named <node id>.png")
    private String imagesDir;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--page"}, description = "Id of a selected page (repeatable)")
    private List<String> pages = new ArrayList<>();

    @Option(names = {"--only-selected-pages"}, description = "Import only the selected pages")
    private boolean onlySelectedPages;

    @Option(names = {"--no-center-pivot"}, description = "Keep the top-left pivot instead of centering it")
    private boolean noCenterPivot;

    @Option(names = {"--no-delta"}, description = "Ignore backups and regenerate everything")
    private boolean noDelta;

    @Option(names = {"--diagnostics"}, description = "Write import diagnostics to this JSON file")
    private String diagnosticsPath;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        Path documentFile = Paths.get(documentPath);
        if (!Files.exists(documentFile)) {
            System.err.println("Error: document file not found: " + documentPath);
            return 1;
        }

        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        DesignDocument document;
        try {
            document = mapper.readValue(documentFile.toFile(), DesignDocument.class);
        } catch (IOException e) {
            System.err.println("Error: could not read document: " + e.getMessage());
            return 1;
        }
        if (document.getDocument() == null) {
            System.err.println("Error: document has no root node: " + documentPath);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (!pages.isEmpty()) {
            overrides.put("selected_page_ids", pages);
        }
        if (onlySelectedPages) {
            overrides.put("only_import_selected_pages", true);
        }
        if (noCenterPivot) {
            overrides.put("center_pivot", false);
        }
        if (noDelta) {
            overrides.put("apply_delta", false);
        }
        SceneBridgeConfig config = new ConfigLoader(configPath).load(overrides);

        BackupProvider backups = backupDir != null
            ? new JsonDirectoryBackupProvider(Paths.get(backupDir))
            : new InMemoryBackupProvider();
        RenderedImageProvider images = imagesDir != null
            ? new DirectoryImageProvider(Paths.get(imagesDir))
            : RenderedImageProvider.none();

        System.out.println("SceneBridge - Scene Reconciliation");
        System.out.println("=".repeat(50));
        System.out.println("Document: " + documentPath);
        System.out.println("Backups: " + (backupDir != null ? backupDir : "(none)"));
        System.out.println();

        ImportResult result;
        try {
            result = new SceneBridgeService(images, backups).importDocument(document, config);
        } catch (RuntimeException e) {
            System.err.println("Error importing document: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }

        System.out.println("Roots: " + result.getRoots().size());
        System.out.println("Server rendered nodes: " + result.getClassifications().size());
        System.out.println("Image fills: " + result.getImageFillIds().size());
        for (PlanAction action : PlanAction.values()) {
            System.out.println(action + ": " + result.getPlan().entriesFor(action).size());
        }
        System.out.println("Diagnostics: " + result.getDiagnostics().size());

        if (diagnosticsPath != null) {
            ImportDiagnostics.writeTo(Paths.get(diagnosticsPath), result.getDiagnostics());
        }

        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(result);
        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput);
            System.out.println("\nOutput written to: " + outputPath);
        } else {
            System.out.println("\nResult:");
            System.out.println(jsonOutput);
        }
        return 0;
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new SceneBridgeCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ClassificationPool.shutdown();
        }
    }
}
