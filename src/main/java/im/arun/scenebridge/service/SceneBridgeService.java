package im.arun.scenebridge.service;

import im.arun.scenebridge.backup.BackupProvider;
import im.arun.scenebridge.classify.ClassificationResult;
import im.arun.scenebridge.classify.ImageFillCollector;
import im.arun.scenebridge.classify.RenderClassifier;
import im.arun.scenebridge.component.ComponentResolver;
import im.arun.scenebridge.config.SceneBridgeConfig;
import im.arun.scenebridge.generate.ComponentRegistry;
import im.arun.scenebridge.generate.GenerationResult;
import im.arun.scenebridge.generate.NodePropertyApplier;
import im.arun.scenebridge.generate.SceneGenerator;
import im.arun.scenebridge.image.RenderedImageProvider;
import im.arun.scenebridge.index.DocumentIndex;
import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.merge.DeltaMergeEngine;
import im.arun.scenebridge.model.DesignDocument;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.PlanAction;
import im.arun.scenebridge.model.ReconciliationPlan;
import im.arun.scenebridge.transform.TransformResolver;
import im.arun.scenebridge.util.ImportDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs one import end to end: index, promote missing components, classify, generate,
 * instantiate, reconcile against backups.
 */
public class SceneBridgeService {
    private static final Logger logger = LoggerFactory.getLogger(SceneBridgeService.class);

    private final RenderedImageProvider imageProvider;
    private final BackupProvider backupProvider;
    private final TransformResolver transformResolver;
    private final RenderClassifier renderClassifier;
    private final ImageFillCollector imageFillCollector;
    private final DeltaMergeEngine mergeEngine;

    public SceneBridgeService(RenderedImageProvider imageProvider, BackupProvider backupProvider) {
        this.imageProvider = imageProvider;
        this.backupProvider = backupProvider;
        this.transformResolver = new TransformResolver();
        this.renderClassifier = new RenderClassifier();
        this.imageFillCollector = new ImageFillCollector();
        this.mergeEngine = new DeltaMergeEngine();
    }

    public ImportResult importDocument(DesignDocument document, SceneBridgeConfig config) {
        return importDocument(document, config, null);
    }

    /**
     * Imports a document.
     *
     * @param missingComponentIds component ids known to have no definition; computed from
     *                            the document when null
     */
    public ImportResult importDocument(DesignDocument document, SceneBridgeConfig config,
                                       Set<String> missingComponentIds) {
        ImportDiagnostics diagnostics = new ImportDiagnostics();
        NodePropertyApplier propertyApplier = new NodePropertyApplier(config.getAssetRootPath());
        ComponentResolver componentResolver = new ComponentResolver(transformResolver, propertyApplier, config.isCenterPivot());
        SceneGenerator generator = new SceneGenerator(transformResolver, propertyApplier,
            config.isCenterPivot(), config.getAssetRootPath());

        logger.info("Importing document '{}'", document.getName());
        DocumentNode root = document.getDocument();
        DocumentIndex index = DocumentIndex.build(root);
        Set<String> selectedPageIds = new HashSet<>(config.getSelectedPageIds());
        List<DocumentNode> pages = DocumentQueries.eligiblePages(root, config.isOnlyImportSelectedPages(), selectedPageIds);
        logger.info("Indexed {} nodes, {} pages eligible", index.size(), pages.size());

        Set<String> missing = missingComponentIds != null
            ? new LinkedHashSet<>(missingComponentIds)
            : new LinkedHashSet<>(componentResolver.findMissingComponentDefinitions(document, pages));
        List<String> promoted = componentResolver.replaceMissingComponents(index, pages, missing, diagnostics);

        ClassificationResult classification = renderClassifier.classify(root, missing, selectedPageIds,
            config.isOnlyImportSelectedPages(), config.isParallelClassification());
        List<String> imageFills = imageFillCollector.collect(root, selectedPageIds,
            config.isOnlyImportImagesFromSelectedPages());

        GenerationResult generation = generator.generate(pages, index, classification, imageProvider, diagnostics);
        ComponentRegistry registry = generation.getRegistry();
        componentResolver.instantiateAll(registry, index, classification, diagnostics);
        List<GeneratedRoot> roots = registry.roots();
        componentResolver.removePlaceholderMarkers(roots);

        ReconciliationPlan plan = reconcile(roots, registry, config, diagnostics);

        if (config.isUpdateBackups()) {
            for (GeneratedRoot generated : roots) {
                backupProvider.store(generated.key(), generated.getTree());
            }
            logger.info("Updated {} backups", roots.size());
        }

        ImportResult result = new ImportResult();
        result.setDocumentName(document.getName());
        result.setRoots(roots);
        result.setClassifications(classification.getClassifications());
        result.setImageFillIds(imageFills);
        result.setRenderedImages(generation.getRenderedImages());
        result.setPlan(plan);
        result.setDiagnostics(diagnostics.getEntries());
        result.setMissingComponentIds(new ArrayList<>(missing));
        result.setPromotedComponentIds(promoted);
        result.setFlowStartScreenId(DocumentQueries.prototypeFlowStartScreenId(pages));

        logger.info("Import of '{}' finished: {} roots, {} plan entries, {} diagnostics",
            document.getName(), roots.size(), plan.getEntries().size(), result.getDiagnostics().size());
        return result;
    }

    private ReconciliationPlan reconcile(List<GeneratedRoot> roots, ComponentRegistry registry,
                                         SceneBridgeConfig config, ImportDiagnostics diagnostics) {
        ReconciliationPlan plan = new ReconciliationPlan();
        Set<String> freshKeys = new HashSet<>();
        for (GeneratedRoot generated : roots) {
            freshKeys.add(generated.key());
            if (!config.isApplyDelta()) {
                mergeEngine.recordCreated(generated.key(), generated.getTree(), plan);
                continue;
            }
            GeneratedNode backup = backupProvider.load(generated.key()).orElse(null);
            mergeEngine.merge(generated.key(), generated.getTree(), backup, registry, plan, diagnostics);
        }

        for (String staleKey : new TreeSet<>(backupProvider.rootKeys())) {
            if (!freshKeys.contains(staleKey)) {
                plan.add(staleKey, "", PlanAction.REMOVE);
            }
        }
        return plan;
    }
}
