package im.arun.scenebridge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.scenebridge.backup.BackupProvider;
import im.arun.scenebridge.backup.InMemoryBackupProvider;
import im.arun.scenebridge.config.SceneBridgeConfig;
import im.arun.scenebridge.image.ImageUnavailableException;
import im.arun.scenebridge.image.RenderedImageProvider;
import im.arun.scenebridge.model.DesignDocument;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.PlanAction;
import im.arun.scenebridge.model.PlanEntry;
import im.arun.scenebridge.model.RenderClassification;
import im.arun.scenebridge.util.ImportDiagnostics.Category;
import im.arun.scenebridge.util.ImportDiagnostics.Entry;
import im.arun.scenebridge.util.TreeUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static im.arun.scenebridge.TestNodes.childByPath;
import static im.arun.scenebridge.TestNodes.root;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SceneBridgeService")
class SceneBridgeServiceTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @Mock
    private RenderedImageProvider imageProvider;

    @Mock
    private BackupProvider backupProvider;

    private SceneBridgeConfig config;

    @BeforeEach
    void setUp() {
        config = new SceneBridgeConfig();
        config.setSelectedPageIds(List.of("2:0"));
    }

    private static DesignDocument loadDocument() throws IOException {
        try (InputStream in = SceneBridgeServiceTest.class.getResourceAsStream("/documents/login-flow.json")) {
            return new ObjectMapper().readValue(in, DesignDocument.class);
        }
    }

    private static GeneratedNode tree(ImportResult result, String rootKey) {
        return root(result, rootKey).map(GeneratedRoot::getTree).orElseThrow();
    }

    @Nested
    @DisplayName("first import")
    class FirstImport {

        private ImportResult result;

        @BeforeEach
        void runImport() throws IOException {
            when(imageProvider.imageFor(anyString())).thenReturn(Optional.of(PNG));
            when(backupProvider.load(anyString())).thenReturn(Optional.empty());
            when(backupProvider.rootKeys()).thenReturn(Set.of("Screens/Removed"));

            result = new SceneBridgeService(imageProvider, backupProvider).importDocument(loadDocument(), config);
        }

        @Test
        @DisplayName("generates component, screen and page roots in that order")
        void importDocument_rootsInOrder() {
            assertThat(result.getRoots()).extracting(GeneratedRoot::key).containsExactly(
                "Components/Button", "Components/Chip A",
                "Screens/Login", "Screens/Banner",
                "Pages/Components", "Pages/Screens");
        }

        @Test
        @DisplayName("promotes the first instance of a missing component")
        void importDocument_promotesMissingComponent() {
            assertThat(result.getMissingComponentIds()).containsExactly("9:9");
            assertThat(result.getPromotedComponentIds()).containsExactly("4:3");

            GeneratedNode login = tree(result, "Screens/Login");
            GeneratedNode chipB = childByPath(login, "Chip B").orElseThrow();
            assertThat(chipB.getComponentRef()).isEqualTo("4:3");
            assertThat(childByPath(chipB, "Text")).isPresent();
        }

        @Test
        @DisplayName("exposes classifications, image fills and pulled images")
        void importDocument_classificationAndImages() {
            assertThat(result.getClassifications()).containsOnly(
                entry("5:3", RenderClassification.SERVER_SUBSTITUTE),
                entry("3:2", RenderClassification.SERVER_EXPORT));
            assertThat(result.getImageFillIds()).containsExactly("hero-image");
            assertThat(result.getRenderedImages()).containsOnlyKeys("5:3", "3:2");
            assertThat(tree(result, "Screens/Banner").getImageRef()).isEqualTo("Assets/Figma/Exports/Banner.png");
        }

        @Test
        @DisplayName("instances carry their own text and keep server rendered parts as images")
        void importDocument_instancesResolved() {
            GeneratedNode submit = childByPath(tree(result, "Screens/Login"), "Submit").orElseThrow();

            assertThat(submit.getComponentRef()).isEqualTo("5:1");
            assertThat(childByPath(submit, "Label").orElseThrow()
                .component(NodeComponent.TEXT).getString("characters")).isEqualTo("Sign in");
            GeneratedNode icon = childByPath(submit, "Icon").orElseThrow();
            assertThat(icon.getImageRef()).isEqualTo("Assets/Figma/ServerRenderedImages/5_3.png");
            assertThat(icon.getTransform().getSizeDelta().getX()).isEqualTo(16.0);
        }

        @Test
        @DisplayName("page trees contain the screens as asset instances")
        void importDocument_pagesReferenceScreens() {
            GeneratedNode page = tree(result, "Pages/Screens");

            assertThat(page.getChildren()).extracting(GeneratedNode::getAssetRef)
                .containsExactly("Screens/Login", "Screens/Banner");
            assertThat(TreeUtils.preOrder(page)).noneMatch(GeneratedNode::isPlaceholder);
        }

        @Test
        @DisplayName("plans creation of every root and removal of stale backups")
        void importDocument_plan() {
            assertThat(result.getPlan().entriesFor(PlanAction.REMOVE)).extracting(PlanEntry::getRootKey)
                .containsExactly("Screens/Removed");
            assertThat(result.getPlan().entriesFor(PlanAction.UPDATE)).isEmpty();
            assertThat(result.getPlan().entriesFor(PlanAction.CREATE)).extracting(PlanEntry::getRootKey)
                .contains("Screens/Login", "Pages/Screens");
        }

        @Test
        @DisplayName("stores a backup per root and reports the flow start")
        void importDocument_backupsAndFlow() {
            verify(backupProvider, times(6)).store(anyString(), any(GeneratedNode.class));
            verify(backupProvider).store(eq("Screens/Login"), any(GeneratedNode.class));
            assertThat(result.getFlowStartScreenId()).isEqualTo("3:1");
            assertThat(result.getDocumentName()).isEqualTo("Login Flow");
        }
    }

    @Test
    @DisplayName("image failures become diagnostics and the import still completes")
    void importDocument_imageFailureIsNotFatal() throws IOException {
        when(imageProvider.imageFor(anyString())).thenThrow(new ImageUnavailableException("renderer offline", null));
        when(backupProvider.load(anyString())).thenReturn(Optional.empty());
        when(backupProvider.rootKeys()).thenReturn(Set.of());

        ImportResult result = new SceneBridgeService(imageProvider, backupProvider).importDocument(loadDocument(), config);

        assertThat(result.getRoots()).hasSize(6);
        assertThat(result.getRenderedImages()).isEmpty();
        assertThat(result.getDiagnostics()).extracting(Entry::getCategory).contains(Category.IMAGE_FETCH);
    }

    @Test
    @DisplayName("backups are left alone when updating them is disabled")
    void importDocument_noBackupUpdate() throws IOException {
        config.setUpdateBackups(false);
        config.setApplyDelta(false);
        when(imageProvider.imageFor(anyString())).thenReturn(Optional.empty());
        when(backupProvider.rootKeys()).thenReturn(Set.of());

        new SceneBridgeService(imageProvider, backupProvider).importDocument(loadDocument(), config);

        verify(backupProvider, never()).store(anyString(), any(GeneratedNode.class));
        verify(backupProvider, never()).load(anyString());
    }

    @Test
    @DisplayName("only selected pages are imported when the selection is enforced")
    void importDocument_onlySelectedPages() throws IOException {
        config.setOnlyImportSelectedPages(true);
        when(imageProvider.imageFor(anyString())).thenReturn(Optional.empty());
        when(backupProvider.load(anyString())).thenReturn(Optional.empty());
        when(backupProvider.rootKeys()).thenReturn(Set.of());

        ImportResult result = new SceneBridgeService(imageProvider, backupProvider).importDocument(loadDocument(), config);

        assertThat(root(result, "Pages/Components")).isEmpty();
        assertThat(root(result, "Components/Button")).isEmpty();
        // the button definition lives on an unselected page, so its instance stands in for it
        assertThat(result.getMissingComponentIds()).containsExactly("5:1", "9:9");
        assertThat(result.getPromotedComponentIds()).containsExactly("4:2", "4:3");
        assertThat(root(result, "Components/Submit")).isPresent();
        assertThat(result.getDiagnostics()).extracting(Entry::getCategory).contains(Category.MISSING_COMPONENT);
    }

    @Nested
    @DisplayName("re-import")
    class Reimport {

        private final InMemoryBackupProvider backups = new InMemoryBackupProvider();

        private SceneBridgeService service() {
            return new SceneBridgeService(RenderedImageProvider.none(), backups);
        }

        @Test
        @DisplayName("manual children added to a backup survive the next import")
        void importDocument_preservesManualEdits() throws IOException {
            service().importDocument(loadDocument(), config);
            GeneratedNode login = backups.load("Screens/Login").orElseThrow();
            GeneratedNode overlay = new GeneratedNode("manual-1", "Debug overlay");
            overlay.addComponent(new NodeComponent("Canvas").with("sortingOrder", 10));
            login.getChildren().add(1, overlay);
            backups.store("Screens/Login", login);

            ImportResult second = service().importDocument(loadDocument(), config);

            GeneratedNode merged = tree(second, "Screens/Login");
            assertThat(merged.getChildren()).extracting(GeneratedNode::getName)
                .containsExactly("Hero", "Debug overlay", "Submit", "Chip A", "Chip B");
            assertThat(second.getPlan().entriesFor(PlanAction.PRESERVE)).extracting(PlanEntry::getPath)
                .containsExactly("Login/Debug overlay");
            assertThat(backups.load("Screens/Login").orElseThrow().getChildren()).hasSize(5);
        }

        @Test
        @DisplayName("re-importing an unchanged document produces the same trees")
        void importDocument_unchangedDocumentIsStable() throws IOException {
            ImportResult first = service().importDocument(loadDocument(), config);
            ImportResult second = service().importDocument(loadDocument(), config);

            assertThat(second.getRoots()).isEqualTo(first.getRoots());
            assertThat(second.getPlan().entriesFor(PlanAction.CREATE)).isEmpty();
        }

        @Test
        @DisplayName("without delta the backup is ignored")
        void importDocument_noDelta() throws IOException {
            service().importDocument(loadDocument(), config);
            GeneratedNode login = backups.load("Screens/Login").orElseThrow();
            login.addChild(new GeneratedNode("manual-1", "Debug overlay"));
            backups.store("Screens/Login", login);
            config.setApplyDelta(false);

            ImportResult second = service().importDocument(loadDocument(), config);

            assertThat(tree(second, "Screens/Login").getChildren()).extracting(GeneratedNode::getName)
                .doesNotContain("Debug overlay");
        }
    }
}
