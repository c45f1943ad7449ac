package im.arun.scenebridge.component;

import im.arun.scenebridge.classify.ClassificationResult;
import im.arun.scenebridge.generate.ComponentRegistry;
import im.arun.scenebridge.generate.NodePropertyApplier;
import im.arun.scenebridge.generate.SceneGenerator;
import im.arun.scenebridge.image.RenderedImageProvider;
import im.arun.scenebridge.index.DocumentIndex;
import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.model.ComponentDescription;
import im.arun.scenebridge.model.DesignDocument;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.transform.TransformResolver;
import im.arun.scenebridge.util.ImportDiagnostics;
import im.arun.scenebridge.util.ImportDiagnostics.Category;
import im.arun.scenebridge.util.TreeUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static im.arun.scenebridge.TestNodes.childByPath;
import static im.arun.scenebridge.TestNodes.component;
import static im.arun.scenebridge.TestNodes.document;
import static im.arun.scenebridge.TestNodes.entriesFor;
import static im.arun.scenebridge.TestNodes.frame;
import static im.arun.scenebridge.TestNodes.instance;
import static im.arun.scenebridge.TestNodes.page;
import static im.arun.scenebridge.TestNodes.placed;
import static im.arun.scenebridge.TestNodes.template;
import static im.arun.scenebridge.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ComponentResolver")
class ComponentResolverTest {

    private TransformResolver transformResolver;
    private NodePropertyApplier propertyApplier;
    private ComponentResolver resolver;
    private ImportDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        transformResolver = new TransformResolver();
        propertyApplier = new NodePropertyApplier("Assets/Figma");
        resolver = new ComponentResolver(transformResolver, propertyApplier, true);
        diagnostics = new ImportDiagnostics();
    }

    private ComponentRegistry generateAndInstantiate(DesignDocument document) {
        DocumentIndex index = DocumentIndex.build(document.getDocument());
        List<DocumentNode> pages = DocumentQueries.pageNodes(document.getDocument());
        SceneGenerator generator = new SceneGenerator(transformResolver, propertyApplier, true, "Assets/Figma");
        ComponentRegistry registry = generator.generate(pages, index, ClassificationResult.empty(),
            RenderedImageProvider.none(), diagnostics).getRegistry();
        resolver.instantiateAll(registry, index, ClassificationResult.empty(), diagnostics);
        return registry;
    }

    @Nested
    @DisplayName("missing definitions")
    class MissingDefinitions {

        @Test
        @DisplayName("reports declared and referenced components that have no definition node")
        void findMissingComponentDefinitions_declaredAndReferenced() {
            DesignDocument document = document(page("1:0", "Page",
                component("5:1", "Defined"),
                instance("6:1", "Uses defined", "5:1"),
                instance("6:2", "Uses remote", "9:2"),
                instance("6:3", "Uses remote again", "9:2")));
            document.getComponents().put("5:1", new ComponentDescription("k1", "Defined", ""));
            document.getComponents().put("9:1", new ComponentDescription("k2", "Library only", ""));

            List<String> missing = resolver.findMissingComponentDefinitions(document,
                DocumentQueries.pageNodes(document.getDocument()));

            assertThat(missing).containsExactly("9:1", "9:2");
        }

        @Test
        @DisplayName("promotes exactly one instance and points the others at it")
        void replaceMissingComponents_promotesFirstInstance() {
            DocumentNode first = instance("6:1", "Chip", "9:9");
            DocumentNode second = instance("6:2", "Chip", "9:9");
            DesignDocument document = document(page("1:0", "Page", frame("2:1", "Screen", first, second)));
            DocumentIndex index = DocumentIndex.build(document.getDocument());
            List<DocumentNode> pages = DocumentQueries.pageNodes(document.getDocument());

            List<String> promoted = resolver.replaceMissingComponents(index, pages, Set.of("9:9"), diagnostics);

            assertThat(promoted).containsExactly("6:1");
            DocumentNode definition = index.lookup("6:1").orElseThrow();
            DocumentNode other = index.lookup("6:2").orElseThrow();
            assertThat(definition.getType()).isEqualTo(NodeType.COMPONENT);
            assertThat(other.getType()).isEqualTo(NodeType.INSTANCE);
            assertThat(other.getComponentId()).isEqualTo("6:1");
            assertThat(DocumentQueries.findAllOfType(document.getDocument(), NodeType.COMPONENT))
                .extracting(DocumentNode::getId)
                .containsExactly("6:1");
            assertThat(entriesFor(diagnostics, Category.MISSING_COMPONENT)).hasSize(1);
        }

        @Test
        @DisplayName("ids without any instance are left alone")
        void replaceMissingComponents_noInstances() {
            DesignDocument document = document(page("1:0", "Page"));
            DocumentIndex index = DocumentIndex.build(document.getDocument());

            List<String> promoted = resolver.replaceMissingComponents(index,
                DocumentQueries.pageNodes(document.getDocument()), Set.of("9:9"), diagnostics);

            assertThat(promoted).isEmpty();
        }
    }

    @Nested
    @DisplayName("instantiation")
    class Instantiation {

        private DesignDocument document;

        @BeforeEach
        void setUp() {
            DocumentNode button = placed(component("5:1", "Button", text("5:2", "Label", "Default")), 0, 0, 120, 40);
            DocumentNode submit = placed(instance("6:1", "Submit", "5:1", text("I6:1;5:2", "Label", "Sign in")), 20, 200, 120, 40);
            DocumentNode login = placed(frame("2:1", "Login", submit), 0, 0, 375, 812);
            document = document(
                page("1:0", "Components", button),
                page("1:1", "Screens", login));
        }

        @Test
        @DisplayName("replaces placeholders with copies of the component carrying the instance's own properties")
        void instantiateAll_expandsInstances() {
            ComponentRegistry registry = generateAndInstantiate(document);

            GeneratedNode screen = template(registry, "Screens/Login");
            GeneratedNode submit = childByPath(screen, "Submit").orElseThrow();
            assertThat(submit.getComponentRef()).isEqualTo("5:1");
            assertThat(submit.getAssetRef()).isEqualTo("Components/Button");
            assertThat(submit.getNodeId()).isEqualTo("6:1");
            assertThat(submit.isPlaceholder()).isFalse();

            GeneratedNode label = childByPath(submit, "Label").orElseThrow();
            assertThat(label.component(NodeComponent.TEXT).getString("characters")).isEqualTo("Sign in");

            GeneratedNode template = template(registry, "Components/Button");
            assertThat(childByPath(template, "Label").orElseThrow()
                .component(NodeComponent.TEXT).getString("characters")).isEqualTo("Default");
        }

        @Test
        @DisplayName("screens on a page are copies of the expanded screen root")
        void instantiateAll_pagesReferenceScreens() {
            ComponentRegistry registry = generateAndInstantiate(document);

            GeneratedNode page = template(registry, "Pages/Screens");
            GeneratedNode login = childByPath(page, "Login").orElseThrow();
            assertThat(login.getAssetRef()).isEqualTo("Screens/Login");
            assertThat(login.getComponentRef()).isNull();
            assertThat(childByPath(login, "Submit", "Label")).isPresent();
        }

        @Test
        @DisplayName("a component containing itself is reported and left unexpanded")
        void instantiateAll_breaksCycles() {
            DocumentNode loop = component("7:1", "Loop", instance("7:2", "Nested loop", "7:1"));
            DesignDocument cyclic = document(page("1:0", "Page", loop));

            ComponentRegistry registry = generateAndInstantiate(cyclic);

            GeneratedNode template = template(registry, "Components/Loop");
            assertThat(childByPath(template, "Nested loop").orElseThrow().isPlaceholder()).isTrue();
            assertThat(entriesFor(diagnostics, Category.MISSING_COMPONENT)).isNotEmpty();
        }

        @Test
        @DisplayName("placeholders without a generated component are counted when markers are removed")
        void removePlaceholderMarkers_countsUnresolved() {
            DesignDocument orphaned = document(page("1:0", "Page", frame("2:1", "Screen", instance("6:1", "Ghost", "9:9"))));
            ComponentRegistry registry = generateAndInstantiate(orphaned);

            int unresolved = resolver.removePlaceholderMarkers(registry.roots());

            assertThat(unresolved).isEqualTo(2);
            assertThat(registry.roots()).allSatisfy(root ->
                assertThat(TreeUtils.preOrder(root.getTree())).noneMatch(GeneratedNode::isPlaceholder));
        }
    }
}
