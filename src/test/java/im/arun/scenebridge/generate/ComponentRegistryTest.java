package im.arun.scenebridge.generate;

import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.LogicalRoot;
import im.arun.scenebridge.model.RootKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ComponentRegistry")
class ComponentRegistryTest {

    private ComponentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ComponentRegistry();
    }

    private LogicalRoot register(RootKind kind, String sourceId, String name) {
        LogicalRoot root = registry.allocateRoot(kind, name);
        registry.register(sourceId, root, new GeneratedNode(sourceId, name));
        return root;
    }

    @Test
    @DisplayName("a suffixed duplicate never collides with a node already named like the suffix")
    void allocateRoot_suffixDoesNotCollide() {
        register(RootKind.COMPONENT, "1:1", "Button");
        register(RootKind.COMPONENT, "1:2", "Button");
        register(RootKind.COMPONENT, "1:3", "Button_1");

        assertThat(registry.roots()).extracting(GeneratedRoot::key)
            .containsExactly("Components/Button", "Components/Button_1", "Components/Button_1_1");
        assertThat(registry.instantiate("Components/Button_1")).map(GeneratedNode::getNodeId).contains("1:2");
        assertThat(registry.instantiate("Components/Button_1_1")).map(GeneratedNode::getNodeId).contains("1:3");
    }

    @Test
    @DisplayName("names that sanitize to the same file name get distinct keys")
    void allocateRoot_sanitizedNamesStayDistinct() {
        LogicalRoot slash = register(RootKind.SCREEN, "2:1", "A/B");
        LogicalRoot colon = register(RootKind.SCREEN, "2:2", "A:B");

        assertThat(slash.key()).isEqualTo("Screens/A_B");
        assertThat(colon.key()).isEqualTo("Screens/A_B_1");
    }

    @Test
    @DisplayName("each slot numbers its duplicates independently")
    void allocateRoot_perKind() {
        assertThat(register(RootKind.COMPONENT, "1:1", "Login").key()).isEqualTo("Components/Login");
        assertThat(register(RootKind.SCREEN, "2:1", "Login").key()).isEqualTo("Screens/Login");
        assertThat(register(RootKind.SCREEN, "2:2", "Login").key()).isEqualTo("Screens/Login_1");
    }

    @Test
    @DisplayName("instances are tagged with their asset and pages are never instantiated")
    void instantiate_tagsAssetRef() {
        register(RootKind.COMPONENT, "1:1", "Button");
        register(RootKind.PAGE, "0:1", "Cover");

        GeneratedNode instance = registry.instantiate("Components/Button").orElseThrow();

        assertThat(instance.getAssetRef()).isEqualTo("Components/Button");
        assertThat(instance.getComponentRef()).isEqualTo("1:1");
        assertThat(registry.instantiate("Pages/Cover")).isEmpty();
        assertThat(registry.instantiate("Components/Unknown")).isEmpty();
    }
}
