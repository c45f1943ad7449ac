package im.arun.scenebridge.model;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NodeComponent")
class NodeComponentTest {

    @Test
    @DisplayName("null, empty, zero and false count as default")
    void isDefaultValue_recognisesDefaults() {
        assertThat(NodeComponent.isDefaultValue(null)).isTrue();
        assertThat(NodeComponent.isDefaultValue("")).isTrue();
        assertThat(NodeComponent.isDefaultValue(0)).isTrue();
        assertThat(NodeComponent.isDefaultValue(0.0)).isTrue();
        assertThat(NodeComponent.isDefaultValue(false)).isTrue();
        assertThat(NodeComponent.isDefaultValue(List.of())).isTrue();
        assertThat(NodeComponent.isDefaultValue(Map.of())).isTrue();

        assertThat(NodeComponent.isDefaultValue("x")).isFalse();
        assertThat(NodeComponent.isDefaultValue(0.1)).isFalse();
        assertThat(NodeComponent.isDefaultValue(true)).isFalse();
    }

    @Test
    @DisplayName("assign accepts any number for a numeric field")
    void assign_numbersAreInterchangeable() {
        NodeComponent image = new NodeComponent(NodeComponent.IMAGE).with("opacity", 1.0);

        image.assign("opacity", 1);

        assertThat(image.getNumber("opacity")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("assign rejects a value of a different type")
    void assign_rejectsTypeMismatch() {
        NodeComponent text = new NodeComponent(NodeComponent.TEXT).with("characters", "Hi");

        assertThatThrownBy(() -> text.assign("characters", 3))
            .isInstanceOf(FieldCopyException.class)
            .hasMessageContaining("Text.characters");
        assertThat(text.getString("characters")).isEqualTo("Hi");
    }

    @Test
    @DisplayName("deepCopy shares no nested collections with the source")
    void deepCopy_copiesNestedValues() {
        List<Object> keyframes = new ArrayList<>(List.of(0, 1));
        NodeComponent animator = new NodeComponent("Animator").with("keyframes", keyframes);

        NodeComponent copy = animator.deepCopy();
        keyframes.add(2);

        assertThat(copy.get("keyframes")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly(0, 1);
        assertThat(copy).isNotSameAs(animator);
    }
}
