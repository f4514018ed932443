package com.designtool.lowering.recognize;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.RawNode;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for grouping repeated siblings.
 */
class RepeaterGrouperTest {

    private final RepeaterGrouper grouper = new RepeaterGrouper();

    @Test
    void testContiguousSameNamedSiblingsFormOneRun() {
        LayoutNode list = layoutOf(frame("1", "List", box(0, 0, 300, 200),
                item("2", "Item 1", 0),
                item("3", "Item 2", 60),
                item("4", "Item 3", 120),
                text("5", "Footer", "More", box(0, 180, 100, 20))));

        List<List<LayoutNode>> runs = grouper.group(list.getChildren());

        assertThat(runs).hasSize(2);
        assertThat(runs.get(0)).extracting(LayoutNode::getId).containsExactly("2", "3", "4");
        assertThat(runs.get(1)).extracting(LayoutNode::getId).containsExactly("5");
    }

    @Test
    void testDifferentShapesBreakTheRun() {
        RawNode odd = frame("3", "Item 2", box(0, 60, 300, 50), text("3a", "Title", "x", box(0, 60, 100, 20)));
        LayoutNode list = layoutOf(frame("1", "List", box(0, 0, 300, 200), item("2", "Item 1", 0), odd));

        assertThat(grouper.group(list.getChildren())).hasSize(2);
    }

    @Test
    void testShortBaseNamesDoNotGroup() {
        LayoutNode list = layoutOf(frame("1", "List", box(0, 0, 300, 200),
                item("2", "A1", 0),
                item("3", "A2", 60)));

        assertThat(grouper.group(list.getChildren())).hasSize(2);
    }

    @Test
    void testSharedComponentIdGroupsDifferentlyNamedInstances() {
        NodeProperties instance = NodeProperties.builder().componentId("42:1").build();
        LayoutNode list = layoutOf(frame("1", "List", box(0, 0, 300, 200),
                node("2", "Visa card", NodeType.INSTANCE, box(0, 0, 300, 50), instance),
                node("3", "Mir card", NodeType.INSTANCE, box(0, 60, 300, 50), instance)));

        assertThat(grouper.group(list.getChildren())).hasSize(1);
    }

    @Test
    void testBaseName() {
        assertThat(RepeaterGrouper.baseName(layoutOf(rect("1", "Row 12", box(0, 0, 10, 10))))).isEqualTo("Row");
    }

    private static RawNode item(String id, String name, double y) {
        return frame(id, name, box(0, y, 300, 50),
                text(id + "t", "Title", "Title " + id, box(0, y, 100, 20)),
                text(id + "s", "Subtitle", "Sub " + id, box(0, y + 25, 100, 20)));
    }
}
