package com.designtool.lowering.detection;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.model.detection.ListHint;
import com.designtool.lowering.model.detection.ListOrientation;
import com.designtool.lowering.model.ir.ButtonIr;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutType;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ListDetector.
 */
class ListDetectorTest {

    private final ListDetector detector = new ListDetector();

    @Test
    void testVerticalListOfNamedRows() {
        IrNode root = container("root", "Orders", LayoutType.COLUMN,
                row("r1", "Order Row 1", 60),
                row("r2", "Order Row 2", 62),
                row("r3", "Order Row 3", 58));

        List<ListHint> hints = detector.detect(root);

        assertThat(hints).hasSize(1);
        ListHint hint = hints.get(0);
        assertThat(hint.getContainerId()).isEqualTo("root");
        assertThat(hint.getItemIds()).containsExactly("r1", "r2", "r3");
        assertThat(hint.getOrientation()).isEqualTo(ListOrientation.VERTICAL);
        assertThat(hint.getItemType()).isEqualTo("OrderRowItem");
    }

    @Test
    void testHorizontalListOfGenericCards() {
        IrNode root = container("root", "Carousel", LayoutType.ROW,
                card("c1", "Frame 1"),
                card("c2", "Frame 2"),
                card("c3", "Frame 3"),
                card("c4", "Frame 4"));

        List<ListHint> hints = detector.detect(root);

        assertThat(hints).singleElement().satisfies(hint -> {
            assertThat(hint.getOrientation()).isEqualTo(ListOrientation.HORIZONTAL);
            assertThat(hint.getItemType()).isEqualTo("CardItem");
        });
    }

    @Test
    void testTwoItemsAreNotAList() {
        IrNode root = container("root", "Orders", LayoutType.COLUMN,
                row("r1", "Row 1", 60),
                row("r2", "Row 2", 60));

        assertThat(detector.detect(root)).isEmpty();
    }

    @Test
    void testSizeOutsideToleranceIsNotAList() {
        IrNode root = container("root", "Orders", LayoutType.COLUMN,
                row("r1", "Row 1", 60),
                row("r2", "Row 2", 60),
                row("r3", "Row 3", 90));

        assertThat(detector.detect(root)).isEmpty();
    }

    @Test
    void testDifferentStructureIsNotAList() {
        IrNode odd = ContainerIr.builder().id("r3").name("Row 3").boundingBox(box(0, 0, 300, 60))
                .layout(layout(LayoutType.ROW))
                .children(List.of(text("r3a", "Only one")))
                .build();
        IrNode root = container("root", "Orders", LayoutType.COLUMN,
                row("r1", "Row 1", 60), row("r2", "Row 2", 60), odd);

        assertThat(detector.detect(root)).isEmpty();
    }

    @Test
    void testNestedListsInsideItemsAreNotReported() {
        IrNode inner = container("inner", "Tags", LayoutType.ROW,
                button("t1", "Tag 1"), button("t2", "Tag 2"), button("t3", "Tag 3"));
        IrNode root = container("root", "Screen", LayoutType.COLUMN,
                container("section", "Section", LayoutType.COLUMN, inner));

        List<ListHint> hints = detector.detect(root);

        assertThat(hints).singleElement().satisfies(hint -> {
            assertThat(hint.getContainerId()).isEqualTo("inner");
            assertThat(hint.getItemType()).isEqualTo("TagItem");
        });
    }

    @Test
    void testItemTypeFallbacks() {
        assertThat(ListDetector.itemType(button("b", "Frame 7"))).isEqualTo("ButtonItem");
        assertThat(ListDetector.itemType(container("c", "Group 2", LayoutType.ROW))).isEqualTo("ListItem");
        assertThat(ListDetector.itemType(TextIr.builder().id("t").name("Text 5").text("x").build())).isEqualTo("Item");
        assertThat(ListDetector.itemType(container("c", "Menu Item 4", LayoutType.ROW))).isEqualTo("MenuItem");
    }

    private static IrNode container(String id, String name, LayoutType type, IrNode... children) {
        return ContainerIr.builder().id(id).name(name).boundingBox(box(0, 0, 300, 300))
                .layout(layout(type)).children(List.of(children)).build();
    }

    private static IrNode row(String id, String name, double height) {
        return ContainerIr.builder().id(id).name(name).boundingBox(box(0, 0, 300, height))
                .layout(layout(LayoutType.ROW))
                .children(List.of(text(id + "a", "Title"), text(id + "b", "Subtitle")))
                .build();
    }

    private static IrNode card(String id, String name) {
        return CardIr.builder().id(id).name(name).boundingBox(box(0, 0, 160, 200))
                .layout(layout(LayoutType.COLUMN))
                .children(List.of(text(id + "a", "Title")))
                .build();
    }

    private static IrNode button(String id, String name) {
        return ButtonIr.builder().id(id).name(name).boundingBox(box(0, 0, 80, 32)).label(name).build();
    }

    private static IrNode text(String id, String value) {
        return TextIr.builder().id(id).name("Label").boundingBox(box(0, 0, 100, 20)).text(value).build();
    }

    private static LayoutMeta layout(LayoutType type) {
        return LayoutMeta.emptyColumn().toBuilder().type(type).build();
    }
}
