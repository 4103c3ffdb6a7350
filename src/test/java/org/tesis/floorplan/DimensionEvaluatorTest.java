package org.tesis.floorplan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionEvaluatorTest {

    private static SliceNode tree(Orientation o, SliceToken.Leaf l, SliceToken.Leaf r) {
        return new SlicingTreeBuilder(FloorplanConfig.defaults()).build(List.of(l, r, SliceToken.cut(o)));
    }

    @Test
    void horizontalCut_takesMaxWidthAndSumsHeights() {
        SliceNode root = tree(Orientation.HORIZONTAL, SliceToken.leaf(1, 3, 4), SliceToken.leaf(2, 5, 2));
        assertThat(((CutNode) root).isEvaluated()).isFalse();

        DimensionEvaluator.evaluate(root);

        assertThat(((CutNode) root).isEvaluated()).isTrue();
        assertThat(root.width()).isEqualTo(5);
        assertThat(root.height()).isEqualTo(6);
    }

    @Test
    void verticalCut_sumsWidthsAndTakesMaxHeight() {
        SliceNode root = tree(Orientation.VERTICAL, SliceToken.leaf(1, 3, 4), SliceToken.leaf(2, 5, 2));

        DimensionEvaluator.evaluate(root);

        assertThat(root.width()).isEqualTo(8);
        assertThat(root.height()).isEqualTo(4);
    }

    @Test
    void leavesKeepTheirParsedDimensions() {
        String input = "1(3,4)\n2(5,2)\nH\n3(7,1)\nV\n";
        SliceNode root = new SlicingTreeBuilder(FloorplanConfig.defaults())
                .build(SliceTokenReader.readAll(input, FloorplanConfig.defaults()));

        DimensionEvaluator.evaluate(root);

        assertThat(DimensionWriter.write(root))
                .containsExactly("1(3,4)", "2(5,2)", "H(5,6)", "3(7,1)", "V(12,6)");
    }

    @Test
    void cutDimensions_areUnavailableBeforeEvaluation() {
        SliceNode root = tree(Orientation.VERTICAL, SliceToken.leaf(1, 3, 4), SliceToken.leaf(2, 5, 2));

        assertThatThrownBy(root::width).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> DimensionWriter.write(root)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void overflow_isCapacityError() {
        SliceNode root = tree(Orientation.VERTICAL,
                SliceToken.leaf(1, Integer.MAX_VALUE, 1), SliceToken.leaf(2, 1, 1));

        assertThatThrownBy(() -> DimensionEvaluator.evaluate(root))
                .isInstanceOf(FloorplanException.class)
                .extracting(e -> ((FloorplanException) e).kind())
                .isEqualTo(FloorplanException.Kind.CAPACITY);
    }
}
