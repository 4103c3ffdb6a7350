package org.tesis.floorplan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LayoutCheckerTest {

    private static SliceNode placedTree(String input) {
        FloorplanConfig cfg = FloorplanConfig.defaults();
        SliceNode root = new SlicingTreeBuilder(cfg).build(SliceTokenReader.readAll(input, cfg));
        DimensionEvaluator.evaluate(root);
        CoordinateEvaluator.place(root, 0, 0);
        return root;
    }

    @Test
    void evaluatedLayout_hasNoOverlapsAndReportsGaps() {
        SliceNode root = placedTree("1(3,4)\n2(5,2)\nH\n");

        LayoutChecker.LayoutCheck check = LayoutChecker.check(root, 0, 0);

        assertThat(check.isValid()).isTrue();
        assertThat(check.rootArea()).isEqualTo(30.0);
        assertThat(check.leafArea()).isEqualTo(22.0);
        assertThat(check.uncoveredArea()).isEqualTo(8.0);
    }

    @Test
    void overlappingLeaves_areDetected() {
        SliceNode root = placedTree("1(3,4)\n2(5,2)\nV\n");
        CutNode v = (CutNode) root;
        ((LeafBlock) v.right()).x = 1;

        LayoutChecker.LayoutCheck check = LayoutChecker.check(root, 0, 0);

        assertThat(check.isValid()).isFalse();
        assertThat(check.overlaps()).containsExactly("1/2");
    }

    @Test
    void leafOutsideRoot_isDetected() {
        SliceNode root = placedTree("1(3,4)\n2(5,2)\nV\n");
        ((LeafBlock) ((CutNode) root).right()).y = 3;

        LayoutChecker.LayoutCheck check = LayoutChecker.check(root, 0, 0);

        assertThat(check.outside()).containsExactly(2);
    }

    @Test
    void touchingEdges_areNotOverlaps() {
        SliceNode root = placedTree("1(1,1)\n2(1,1)\nV\n3(2,1)\nH\n");

        assertThat(LayoutChecker.check(root, 0, 0).overlaps()).isEmpty();
    }
}
