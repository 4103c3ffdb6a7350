package org.tesis.floorplan;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinateEvaluatorTest {

    private final FloorplanConfig cfg = FloorplanConfig.defaults();

    private SliceNode evaluated(String input) {
        SliceNode root = new SlicingTreeBuilder(cfg).build(SliceTokenReader.readAll(input, cfg));
        DimensionEvaluator.evaluate(root);
        return root;
    }

    @Test
    void horizontalCut_placesRightChildBelowLeft() {
        SliceNode root = evaluated("1(3,4)\n2(5,2)\nH\n");

        CutNode cut = (CutNode) root;
        assertThat(((LeafBlock) cut.left()).isPlaced()).isFalse();

        CoordinateEvaluator.place(root, 0, 0);

        assertThat(((LeafBlock) cut.left()).isPlaced()).isTrue();
        assertThat(((LeafBlock) cut.right()).isPlaced()).isTrue();
        assertThat(PlacementWriter.write(root)).containsExactly("1((3,4)(0,2))", "2((5,2)(0,0))");
    }

    @Test
    void verticalCut_placesRightChildAfterLeft() {
        SliceNode root = evaluated("1(3,4)\n2(5,2)\nV\n");

        CoordinateEvaluator.place(root, 0, 0);

        assertThat(PlacementWriter.write(root)).containsExactly("1((3,4)(0,0))", "2((5,2)(3,0))");
    }

    @Test
    void origin_shiftsEveryLeaf() {
        SliceNode root = evaluated("1(3,4)\n2(5,2)\nV\n");

        CoordinateEvaluator.place(root, 10, -5);

        assertThat(PlacementWriter.write(root)).containsExactly("1((3,4)(10,-5))", "2((5,2)(13,-5))");
    }

    @Test
    void nestedCuts_useEnclosingDimensionsOfSubtrees() {
        // V( H(1,2), H(3,4) ): el subárbol izquierdo mide 4 de ancho
        SliceNode root = evaluated("1(4,1)\n2(2,3)\nH\n3(1,1)\n4(1,1)\nH\nV\n");

        CoordinateEvaluator.place(root, 0, 0);

        assertThat(PlacementWriter.write(root)).containsExactly(
                "1((4,1)(0,3))", "2((2,3)(0,0))", "3((1,1)(4,1))", "4((1,1)(4,0))");
    }

    @Test
    void leavesTileTheRootWithoutOverlap() {
        String input = String.join("\n",
                "1(2,2)", "2(2,2)", "V", "3(4,4)", "H",
                "4(1,3)", "5(1,3)", "H", "6(1,6)", "V", "V", "");
        SliceNode root = evaluated(input);
        CoordinateEvaluator.place(root, 0, 0);

        LayoutChecker.LayoutCheck check = LayoutChecker.check(root, 0, 0);
        assertThat(check.isValid()).isTrue();
        assertThat(check.uncoveredArea()).isZero();

        Geometry union = LayoutChecker.coverage(root, new GeometryFactory());
        Geometry bounds = new GeometryFactory().toGeometry(LayoutChecker.rootEnvelope(root, 0, 0));
        assertThat(union.equalsTopo(bounds)).isTrue();
    }

    @Test
    void placementBeforeDimensions_isRejected() {
        SliceNode root = new SlicingTreeBuilder(cfg).build(List.of(
                SliceToken.leaf(1, 1, 1), SliceToken.leaf(2, 1, 1), SliceToken.cut(Orientation.HORIZONTAL)));

        assertThatThrownBy(() -> CoordinateEvaluator.place(root, 0, 0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void placementDump_requiresCoordinates() {
        SliceNode root = evaluated("1(3,4)\n2(5,2)\nV\n");

        assertThatThrownBy(() -> PlacementWriter.write(root)).isInstanceOf(IllegalStateException.class);
    }
}
