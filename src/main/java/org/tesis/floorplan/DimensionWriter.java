package org.tesis.floorplan;

import java.util.ArrayList;
import java.util.List;

// volcado postorden de las dimensiones ya evaluadas de cada nodo
public final class DimensionWriter {

    private DimensionWriter() {}

    public static List<String> write(SliceNode root) {
        List<String> out = new ArrayList<>();
        SliceTraversal.postorder(root, n -> out.add(format(n)));
        return out;
    }

    static String format(SliceNode n) {
        if (n instanceof LeafBlock leaf) {
            return leaf.label + "(" + leaf.width + "," + leaf.height + ")";
        }
        CutNode c = (CutNode) n;
        c.requireEvaluated();
        return c.orientation.marker() + "(" + c.width + "," + c.height + ")";
    }
}
