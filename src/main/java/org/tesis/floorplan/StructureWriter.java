package org.tesis.floorplan;

import java.util.ArrayList;
import java.util.List;

// volcado preorden de la estructura: hojas con su tamaño original, cortes sólo con H / V
public final class StructureWriter {

    private StructureWriter() {}

    public static List<String> write(SliceNode root) {
        List<String> out = new ArrayList<>();
        SliceTraversal.preorder(root, n -> out.add(format(n)));
        return out;
    }

    static String format(SliceNode n) {
        if (n instanceof LeafBlock leaf) {
            return leaf.label + "(" + leaf.width + "," + leaf.height + ")";
        }
        return String.valueOf(((CutNode) n).orientation.marker());
    }
}
