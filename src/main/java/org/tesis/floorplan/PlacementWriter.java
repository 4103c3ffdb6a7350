package org.tesis.floorplan;

import java.util.ArrayList;
import java.util.List;

// una línea por hoja, en preorden: label((width,height)(x,y)); los cortes no se escriben
public final class PlacementWriter {

    private PlacementWriter() {}

    public static List<String> write(SliceNode root) {
        List<String> out = new ArrayList<>();
        SliceTraversal.preorder(root, n -> {
            if (n instanceof LeafBlock leaf) out.add(format(leaf));
        });
        return out;
    }

    static String format(LeafBlock leaf) {
        if (!leaf.placed) {
            throw new IllegalStateException("La hoja " + leaf.label + " aún no tiene coordenadas");
        }
        return leaf.label + "((" + leaf.width + "," + leaf.height + ")(" + leaf.x + "," + leaf.y + "))";
    }

    // hojas en el mismo orden que el volcado
    static List<LeafBlock> leaves(SliceNode root) {
        List<LeafBlock> out = new ArrayList<>();
        SliceTraversal.preorder(root, n -> {
            if (n instanceof LeafBlock leaf) out.add(leaf);
        });
        return out;
    }
}
