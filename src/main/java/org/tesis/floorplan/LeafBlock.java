package org.tesis.floorplan;

// bloque físico: tamaño propio fijo y, tras la colocación, su esquina inferior izquierda
public final class LeafBlock extends SliceNode {
    final int label;
    final int width, height;
    int x, y;
    boolean placed;

    LeafBlock(int label, int width, int height) {
        this.label = label;
        this.width = width;
        this.height = height;
    }

    public int label() { return label; }

    @Override public int width() { return width; }

    @Override public int height() { return height; }

    public int x() { return x; }

    public int y() { return y; }

    public boolean isPlaced() { return placed; }

    @Override public String toString() {
        return label + "(" + width + "," + height + ")";
    }
}
