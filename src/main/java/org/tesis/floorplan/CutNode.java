package org.tesis.floorplan;

import java.util.Objects;

// corte interno; width/height son los del rectángulo mínimo que encierra a ambos hijos
public final class CutNode extends SliceNode {
    final Orientation orientation;
    final SliceNode left, right;
    int width, height;
    boolean evaluated;

    CutNode(Orientation orientation, SliceNode left, SliceNode right) {
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Orientation orientation() { return orientation; }

    public SliceNode left() { return left; }

    public SliceNode right() { return right; }

    @Override public int width() {
        requireEvaluated();
        return width;
    }

    @Override public int height() {
        requireEvaluated();
        return height;
    }

    public boolean isEvaluated() { return evaluated; }

    void requireEvaluated() {
        if (!evaluated) {
            throw new IllegalStateException("Dimensiones del corte " + orientation.marker() + " aún no calculadas");
        }
    }

    @Override public String toString() {
        return evaluated ? orientation.marker() + "(" + width + "," + height + ")" : String.valueOf(orientation.marker());
    }
}
