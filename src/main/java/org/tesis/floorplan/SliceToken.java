package org.tesis.floorplan;

import java.util.Objects;

/**
 * Un token de la serialización postorden: una hoja {@code label(width,height)} o un corte {@code H}/{@code V}.
 */
public abstract class SliceToken {

    final int line;   // línea de origen (1-based), 0 si el token se creó a mano

    private SliceToken(int line) {
        this.line = line;
    }

    public int line() {
        return line;
    }

    public static Leaf leaf(int label, int width, int height) {
        return new Leaf(label, width, height, 0);
    }

    public static Cut cut(Orientation orientation) {
        return new Cut(orientation, 0);
    }

    public static final class Leaf extends SliceToken {
        final int label;
        final int width, height;

        Leaf(int label, int width, int height, int line) {
            super(line);
            this.label = label;
            this.width = width;
            this.height = height;
        }

        @Override public boolean equals(Object o) {
            if (!(o instanceof Leaf l)) return false;
            return label == l.label && width == l.width && height == l.height;
        }

        @Override public int hashCode() {
            return Objects.hash(label, width, height);
        }

        @Override public String toString() {
            return label + "(" + width + "," + height + ")";
        }
    }

    public static final class Cut extends SliceToken {
        final Orientation orientation;

        Cut(Orientation orientation, int line) {
            super(line);
            this.orientation = Objects.requireNonNull(orientation, "orientation");
        }

        @Override public boolean equals(Object o) {
            return o instanceof Cut c && orientation == c.orientation;
        }

        @Override public int hashCode() {
            return orientation.hashCode();
        }

        @Override public String toString() {
            return String.valueOf(orientation.marker());
        }
    }
}
