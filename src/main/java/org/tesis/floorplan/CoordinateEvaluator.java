package org.tesis.floorplan;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Asigna a cada hoja su esquina inferior izquierda absoluta, de arriba hacia abajo.
 * En un corte H el hijo derecho va abajo y el izquierdo encima; en un corte V el izquierdo va a la
 * izquierda y el derecho a continuación. Requiere que {@link DimensionEvaluator} ya haya corrido.
 */
public final class CoordinateEvaluator {

    private CoordinateEvaluator() {}

    private static final class Frame {
        final SliceNode node;
        final int x, y;

        Frame(SliceNode node, int x, int y) {
            this.node = node;
            this.x = x;
            this.y = y;
        }
    }

    public static void place(SliceNode root, int originX, int originY) {
        if (root == null) return;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, originX, originY));
        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (f.node instanceof LeafBlock leaf) {
                leaf.x = f.x;
                leaf.y = f.y;
                leaf.placed = true;
            } else if (f.node instanceof CutNode c) {
                c.requireEvaluated();
                // se apila primero el derecho para visitar self, left, right
                if (c.orientation == Orientation.HORIZONTAL) {
                    stack.push(new Frame(c.right, f.x, f.y));
                    stack.push(new Frame(c.left, f.x, offset(f.y, c.right.height())));
                } else {
                    stack.push(new Frame(c.right, offset(f.x, c.left.width()), f.y));
                    stack.push(new Frame(c.left, f.x, f.y));
                }
            }
        }
    }

    private static int offset(int base, int delta) {
        try {
            return Math.addExact(base, delta);
        } catch (ArithmeticException e) {
            throw new FloorplanException(FloorplanException.Kind.CAPACITY, "Coordenada fuera del rango de int", e);
        }
    }
}
