package org.tesis.floorplan;

/**
 * Calcula de abajo hacia arriba el rectángulo mínimo que encierra cada corte.
 * <ul>
 *   <li>H: ancho = max(izq, der), alto = izq + der (hijos apilados)</li>
 *   <li>V: ancho = izq + der, alto = max(izq, der) (hijos lado a lado)</li>
 * </ul>
 */
public final class DimensionEvaluator {

    private DimensionEvaluator() {}

    public static void evaluate(SliceNode root) {
        SliceTraversal.postorder(root, n -> {
            if (n instanceof CutNode c) evaluateCut(c);
        });
    }

    // los hijos ya están evaluados cuando el postorden llega al corte
    static void evaluateCut(CutNode c) {
        int lw = c.left.width(), lh = c.left.height();
        int rw = c.right.width(), rh = c.right.height();
        try {
            if (c.orientation == Orientation.HORIZONTAL) {
                c.width = Math.max(lw, rw);
                c.height = Math.addExact(lh, rh);
            } else {
                c.width = Math.addExact(lw, rw);
                c.height = Math.max(lh, rh);
            }
        } catch (ArithmeticException e) {
            throw new FloorplanException(FloorplanException.Kind.CAPACITY,
                    "Dimensiones del corte " + c.orientation.marker() + " exceden el rango de int", e);
        }
        c.evaluated = true;
    }
}
