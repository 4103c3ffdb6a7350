package org.tesis.floorplan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Reconstruye el árbol cuyo recorrido postorden es la secuencia de tokens, usando una pila de subárboles.
 */
public class SlicingTreeBuilder {

    private final int maxNodes;

    public SlicingTreeBuilder(FloorplanConfig cfg) {
        this.maxNodes = cfg.maxNodes;
    }

    public SliceNode build(Iterable<SliceToken> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return build(tokens.iterator());
    }

    // hoja -> push; corte -> pop derecho, pop izquierdo, push del corte
    public SliceNode build(Iterator<SliceToken> tokens) {
        Deque<SliceNode> stack = new ArrayDeque<>();
        int count = 0;
        int position = 0;

        while (tokens.hasNext()) {
            SliceToken t = tokens.next();
            position++;
            if (++count > maxNodes) {
                throw FloorplanException.capacity("El árbol supera el máximo de " + maxNodes + " nodos");
            }
            if (t instanceof SliceToken.Leaf leaf) {
                stack.push(new LeafBlock(leaf.label, leaf.width, leaf.height));
            } else if (t instanceof SliceToken.Cut cut) {
                if (stack.size() < 2) {
                    throw FloorplanException.structure("Corte " + cut.orientation.marker() + " en el token "
                            + position + where(t) + " con " + stack.size() + " subárbol(es) disponibles, se necesitan 2");
                }
                SliceNode right = stack.pop();
                SliceNode left = stack.pop();
                stack.push(new CutNode(cut.orientation, left, right));
            } else {
                throw new IllegalArgumentException("Token desconocido: " + t);
            }
        }

        if (stack.isEmpty()) {
            throw FloorplanException.structure("Entrada vacía: no hay raíz");
        }
        if (stack.size() > 1) {
            throw FloorplanException.structure("La secuencia deja " + stack.size()
                    + " subárboles sueltos en lugar de un único árbol");
        }
        return stack.pop();
    }

    private static String where(SliceToken t) {
        return t.line > 0 ? " (línea " + t.line + ")" : "";
    }
}
