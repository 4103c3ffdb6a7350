package org.tesis.floorplan;

/**
 * Nodo del árbol de cortes. Es una hoja ({@link LeafBlock}) o un corte ({@link CutNode}) con dos hijos.
 * La forma del árbol queda fija al construirlo; los evaluadores sólo cambian dimensiones y coordenadas.
 */
public abstract class SliceNode {

    SliceNode() {}

    public abstract int width();

    public abstract int height();

    public boolean isLeaf() {
        return this instanceof LeafBlock;
    }
}
