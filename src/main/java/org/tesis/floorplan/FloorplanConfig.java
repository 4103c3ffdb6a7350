package org.tesis.floorplan;

// parámetros de la corrida; los valores por defecto son los que usa la línea de comandos
public class FloorplanConfig {
    int maxLineLength = 64;       // largo máximo de una línea de entrada (sin el salto)
    int maxNodes      = 100_000;  // nodos (hojas + cortes) admitidos en un árbol
    int originX       = 0;        // esquina inferior izquierda de la raíz
    int originY       = 0;

    public static FloorplanConfig defaults() {
        return new FloorplanConfig();
    }

    public FloorplanConfig maxLineLength(int v) {
        if (v <= 0) throw new IllegalArgumentException("maxLineLength debe ser > 0: " + v);
        this.maxLineLength = v;
        return this;
    }

    public FloorplanConfig maxNodes(int v) {
        if (v <= 0) throw new IllegalArgumentException("maxNodes debe ser > 0: " + v);
        this.maxNodes = v;
        return this;
    }

    public FloorplanConfig origin(int x, int y) {
        this.originX = x;
        this.originY = y;
        return this;
    }
}
