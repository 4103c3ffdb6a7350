package org.tesis.floorplan;

// orientación de un corte: H apila los hijos, V los pone lado a lado
public enum Orientation {
    HORIZONTAL('H'),
    VERTICAL('V');

    private final char marker;

    Orientation(char marker) {
        this.marker = marker;
    }

    public char marker() {
        return marker;
    }

    // devuelve la orientación para 'H' / 'V', o null si el carácter no es un corte
    static Orientation fromMarker(char c) {
        if (c == 'H') return HORIZONTAL;
        if (c == 'V') return VERTICAL;
        return null;
    }
}
