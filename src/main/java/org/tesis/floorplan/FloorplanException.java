package org.tesis.floorplan;

// error fatal de la corrida: entrada mal formada, postorden que no reduce a un árbol, o límites excedidos
public class FloorplanException extends IllegalStateException {

    public enum Kind { PARSE, STRUCTURE, CAPACITY }

    private final Kind kind;

    public FloorplanException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FloorplanException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static FloorplanException parse(int line, String message) {
        return new FloorplanException(Kind.PARSE, "Línea " + line + ": " + message);
    }

    static FloorplanException structure(String message) {
        return new FloorplanException(Kind.STRUCTURE, message);
    }

    static FloorplanException capacity(String message) {
        return new FloorplanException(Kind.CAPACITY, message);
    }
}
