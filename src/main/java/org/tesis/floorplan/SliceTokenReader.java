package org.tesis.floorplan;

import java.io.*;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lee la serialización postorden línea por línea y entrega un token por cada línea no vacía.
 * <p>
 * El iterador es perezoso y no se puede reiniciar: cada {@code next()} consume del lector subyacente.
 * Los errores de lectura se propagan como {@link UncheckedIOException}.
 */
public class SliceTokenReader implements Iterator<SliceToken> {

    // label(width,height), con espacios opcionales alrededor de los números
    private static final Pattern LEAF = Pattern.compile(
            "\\s*([+-]?\\d+)\\s*\\(\\s*([+-]?\\d+)\\s*,\\s*([+-]?\\d+)\\s*\\)\\s*");

    private final BufferedReader in;
    private final int maxLineLength;
    private int lineNo = 0;
    private SliceToken pending;
    private boolean exhausted;

    public SliceTokenReader(Reader in, FloorplanConfig cfg) {
        this.in = (in instanceof BufferedReader br) ? br : new BufferedReader(in);
        this.maxLineLength = cfg.maxLineLength;
    }

    // función para leer un texto completo y devolver la lista de tokens
    public static List<SliceToken> readAll(String text, FloorplanConfig cfg) {
        return drain(new SliceTokenReader(new StringReader(text), cfg));
    }

    private static List<SliceToken> drain(SliceTokenReader r) {
        List<SliceToken> out = new ArrayList<>();
        while (r.hasNext()) out.add(r.next());
        return out;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) pending = advance();
        return pending != null;
    }

    @Override
    public SliceToken next() {
        if (!hasNext()) throw new NoSuchElementException();
        SliceToken t = pending;
        pending = null;
        return t;
    }

    private SliceToken advance() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lineNo++;
                if (line.length() > maxLineLength) {
                    throw FloorplanException.parse(lineNo,
                            "línea de " + line.length() + " caracteres, máximo " + maxLineLength);
                }
                if (line.trim().isEmpty()) continue;
                return parseLine(line, lineNo);
            }
            exhausted = true;
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // convierte una línea en token; la línea no debe estar vacía
    static SliceToken parseLine(String line, int lineNo) {
        Orientation o = Orientation.fromMarker(line.charAt(0));
        if (o != null) return new SliceToken.Cut(o, lineNo);

        Matcher m = LEAF.matcher(line);
        if (!m.matches()) {
            throw FloorplanException.parse(lineNo, "se esperaba H, V o label(width,height): '" + line + "'");
        }
        int label  = parseInt(m.group(1), lineNo, "label");
        int width  = parseInt(m.group(2), lineNo, "width");
        int height = parseInt(m.group(3), lineNo, "height");
        if (width <= 0 || height <= 0) {
            throw FloorplanException.parse(lineNo, "dimensiones no positivas en '" + line.trim() + "'");
        }
        return new SliceToken.Leaf(label, width, height, lineNo);
    }

    static int parseInt(String s, int lineNo, String field) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new FloorplanException(FloorplanException.Kind.PARSE,
                    "Línea " + lineNo + ": " + field + " fuera de rango: " + s, e);
        }
    }
}
