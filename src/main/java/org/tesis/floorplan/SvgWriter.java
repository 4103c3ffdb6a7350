package org.tesis.floorplan;

import org.locationtech.jts.geom.*;

import java.util.List;
import java.util.Locale;

class SvgWriter {

    static String toSVG(SliceNode root, int originX, int originY) {
        GeometryFactory gf = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);
        Envelope env = LayoutChecker.rootEnvelope(root, originX, originY);
        double minX = env.getMinX(), minY = env.getMinY(), w = env.getWidth(), h = env.getHeight();

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w))
          .append("\" height=\"").append(fmt(h)).append("\" viewBox=\"")
          .append(fmt(minX)).append(" ").append(fmt(minY)).append(" ").append(fmt(w)).append(" ").append(fmt(h)).append("\">\n");

        // Grupo invertido en Y (SVG tiene Y hacia abajo, la colocación usa esquina inferior izquierda)
        sb.append("  <g transform=\"translate(0,").append(fmt(2 * minY + h)).append(") scale(1,-1)\">\n");

        // Rectángulo de la raíz
        sb.append("    <path d=\"").append(pathFor(LayoutChecker.rectangle(env, gf)))
          .append("\" fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"1\"/>\n");

        // Bloques
        String[] fills = {"#6baed6","#74c476","#fd8d3c","#9e9ac8","#fdd0a2","#a1d99b","#9ecae1","#fdae6b"};
        List<LeafBlock> leaves = PlacementWriter.leaves(root);
        int colorIdx = 0;
        for (LeafBlock leaf : leaves) {
            String fill = fills[colorIdx++ % fills.length];
            emitBlock(sb, LayoutChecker.rectangle(leaf, gf), fill, leaf);
        }

        sb.append("  </g>\n</svg>\n");
        return sb.toString();
    }

    static void emitBlock(StringBuilder sb, Polygon rect, String fill, LeafBlock meta) {
        sb.append("    <path d=\"").append(pathFor(rect))
          .append("\" fill=\"").append(fill)
          .append("\" fill-opacity=\"0.85\" stroke=\"#111\" stroke-width=\"0.8\">\n");
        sb.append("      <title>").append(meta.label)
          .append(" | ").append(meta.width).append("x").append(meta.height)
          .append(" @ (").append(meta.x).append(",").append(meta.y).append(")")
          .append("</title>\n");
        sb.append("    </path>\n");
    }

    // atributo "d" de un path SVG para el anillo exterior del rectángulo
    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        Coordinate[] c = poly.getExteriorRing().getCoordinates();
        if (c.length == 0) return "";
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z");
        return sb.toString();
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.3f", d);
    }
}
