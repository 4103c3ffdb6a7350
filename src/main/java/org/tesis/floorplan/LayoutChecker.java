package org.tesis.floorplan;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.index.quadtree.Quadtree;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifica la colocación con JTS: ninguna hoja se solapa con otra (área positiva) y todas quedan
 * dentro del rectángulo de la raíz.
 */
public final class LayoutChecker {

    private LayoutChecker() {}

    public static final class LayoutCheck {
        final Envelope bounds;
        final double leafArea;
        final List<String> overlaps = new ArrayList<>();
        final List<Integer> outside = new ArrayList<>();

        LayoutCheck(Envelope bounds, double leafArea) {
            this.bounds = bounds;
            this.leafArea = leafArea;
        }

        public boolean isValid() {
            return overlaps.isEmpty() && outside.isEmpty();
        }

        public double rootArea() {
            return bounds.getArea();
        }

        public double leafArea() {
            return leafArea;
        }

        // sin solapes, el área cubierta es la suma de las hojas
        public double uncoveredArea() {
            return Math.max(0.0, bounds.getArea() - leafArea);
        }

        public List<String> overlaps() {
            return overlaps;
        }

        public List<Integer> outside() {
            return outside;
        }
    }

    public static LayoutCheck check(SliceNode root, int originX, int originY) {
        Envelope bounds = rootEnvelope(root, originX, originY);
        List<LeafBlock> leaves = PlacementWriter.leaves(root);

        double area = 0.0;
        for (LeafBlock l : leaves) area += (double) l.width * l.height;
        LayoutCheck res = new LayoutCheck(bounds, area);

        Quadtree index = new Quadtree();
        for (LeafBlock l : leaves) {
            Envelope e = envelopeOf(l);
            if (!bounds.covers(e)) res.outside.add(l.label);

            @SuppressWarnings("unchecked")
            List<LeafBlock> candidates = index.query(e);
            for (LeafBlock other : candidates) {
                Envelope inter = e.intersection(envelopeOf(other));
                if (inter.getArea() > 0) res.overlaps.add(other.label + "/" + l.label);
            }
            index.insert(e, l);
        }
        return res;
    }

    // unión de los rectángulos de todas las hojas (útil para comparar contra la raíz)
    public static Geometry coverage(SliceNode root, GeometryFactory gf) {
        List<Geometry> rects = new ArrayList<>();
        for (LeafBlock l : PlacementWriter.leaves(root)) rects.add(rectangle(l, gf));
        if (rects.isEmpty()) return gf.createGeometryCollection(new Geometry[0]);
        return UnaryUnionOp.union(rects);
    }

    static Envelope rootEnvelope(SliceNode root, int originX, int originY) {
        return new Envelope(originX, (double) originX + root.width(), originY, (double) originY + root.height());
    }

    static Envelope envelopeOf(LeafBlock l) {
        return new Envelope(l.x, (double) l.x + l.width, l.y, (double) l.y + l.height);
    }

    static Polygon rectangle(LeafBlock l, GeometryFactory gf) {
        return (Polygon) gf.toGeometry(envelopeOf(l));
    }

    static Polygon rectangle(Envelope e, GeometryFactory gf) {
        return (Polygon) gf.toGeometry(e);
    }
}
