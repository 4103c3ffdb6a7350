package org.tesis.floorplan;

import java.util.List;

// salidas de una corrida completa, todavía en memoria
public final class FloorplanResult {
    final SliceNode root;
    final List<String> structure;    // preorden
    final List<String> dimensions;   // postorden
    final List<String> placements;   // sólo hojas
    final FloorplanReport report;

    FloorplanResult(SliceNode root, List<String> structure, List<String> dimensions,
                    List<String> placements, FloorplanReport report) {
        this.root = root;
        this.structure = List.copyOf(structure);
        this.dimensions = List.copyOf(dimensions);
        this.placements = List.copyOf(placements);
        this.report = report;
    }

    public SliceNode root() { return root; }

    public List<String> structure() { return structure; }

    public List<String> dimensions() { return dimensions; }

    public List<String> placements() { return placements; }

    public FloorplanReport report() { return report; }
}
