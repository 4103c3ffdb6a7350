package org.tesis.floorplan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * tokens -> árbol -> volcado preorden; árbol -> dimensiones -> volcado postorden -> coordenadas -> volcado de hojas.
 * Todo se calcula en memoria; si algo falla no se produjo ninguna salida.
 */
public class FloorplanPipeline {

    private final FloorplanConfig cfg;
    private final RunLogger log;

    public FloorplanPipeline(FloorplanConfig cfg, RunLogger log) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.log = log;
    }

    public FloorplanResult run(Path input) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return run(new SliceTokenReader(br, cfg));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public FloorplanResult run(List<SliceToken> tokens) {
        return run(tokens.iterator());
    }

    public FloorplanResult run(Iterator<SliceToken> tokens) {
        long t0 = System.currentTimeMillis();

        // 1) Reconstruir el árbol
        SliceNode root = new SlicingTreeBuilder(cfg).build(tokens);

        // 2) Estructura antes de evaluar
        List<String> structure = StructureWriter.write(root);

        // 3) Dimensiones
        DimensionEvaluator.evaluate(root);
        List<String> dimensions = DimensionWriter.write(root);

        // 4) Coordenadas
        CoordinateEvaluator.place(root, cfg.originX, cfg.originY);
        List<String> placements = PlacementWriter.write(root);

        // 5) Verificación de la colocación
        LayoutChecker.LayoutCheck check = verify(root, cfg.originX, cfg.originY);

        FloorplanReport rep = new FloorplanReport();
        rep.hojas = placements.size();
        rep.cortes = structure.size() - placements.size();
        rep.anchoRaiz = root.width();
        rep.altoRaiz = root.height();
        rep.areaHojas = check.leafArea();
        rep.areaRaiz = check.rootArea();
        rep.areaDesperdiciada = check.uncoveredArea();
        rep.tiempoMs = System.currentTimeMillis() - t0;

        if (log != null) {
            log.logf("Árbol: %d hojas, %d cortes, raíz %dx%d", rep.hojas, rep.cortes, rep.anchoRaiz, rep.altoRaiz);
            log.log(rep.formatResumen());
        }
        return new FloorplanResult(root, structure, dimensions, placements, rep);
    }

    // sólo falla si los evaluadores tienen un error; no depende de la entrada
    static LayoutChecker.LayoutCheck verify(SliceNode root, int originX, int originY) {
        LayoutChecker.LayoutCheck check = LayoutChecker.check(root, originX, originY);
        if (!check.isValid()) {
            throw new IllegalStateException("Error interno: colocación inválida, solapes=" + check.overlaps()
                    + " fuera de la raíz=" + check.outside());
        }
        return check;
    }
}
