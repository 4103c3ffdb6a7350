package org.tesis.floorplan;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;


public class TesisFloorplan {

    static final String USAGE = "Uso: TesisFloorplan in_file out_file1 out_file2 out_file3 [out_svg]";

    public static void main(String[] args) {
        int code;
        try (RunLogger log = RunLogger.to(System.err)) {
            code = run(args, FloorplanConfig.defaults(), log);
        }
        System.exit(code);
    }

    // 0 = ok, 1 = error de entrada/salida o de contenido, 2 = argumentos
    static int run(String[] args, FloorplanConfig cfg, RunLogger log) {
        if (args.length != 4 && args.length != 5) {
            log.log(USAGE);
            return 2;
        }
        Path input = Paths.get(args[0]);
        Path structureOut = Paths.get(args[1]);
        Path dimensionsOut = Paths.get(args[2]);
        Path placementsOut = Paths.get(args[3]);
        Path svgOut = args.length == 5 ? Paths.get(args[4]) : null;

        if (!Files.isReadable(input) || Files.isDirectory(input)) {
            log.log("No se puede leer la entrada: " + input);
            return 1;
        }
        for (Path p : new Path[]{structureOut, dimensionsOut, placementsOut, svgOut}) {
            if (p != null && Files.isDirectory(p)) {
                log.log("La salida es un directorio: " + p);
                return 1;
            }
        }

        // 1) Reservar las salidas: cada una se escribe en un temporal junto a su destino
        List<StagedOutput> staged = new ArrayList<>();
        try {
            for (Path p : new Path[]{structureOut, dimensionsOut, placementsOut, svgOut}) {
                if (p != null) staged.add(StagedOutput.open(p));
            }
        } catch (IOException e) {
            log.log("No se puede abrir la salida: " + e.getMessage());
            discard(staged, log);
            return 1;
        }

        // 2) Procesar todo en memoria
        FloorplanResult res;
        try {
            res = new FloorplanPipeline(cfg, log).run(input);
        } catch (FloorplanException e) {
            log.log("Error (" + e.kind() + "): " + e.getMessage());
            discard(staged, log);
            return 1;
        } catch (IOException e) {
            log.log("Error leyendo " + input + ": " + e.getMessage());
            discard(staged, log);
            return 1;
        }

        // 3) Escribir los temporales y recién entonces moverlos a su destino
        try {
            writeLines(staged.get(0).tmp, res.structure());
            writeLines(staged.get(1).tmp, res.dimensions());
            writeLines(staged.get(2).tmp, res.placements());
            if (svgOut != null) {
                try (Writer w = new OutputStreamWriter(new FileOutputStream(staged.get(3).tmp.toFile()), StandardCharsets.UTF_8)) {
                    w.write(SvgWriter.toSVG(res.root(), cfg.originX, cfg.originY));
                }
            }
            for (StagedOutput o : staged) o.commit();
        } catch (IOException e) {
            log.log("Error escribiendo salidas: " + e.getMessage());
            discard(staged, log);
            return 1;
        }
        if (svgOut != null) log.log("SVG generado en: " + svgOut);
        return 0;
    }

    // salida reservada: temporal en el mismo directorio que el destino
    static final class StagedOutput {
        final Path target;
        final Path tmp;

        private StagedOutput(Path target, Path tmp) {
            this.target = target;
            this.tmp = tmp;
        }

        static StagedOutput open(Path target) throws IOException {
            Path abs = target.toAbsolutePath();
            Path dir = abs.getParent();
            Path tmp = Files.createTempFile(dir, "." + abs.getFileName(), ".tmp");
            return new StagedOutput(target, tmp);
        }

        void commit() throws IOException {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // borra los temporales que sigan en disco
    static void discard(List<StagedOutput> staged, RunLogger log) {
        for (StagedOutput o : staged) {
            try {
                Files.deleteIfExists(o.tmp);
            } catch (IOException e) {
                log.log("No se pudo borrar el temporal " + o.tmp + ": " + e.getMessage());
            }
        }
    }

    // una línea por registro, terminada en '\n' sin importar la plataforma
    static void writeLines(Path path, List<String> lines) throws IOException {
        try (Writer w = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(path.toFile()), StandardCharsets.UTF_8))) {
            for (String l : lines) {
                w.write(l);
                w.write('\n');
            }
        }
    }
}
