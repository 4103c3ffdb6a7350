package org.tesis.floorplan;

import java.io.PrintStream;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Logger con timestamp tipo [HH:mm:ss.SSS] */
public final class RunLogger implements AutoCloseable {
    private final PrintStream out;
    private final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private RunLogger(PrintStream out) {
        this.out = out;
    }

    // el stream queda abierto al cerrar el logger (p.ej. System.err)
    public static RunLogger to(PrintStream out) {
        return new RunLogger(out);
    }

    public void log(String msg) {
        String t = "[" + LocalTime.now().format(fmt) + "] ";
        out.println(t + msg);
    }

    public void logf(String pattern, Object... args) {
        log(String.format(Locale.US, pattern, args));
    }

    @Override public void close() {
        out.flush();
    }
}
