package org.survey.coverage;

import java.io.File;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Logger con timestamp tipo [HH:mm:ss.SSS] */
public final class PlanLogger implements AutoCloseable {
    private final PrintStream out;
    private final boolean ownsStream;
    private final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private PlanLogger(PrintStream out, boolean ownsStream) {
        this.out = out;
        this.ownsStream = ownsStream;
    }

    // escribe en un stream ajeno (p.ej. System.err); close() sólo hace flush
    public static PlanLogger to(PrintStream out) {
        return new PlanLogger(out, false);
    }

    public static PlanLogger toFile(String path) {
        try {
            File f = new File(path);
            File dir = f.getParentFile();
            if (dir != null) dir.mkdirs();
            PrintStream ps = new PrintStream(new FileOutputStream(f, /*append*/false), true, StandardCharsets.UTF_8);
            return new PlanLogger(ps, true);
        } catch (Exception e) {
            throw new RuntimeException("No se pudo abrir el log " + path, e);
        }
    }

    public synchronized void log(String msg) {
        String t = "[" + LocalTime.now().format(fmt) + "] ";
        out.println(t + msg);
    }

    public void logf(String pattern, Object... args) {
        log(String.format(Locale.US, pattern, args));
    }

    @Override public void close() {
        out.flush();
        if (ownsStream) out.close();
    }
}
