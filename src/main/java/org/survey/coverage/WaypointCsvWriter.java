package org.survey.coverage;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

class WaypointCsvWriter {

    // waypoints planos: idx,x,y con 3 decimales
    static String toCsv(List<Point> path) {
        StringBuilder sb = new StringBuilder("idx,x,y\n");
        for (int i = 0; i < path.size(); i++) {
            Point p = path.get(i);
            sb.append(i).append(',').append(fmt3(p.x)).append(',').append(fmt3(p.y)).append('\n');
        }
        return sb.toString();
    }

    // waypoints geodésicos: idx,lat,lon con 6 decimales
    static String toLatLonCsv(List<double[]> latLon) {
        StringBuilder sb = new StringBuilder("idx,lat,lon\n");
        for (int i = 0; i < latLon.size(); i++) {
            double[] ll = latLon.get(i);
            sb.append(i).append(',').append(fmt6(ll[0])).append(',').append(fmt6(ll[1])).append('\n');
        }
        return sb.toString();
    }

    static void write(String path, String csv) throws IOException {
        File f = new File(path);
        File dir = f.getParentFile();
        if (dir != null) dir.mkdirs();
        try (Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8)) {
            w.write(csv);
        }
    }

    static String fmt3(double d) {
        return String.format(Locale.US, "%.3f", d);
    }

    static String fmt6(double d) {
        return String.format(Locale.US, "%.6f", d);
    }
}
