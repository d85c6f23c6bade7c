package org.survey.coverage;

import java.util.Locale;

// una fila del CSV de entrada: vértice plano (x,y) o geodésico (lat,lon)
public class VertexRow {
    int pointIdx;
    Double x, y;       // metros
    Double lat, lon;   // grados WGS84

    boolean isGeodetic() {
        return lat != null && lon != null;
    }

    static VertexRow fromCsv(String[] h, String[] v) {
        VertexRow r = new VertexRow();
        r.pointIdx = parseInt(get(v, idx(h, "point_idx")), 0);
        r.x   = parseNullableDouble(getOpt(v, h, "x"));
        r.y   = parseNullableDouble(getOpt(v, h, "y"));
        r.lat = parseNullableDouble(getOpt(v, h, "lat"));
        r.lon = parseNullableDouble(getOpt(v, h, "lon"));
        if (!r.isGeodetic() && (r.x == null || r.y == null))
            throw new IllegalArgumentException("Vértice " + r.pointIdx + " sin x,y ni lat,lon");
        return r;
    }

    // ------------- helpers CSV -------------
    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i=0;i<raw.length;i++) raw[i] = raw[i].trim();
        return raw;
    }
    static int idx(String[] h, String name) {
        int i = idxOpt(h, name);
        if (i == -1) throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
        return i;
    }
    static int idxOpt(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].toLowerCase(Locale.ROOT).equals(name)) return i;
        return -1;
    }
    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }
    static String getOpt(String[] v, String[] h, String name) {
        int i = idxOpt(h, name);
        return i == -1 ? "" : get(v, i);
    }

    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }
    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
    }
    static int parseInt(String s, int d) {
        Integer v = parseNullableInt(s); return v == null ? d : v;
    }
}
