package org.survey.coverage;

// Web Mercator esférico (EPSG:3857), suficiente para áreas chicas
public final class WebMercatorProjector implements Projector {
    static final double R       = 6378137.0;
    static final double MAX_LAT = 85.05112878;

    @Override public Point forward(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon))
            throw new IllegalArgumentException("lat/lon no finitos: " + lat + "," + lon);
        double phi = Math.toRadians(Math.max(-MAX_LAT, Math.min(MAX_LAT, lat)));
        double x = R * Math.toRadians(lon);
        double y = R * Math.log(Math.tan(Math.PI / 4 + phi / 2));
        return new Point(x, y);
    }

    @Override public double[] inverse(Point p) {
        double lon = Math.toDegrees(p.x / R);
        double lat = Math.toDegrees(2 * Math.atan(Math.exp(p.y / R)) - Math.PI / 2);
        return new double[] { lat, lon };
    }
}
