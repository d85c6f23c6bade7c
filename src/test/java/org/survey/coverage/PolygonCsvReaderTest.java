package org.survey.coverage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PolygonCsvReaderTest {

    @TempDir
    Path dir;

    private String write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p.toString();
    }

    @Test
    void planarRowsAreSortedByPointIndex() throws IOException {
        String path = write("area.csv", "point_idx, x, y\n2,10,10\n0,0,0\n\n3,0,10\n1,10,0\n");
        List<VertexRow> rows = PolygonCsvReader.readCsv(path);
        assertFalse(PolygonCsvReader.isGeodetic(rows));
        assertEquals(Shapes.square10(), PolygonCsvReader.toRing(rows, new WebMercatorProjector()));
    }

    @Test
    void geodeticRowsAreProjected() throws IOException {
        String path = write("ll.csv", "POINT_IDX,LAT,LON\n0,37.7749,-122.4194\n1,37.7749,-122.4184\n2,37.7740,-122.4184\n");
        List<VertexRow> rows = PolygonCsvReader.readCsv(path);
        assertTrue(PolygonCsvReader.isGeodetic(rows));
        Projector proj = new WebMercatorProjector();
        List<Point> ring = PolygonCsvReader.toRing(rows, proj);
        assertEquals(3, ring.size());
        assertEquals(proj.forward(37.7749, -122.4194), ring.get(0));
    }

    @Test
    void mixedRowsAreRejected() throws IOException {
        String path = write("mixed.csv", "point_idx,x,y,lat,lon\n0,0,0,,\n1,,,37.7,-122.4\n2,5,5,,\n");
        List<VertexRow> rows = PolygonCsvReader.readCsv(path);
        assertThrows(IllegalArgumentException.class, () -> PolygonCsvReader.toRing(rows, new WebMercatorProjector()));
    }

    @Test
    void missingHeaderOrCoordinatesAreReported() throws IOException {
        String noIdx = write("noidx.csv", "x,y\n0,0\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> PolygonCsvReader.readCsv(noIdx));
        assertTrue(e.getMessage().contains("point_idx"));

        String noCoords = write("nocoords.csv", "point_idx,x\n0,1\n");
        assertThrows(IllegalArgumentException.class, () -> PolygonCsvReader.readCsv(noCoords));
    }

    @Test
    void emptyFileIsAnIoError() throws IOException {
        String empty = write("empty.csv", "");
        assertThrows(IOException.class, () -> PolygonCsvReader.readCsv(empty));
    }
}
