package org.survey.coverage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Envelope;

public class GeomKernelTest {

    private static final double TOL = 1e-9;

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 5.0, 17.5, 45.0, 90.0, 133.3, 179.9, -60.0, 359.0 })
    void rotationRoundTripRestoresPoints(double angle) {
        List<Point> pts = Shapes.ring(0, 0, 120.5, -3, 44, 87.25, -15, 12);
        for (Point pivot : List.of(new Point(0, 0), new Point(3.5, -2), new Point(1e4, -7e3))) {
            List<Point> back = GeomKernel.rotate(GeomKernel.rotate(pts, -angle, pivot), angle, pivot);
            assertEquals(pts.size(), back.size());
            for (int i = 0; i < pts.size(); i++) {
                assertEquals(pts.get(i).x, back.get(i).x, 1e-6, "x angle=" + angle + " pivot=" + pivot);
                assertEquals(pts.get(i).y, back.get(i).y, 1e-6, "y angle=" + angle + " pivot=" + pivot);
            }
        }
    }

    @Test
    void rotateQuarterTurnCounterClockwise() {
        List<Point> r = GeomKernel.rotate(List.of(new Point(1, 0)), 90, new Point(0, 0));
        assertEquals(0.0, r.get(0).x, 1e-12);
        assertEquals(1.0, r.get(0).y, 1e-12);
    }

    @Test
    void rotateByZeroIsExact() {
        List<Point> sq = Shapes.square10();
        assertEquals(sq, GeomKernel.rotate(sq, 0.0, new Point(5, 5)));
        assertEquals(sq, GeomKernel.rotate(sq, -0.0, new Point(5, 5)));
    }

    @Test
    void boundingBoxOfSquare() {
        Envelope env = GeomKernel.boundingBox(Shapes.square10());
        assertEquals(0, env.getMinX());
        assertEquals(0, env.getMinY());
        assertEquals(10, env.getMaxX());
        assertEquals(10, env.getMaxY());
    }

    @Test
    void centroidIsAreaWeighted() {
        Point c = GeomKernel.centroid(Shapes.square10());
        assertEquals(5.0, c.x, TOL);
        assertEquals(5.0, c.y, TOL);

        // L de tres cuadrados unitarios
        Point l = GeomKernel.centroid(Shapes.ring(0, 0, 2, 0, 2, 1, 1, 1, 1, 2, 0, 2));
        assertEquals(2.5 / 3, l.x, TOL);
        assertEquals(2.5 / 3, l.y, TOL);
    }

    @Test
    void pathLengthOfShortAndLongPaths() {
        assertEquals(0.0, GeomKernel.pathLength(List.of()));
        assertEquals(0.0, GeomKernel.pathLength(List.of(new Point(3, 4))));
        assertEquals(5.0, GeomKernel.pathLength(Shapes.ring(0, 0, 3, 4)), TOL);
        assertEquals(25.0, GeomKernel.pathLength(Shapes.ring(0, 10, 0, 0, 5, 0, 5, 10)), TOL);
    }

    @Test
    void verticalLineThroughSquareGivesOneChordTopFirst() {
        List<Segment> segs = GeomKernel.intersectVerticalLine(Shapes.square10(), 5, -5, 15);
        assertEquals(1, segs.size());
        assertEquals(new Point(5, 10), segs.get(0).top);
        assertEquals(new Point(5, 0), segs.get(0).bottom);
    }

    @Test
    void lineOutsideOrOnRightEdgeGivesNothing() {
        List<Point> sq = Shapes.square10();
        assertTrue(GeomKernel.intersectVerticalLine(sq, -1, -5, 15).isEmpty());
        assertTrue(GeomKernel.intersectVerticalLine(sq, 11, -5, 15).isEmpty());
        // aristas verticales no cuentan; el borde izquierdo sí entra por los horizontales
        assertTrue(GeomKernel.intersectVerticalLine(sq, 10, -5, 15).isEmpty());
        assertEquals(1, GeomKernel.intersectVerticalLine(sq, 0, -5, 15).size());
    }

    @Test
    void touchingVertexIsDiscarded() {
        List<Point> diamond = Shapes.ring(5, 0, 10, 5, 5, 10, 0, 5);
        assertTrue(GeomKernel.intersectVerticalLine(diamond, 0, -5, 15).isEmpty());
        assertTrue(GeomKernel.intersectVerticalLine(diamond, 10, -5, 15).isEmpty());
        assertEquals(1, GeomKernel.intersectVerticalLine(diamond, 2.5, -5, 15).size());
    }

    @Test
    void nonConvexLineGivesTwoChordsInAscendingOrder() {
        List<Segment> segs = GeomKernel.intersectVerticalLine(Shapes.cShape(), 20, -10, 40);
        assertEquals(2, segs.size());
        assertEquals(10.0, segs.get(0).top.y, TOL);
        assertEquals(0.0, segs.get(0).bottom.y, TOL);
        assertEquals(30.0, segs.get(1).top.y, TOL);
        assertEquals(20.0, segs.get(1).bottom.y, TOL);
    }

    @Test
    void chordsAreClippedToVerticalExtent() {
        List<Segment> segs = GeomKernel.intersectVerticalLine(Shapes.square10(), 5, 2, 8);
        assertEquals(1, segs.size());
        assertEquals(8.0, segs.get(0).top.y);
        assertEquals(2.0, segs.get(0).bottom.y);

        assertTrue(GeomKernel.intersectVerticalLine(Shapes.square10(), 5, 20, 30).isEmpty());
    }

    @Test
    void segmentBetweenOrdersEndpointsTopFirst() {
        Segment s = Segment.between(new Point(1, 2), new Point(1, 9));
        assertEquals(9.0, s.top.y);
        assertEquals(2.0, s.bottom.y);
        assertEquals(5.5, s.midY());
    }

    @Test
    void chordEndpointsShareTheLineAbscissa() {
        for (Segment s : GeomKernel.intersectVerticalLine(Shapes.cShape(), 12.5, -10, 40)) {
            assertEquals(12.5, s.top.x);
            assertEquals(12.5, s.bottom.x);
            assertTrue(s.top.y > s.bottom.y);
        }
    }

    @Test
    void tooFewPointsCannotFormPolygon() {
        assertThrows(InvalidPolygonException.class, () -> GeomKernel.toPolygon(Shapes.ring(0, 0, 1, 1)));
    }
}
