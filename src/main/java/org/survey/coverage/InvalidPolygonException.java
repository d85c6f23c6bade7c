package org.survey.coverage;

// polígono de entrada inutilizable (menos de 3 vértices, vacío o degenerado)
public class InvalidPolygonException extends IllegalArgumentException {
    public InvalidPolygonException(String msg) {
        super(msg);
    }
}
