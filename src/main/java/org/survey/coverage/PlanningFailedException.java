package org.survey.coverage;

// ningún ángulo muestreado produjo una ruta no vacía
public class PlanningFailedException extends IllegalStateException {
    public PlanningFailedException(String msg) {
        super(msg);
    }

    public PlanningFailedException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
