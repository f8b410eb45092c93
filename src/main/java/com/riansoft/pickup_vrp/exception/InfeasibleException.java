package com.riansoft.pickup_vrp.exception;

public class InfeasibleException extends RoutingException {

    private final String solverStatus;

    public InfeasibleException(String message, String solverStatus) {
        super("INFEASIBLE", message);
        this.solverStatus = solverStatus;
    }

    public String getSolverStatus() {
        return solverStatus;
    }
}
