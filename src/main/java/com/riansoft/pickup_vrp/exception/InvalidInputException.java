package com.riansoft.pickup_vrp.exception;

public class InvalidInputException extends RoutingException {

    public InvalidInputException(String message) {
        super("INVALID_INPUT", message);
    }
}
