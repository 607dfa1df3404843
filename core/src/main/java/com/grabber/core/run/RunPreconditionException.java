package com.grabber.core.run;

/**
 * A run cannot start at all: no input URLs, or nowhere to write to.
 */
public class RunPreconditionException extends Exception {

    public RunPreconditionException(String message) {
        super(message);
    }
}
