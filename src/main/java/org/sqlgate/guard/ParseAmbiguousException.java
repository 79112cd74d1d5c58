package org.sqlgate.guard;

// Raised when quoting, comments or limits make a statement unsafe to classify
public class ParseAmbiguousException extends RuntimeException {

    public ParseAmbiguousException(String message) {
        super(message);
    }
}
