package com.jpyq.tree;

/**
 * The handle does not have the shape an operation needs, such as indexing a handle with no body.
 */
public class InvalidOperationException extends IllegalStateException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
