package com.hcltech.lineage.graph.exceptions;

public final class DuplicateNodeException extends RuntimeException {
    public DuplicateNodeException(String message, Throwable cause) { super(message, cause); }
    public DuplicateNodeException(String message) { super(message); }
}
