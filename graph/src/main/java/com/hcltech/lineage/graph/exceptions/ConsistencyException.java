package com.hcltech.lineage.graph.exceptions;

public final class ConsistencyException extends RuntimeException {
    public ConsistencyException(String message, Throwable cause) { super(message, cause); }
    public ConsistencyException(String message) { super(message); }
}
