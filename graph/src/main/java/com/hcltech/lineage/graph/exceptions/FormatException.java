package com.hcltech.lineage.graph.exceptions;

public final class FormatException extends RuntimeException {
    public FormatException(String message, Throwable cause) { super(message, cause); }
    public FormatException(String message) { super(message); }
}
