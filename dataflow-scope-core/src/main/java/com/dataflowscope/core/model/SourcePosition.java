package com.dataflowscope.core.model;

/**
 * Zero-based line/column position inside a source document.
 *
 * @param line zero-based line number
 * @param column zero-based column number
 */
public record SourcePosition(int line, int column) {
}
