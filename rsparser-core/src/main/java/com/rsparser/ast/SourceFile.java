package com.rsparser.ast;

import java.util.List;

/**
 * The contents of a source file: inner attributes, then items.
 */
public record SourceFile(List<Attribute> attrs, List<Item> items) implements Node {
}
