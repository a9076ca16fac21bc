package com.rsparser.ast;

import java.util.List;

/**
 * A function parameter: the {@code self} receiver or a typed pattern.
 */
public sealed interface FnArg extends Node permits Receiver, PatType {

    List<Attribute> attrs();
}
