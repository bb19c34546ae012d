package com.erbformat.parser.ast;

/** What may follow the body of an {@code unless}. */
public sealed interface UnlessTerminator extends Node permits ErbElse, ErbEnd {

    @Override
    UnlessTerminator withoutNewLine();
}
