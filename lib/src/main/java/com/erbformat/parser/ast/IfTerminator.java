package com.erbformat.parser.ast;

/** What may follow the body of an {@code if} or {@code elsif}. */
public sealed interface IfTerminator extends Node permits ErbElsif, ErbElse, ErbEnd {

    @Override
    IfTerminator withoutNewLine();
}
