package com.erbformat.parser.ast;

/** What may follow the body of a {@code case} or {@code when}. */
public sealed interface CaseTerminator extends Node permits ErbCaseWhen, ErbElse, ErbEnd {

    @Override
    CaseTerminator withoutNewLine();
}
