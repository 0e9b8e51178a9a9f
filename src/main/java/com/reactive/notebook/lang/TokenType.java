package com.reactive.notebook.lang;

public enum TokenType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    EOF
}
