package com.libragraph.attest.formats.python;

public enum PythonTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    END
}
