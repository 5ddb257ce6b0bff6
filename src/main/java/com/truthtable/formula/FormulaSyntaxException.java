package com.truthtable.formula;

public class FormulaSyntaxException extends RuntimeException {
    private final CompileError error;

    public FormulaSyntaxException(CompileError error) {
        super(buildMessage(error));
        this.error = error;
    }

    public CompileError getError() {
        return error;
    }

    public String getDescription() {
        return error.description();
    }

    public int getStart() {
        return error.start();
    }

    public int getEnd() {
        return error.end();
    }

    static FormulaSyntaxException lex(String description, int start, int end) {
        return new FormulaSyntaxException(CompileError.lex(description, start, end));
    }

    static FormulaSyntaxException parse(String description, int start, int end) {
        return new FormulaSyntaxException(CompileError.parse(description, start, end));
    }

    private static String buildMessage(CompileError error) {
        String stage = error.kind() == CompileError.Kind.LEX ? "Lex" : "Parse";
        return stage + " error at [" + error.start() + ", " + error.end() + "): " + error.description();
    }
}
