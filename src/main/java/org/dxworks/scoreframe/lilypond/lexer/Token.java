package org.dxworks.scoreframe.lilypond.lexer;

public final class Token {
    public final TokenType type;
    public final String text;
    public final int offset;

    public Token(TokenType type, String text, int offset) {
        this.type = type;
        this.text = text;
        this.offset = offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isCommand(String name) {
        return type == TokenType.COMMAND && text.equals(name);
    }

    /**
     * Human-readable form for error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case COMMAND -> "'\\" + text + "'";
            case ESCAPED_NUMBER -> "'\\" + text + "'";
            case STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + offset;
    }
}
