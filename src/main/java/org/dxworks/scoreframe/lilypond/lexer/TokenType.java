package org.dxworks.scoreframe.lilypond.lexer;

public enum TokenType {
    NOTE_NAME,
    WORD,
    COMMAND,          // \name, text without the backslash
    ESCAPED_NUMBER,   // \1, string number
    NUMBER,
    STRING,           // text without quotes, escapes resolved
    SCHEME,           // #..., raw text

    OPEN_BRACE,
    CLOSE_BRACE,
    DOUBLE_ANGLE_OPEN,
    DOUBLE_ANGLE_CLOSE,
    ANGLE_OPEN,
    ANGLE_CLOSE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_PAREN,
    CLOSE_PAREN,
    PHRASING_OPEN,    // \(
    PHRASING_CLOSE,   // \)
    CRESCENDO,        // \<
    DECRESCENDO,      // \>
    HAIRPIN_END,      // \!
    DOUBLE_BACKSLASH, // \\

    TILDE,
    PIPE,
    EQUALS,
    DOT,
    APOSTROPHE,
    COMMA,
    EXCLAMATION,
    QUESTION,
    DASH,
    CARET,
    UNDERSCORE,
    PLUS,
    COLON,
    SLASH,
    STAR,

    EOF
}
