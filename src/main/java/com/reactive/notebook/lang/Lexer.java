package com.reactive.notebook.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Hand-written scanner for cell source.
 *
 * <p>
 * Newlines terminate statements except inside parentheses or brackets, where
 * they are ignored so that long argument lists and list literals can span
 * lines. Braces are not tracked here: the parser skips newlines inside map
 * literals and blocks itself. A {@code ;} is emitted as a {@link TokenType#NEWLINE}.
 */
public final class Lexer {
    static final Set<String> KEYWORDS = Set.of(
            "def", "record", "import", "from", "as", "if", "elif", "else", "while", "for", "in",
            "return", "break", "continue", "pass", "and", "or", "not", "true", "false", "null", "fn");

    // Longest operators first so that "**" wins over "*".
    private static final String[] OPERATORS = {
            "**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "->",
            "+", "-", "*", "/", "%", "<", ">", "=", "(", ")", "[", "]", "{", "}", ",", ":", "."
    };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int nesting;

    private Lexer(String src) {
        this.src = src;
    }

    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source == null ? "" : source);
        lexer.scan();
        return lexer.tokens;
    }

    private void scan() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') {
                if (nesting == 0)
                    newline();
                pos++;
                line++;
                lineStart = pos;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\\' && peekChar(1) == '\n') {
                // explicit line continuation
                pos += 2;
                line++;
                lineStart = pos;
            } else if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n')
                    pos++;
            } else if (c == ';') {
                newline();
                pos++;
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
                number();
            } else if (c == '"' || c == '\'') {
                string(c);
            } else if (Character.isLetter(c) || c == '_') {
                name();
            } else {
                operator();
            }
        }
        newline();
        tokens.add(new Token(TokenType.EOF, "", null, line, column()));
    }

    private void newline() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE)
            tokens.add(new Token(TokenType.NEWLINE, "\n", null, line, column()));
    }

    private void number() {
        int start = pos;
        int col = column();
        boolean decimal = false;
        while (pos < src.length() && Character.isDigit(src.charAt(pos)))
            pos++;
        if (pos < src.length() && src.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            decimal = true;
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                pos++;
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                decimal = true;
                while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                    pos++;
            } else {
                pos = save;
            }
        }
        String text = src.substring(start, pos);
        Object value;
        try {
            value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ParseException("invalid number literal " + text, line);
        }
        tokens.add(new Token(TokenType.NUMBER, text, value, line, col));
    }

    private void string(char quote) {
        int start = pos;
        int col = column();
        int startLine = line;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length() || src.charAt(pos) == '\n')
                throw new ParseException("unterminated string literal", startLine);
            char c = src.charAt(pos++);
            if (c == quote)
                break;
            if (c == '\\') {
                if (pos >= src.length())
                    throw new ParseException("unterminated string literal", startLine);
                char esc = src.charAt(pos++);
                switch (esc) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case '\\', '\'', '"' -> sb.append(esc);
                    default -> sb.append('\\').append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        tokens.add(new Token(TokenType.STRING, src.substring(start, pos), sb.toString(), startLine, col));
    }

    private void name() {
        int start = pos;
        int col = column();
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
        String text = src.substring(start, pos);
        TokenType type = KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.NAME;
        tokens.add(new Token(type, text, null, line, col));
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                if (op.equals("(") || op.equals("["))
                    nesting++;
                else if ((op.equals(")") || op.equals("]")) && nesting > 0)
                    nesting--;
                tokens.add(new Token(TokenType.OP, op, null, line, column()));
                pos += op.length();
                return;
            }
        }
        throw new ParseException("unexpected character '" + src.charAt(pos) + "'", line);
    }

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private int column() {
        return pos - lineStart + 1;
    }
}
