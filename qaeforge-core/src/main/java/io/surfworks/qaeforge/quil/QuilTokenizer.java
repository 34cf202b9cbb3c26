package io.surfworks.qaeforge.quil;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the Quil subset emitted by {@link QuilWriter}.
 *
 * Recognizes:
 * - Identifiers: DEFGATE, RX, CRZ, COS, pi, i
 * - Parameters: %theta
 * - Numeric literals: 0, 12, 1.5707963267948966, 1.0E-5
 * - Operators and punctuation: ( ) , : * / + -
 * - Line breaks, which terminate instructions
 * - Comments: # to end of line
 */
public final class QuilTokenizer {

    public enum TokenType {
        IDENTIFIER,      // DEFGATE, RX, COS, pi
        PERCENT_ID,      // %theta

        INTEGER,         // 0, 1, 8
        FLOAT,           // 1.5, 2.0E-4

        LPAREN,          // (
        RPAREN,          // )
        COMMA,           // ,
        COLON,           // :
        STAR,            // *
        SLASH,           // /
        PLUS,            // +
        MINUS,           // -

        NEWLINE,
        EOF
    }

    public record Token(TokenType type, String value, int line, int column) {
        @Override
        public String toString() {
            return String.format("%s(%s)@%d:%d", type, value, line, column);
        }
    }

    private final String input;
    private int pos;
    private int line;
    private int column;

    public QuilTokenizer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < input.length()) {
            skipBlanksAndComments();
            if (pos >= input.length()) break;

            char c = input.charAt(pos);
            if (c == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "\\n", line, column));
                pos++;
                line++;
                column = 1;
                continue;
            }
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipBlanksAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
                column++;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                    column++;
                }
            } else {
                break;
            }
        }
    }

    private Token nextToken() {
        int startCol = column;
        char c = input.charAt(pos);

        TokenType punct = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ',' -> TokenType.COMMA;
            case ':' -> TokenType.COLON;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            default -> null;
        };

        if (punct != null) {
            pos++;
            column++;
            return new Token(punct, String.valueOf(c), line, startCol);
        }

        if (c == '%') {
            return scanPercentId(startCol);
        }

        if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return scanNumber(startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return scanIdentifier(startCol);
        }

        throw new QuilParseException(String.format("Unexpected character '%c'", c), line, startCol);
    }

    private Token scanPercentId(int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.append(input.charAt(pos++)); // %
        column++;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                sb.append(c);
                pos++;
                column++;
            } else {
                break;
            }
        }

        if (sb.length() == 1) {
            throw new QuilParseException("Empty parameter name after '%'", line, startCol);
        }
        return new Token(TokenType.PERCENT_ID, sb.toString(), line, startCol);
    }

    private Token scanNumber(int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean isFloat = false;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isDigit(c)) {
                sb.append(c);
                pos++;
                column++;
            } else if (c == '.' && !isFloat) {
                isFloat = true;
                sb.append(c);
                pos++;
                column++;
            } else if ((c == 'e' || c == 'E') && exponentFollows()) {
                // Scientific notation, as Double.toString writes it
                isFloat = true;
                sb.append(c);
                pos++;
                column++;
                if (input.charAt(pos) == '+' || input.charAt(pos) == '-') {
                    sb.append(input.charAt(pos++));
                    column++;
                }
            } else {
                break;
            }
        }

        TokenType type = isFloat ? TokenType.FLOAT : TokenType.INTEGER;
        return new Token(type, sb.toString(), line, startCol);
    }

    private boolean exponentFollows() {
        int next = pos + 1;
        if (next < input.length() && (input.charAt(next) == '+' || input.charAt(next) == '-')) {
            next++;
        }
        return next < input.length() && Character.isDigit(input.charAt(next));
    }

    private Token scanIdentifier(int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                sb.append(c);
                pos++;
                column++;
            } else {
                break;
            }
        }

        return new Token(TokenType.IDENTIFIER, sb.toString(), line, startCol);
    }
}
