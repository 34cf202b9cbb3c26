package io.surfworks.qaeforge.quil;

import io.surfworks.qaeforge.circuit.CircuitProgram;
import io.surfworks.qaeforge.circuit.GateDefinition;
import io.surfworks.qaeforge.circuit.GateRegistry;
import io.surfworks.qaeforge.circuit.GateType;
import io.surfworks.qaeforge.circuit.Instruction;
import io.surfworks.qaeforge.quil.QuilTokenizer.Token;
import io.surfworks.qaeforge.quil.QuilTokenizer.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the Quil text produced by {@link QuilWriter}.
 *
 * <p>Reads {@code DEFGATE} blocks and gate instructions back into a
 * {@link CircuitProgram}. A {@code DEFGATE} block is not re-evaluated: its
 * name must be one of the controlled rotations, and the registry's definition
 * of that gate is attached to the program. Angles may be decimals or rational
 * multiples of {@code pi}.
 *
 * <pre>
 * program     := (defgate | instruction | NEWLINE)* EOF
 * defgate     := 'DEFGATE' NAME '(' %param ')' ':' NEWLINE (indented row NEWLINE)*
 * instruction := NAME '(' angle ')' INTEGER+ (NEWLINE | EOF)
 * angle       := '-'? (number | 'pi' ('/' number)? | number '*' 'pi' ('/' number)?)
 * </pre>
 */
public final class QuilParser {

    private static final String PI = "pi";

    private final List<Token> tokens;
    private int pos;

    public QuilParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    public static CircuitProgram parse(String input) {
        QuilTokenizer tokenizer = new QuilTokenizer(input);
        QuilParser parser = new QuilParser(tokenizer.tokenize());
        return parser.parseProgram();
    }

    public CircuitProgram parseProgram() {
        Map<String, GateDefinition> definitions = new LinkedHashMap<>();
        List<Instruction> instructions = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (check(TokenType.NEWLINE)) {
                advance();
            } else if (checkIdentifier("DEFGATE")) {
                GateDefinition def = parseDefGate();
                definitions.putIfAbsent(def.name(), def);
            } else {
                instructions.add(parseInstruction());
            }
        }

        return new CircuitProgram(List.copyOf(definitions.values()), instructions);
    }

    // ==================== DEFGATE ====================

    private GateDefinition parseDefGate() {
        expect(TokenType.IDENTIFIER, "DEFGATE");
        Token nameToken = expect(TokenType.IDENTIFIER);
        GateType type = resolveGate(nameToken);
        if (!type.isControlled()) {
            throw new QuilParseException("DEFGATE of native gate " + type,
                    nameToken.line(), nameToken.column());
        }
        expect(TokenType.LPAREN);
        expect(TokenType.PERCENT_ID);
        expect(TokenType.RPAREN);
        expect(TokenType.COLON);
        expectEndOfLine();

        // Matrix rows are the indented lines that follow the header
        int rows = 0;
        while (!check(TokenType.EOF) && !check(TokenType.NEWLINE) && peek().column() > 1) {
            skipLine();
            rows++;
        }
        if (rows != 4) {
            throw error("DEFGATE " + type + " must have 4 matrix rows, found " + rows);
        }
        return GateRegistry.definition(type);
    }

    // ==================== Instructions ====================

    private Instruction parseInstruction() {
        Token nameToken = expect(TokenType.IDENTIFIER);
        GateType type = resolveGate(nameToken);

        expect(TokenType.LPAREN);
        double angle = parseAngle();
        expect(TokenType.RPAREN);

        List<Integer> qubits = new ArrayList<>();
        while (check(TokenType.INTEGER)) {
            Token q = advance();
            try {
                qubits.add(Integer.parseInt(q.value()));
            } catch (NumberFormatException e) {
                throw new QuilParseException("Qubit index out of range: " + q.value(), q.line(), q.column(), e);
            }
        }
        if (qubits.size() != type.arity()) {
            throw new QuilParseException(String.format("%s expects %d qubit(s), got %d",
                    type, type.arity(), qubits.size()), nameToken.line(), nameToken.column());
        }
        expectEndOfLine();

        return new Instruction(type, List.of(angle), qubits);
    }

    private double parseAngle() {
        boolean negative = false;
        if (check(TokenType.MINUS)) {
            advance();
            negative = true;
        }

        double value;
        if (checkIdentifier(PI)) {
            advance();
            value = QuilParameterFormat.piMultiple(1, parseDenominator());
        } else {
            Token number = advance();
            if (number.type() == TokenType.INTEGER && check(TokenType.STAR)) {
                advance();
                expect(TokenType.IDENTIFIER, PI);
                value = QuilParameterFormat.piMultiple(parseLong(number), parseDenominator());
            } else if (number.type() == TokenType.INTEGER || number.type() == TokenType.FLOAT) {
                value = Double.parseDouble(number.value());
            } else {
                throw new QuilParseException("Expected angle but got " + number.type(),
                        number.line(), number.column());
            }
        }
        return negative ? -value : value;
    }

    private long parseDenominator() {
        if (!check(TokenType.SLASH)) {
            return 1;
        }
        advance();
        Token den = expect(TokenType.INTEGER);
        long value = parseLong(den);
        if (value == 0) {
            throw new QuilParseException("Division by zero in angle", den.line(), den.column());
        }
        return value;
    }

    private long parseLong(Token token) {
        try {
            return Long.parseLong(token.value());
        } catch (NumberFormatException e) {
            throw new QuilParseException("Integer out of range: " + token.value(),
                    token.line(), token.column(), e);
        }
    }

    private GateType resolveGate(Token nameToken) {
        try {
            return GateRegistry.byName(nameToken.value());
        } catch (IllegalArgumentException e) {
            throw new QuilParseException("Unknown gate '" + nameToken.value() + "'",
                    nameToken.line(), nameToken.column(), e);
        }
    }

    // ==================== Utilities ====================

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkIdentifier(String value) {
        Token t = peek();
        return t.type() == TokenType.IDENTIFIER && t.value().equals(value);
    }

    private Token expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but got " + peek().type());
        }
        return advance();
    }

    private Token expect(TokenType type, String value) {
        Token t = expect(type);
        if (!t.value().equals(value)) {
            throw new QuilParseException("Expected '" + value + "' but got '" + t.value() + "'",
                    t.line(), t.column());
        }
        return t;
    }

    private void expectEndOfLine() {
        if (check(TokenType.EOF)) {
            return;
        }
        expect(TokenType.NEWLINE);
    }

    private void skipLine() {
        while (!check(TokenType.NEWLINE) && !check(TokenType.EOF)) {
            advance();
        }
        if (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private QuilParseException error(String message) {
        Token t = peek();
        return new QuilParseException(message, t.line(), t.column());
    }
}
