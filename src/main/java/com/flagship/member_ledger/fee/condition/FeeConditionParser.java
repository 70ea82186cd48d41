package com.flagship.member_ledger.fee.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Parser for the fee condition language.
 *
 * <pre>
 * expr    := xorExpr ( OR expr )?
 * xorExpr := andExpr ( XOR xorExpr )?
 * andExpr := unary ( AND andExpr )?
 * unary   := NOT unary | atom
 * atom    := '(' expr ')' | part.SHORTNAME | field.NAME
 *          | true | false | any_part | all_parts | is_member | is_orga
 * </pre>
 *
 * Keywords are case-insensitive, binary operators chain to the right. Part shortnames may
 * contain anything but whitespace, parentheses and brackets, so {@code part.1.H.} is a
 * single atom.
 */
public final class FeeConditionParser {

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final List<Token> tokens;
    private int cursor;

    private FeeConditionParser(String source) {
        this.tokens = tokenize(source);
        this.cursor = 0;
    }

    /**
     * Parses a condition string. A null or blank string is the unconditional condition.
     *
     * @throws FeeConditionException on syntax errors
     */
    public static FeeCondition parse(String condition) {
        if (condition == null || condition.isBlank()) {
            return FeeCondition.ALWAYS;
        }
        FeeConditionParser parser = new FeeConditionParser(condition);
        FeeCondition result = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw new FeeConditionException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return result;
    }

    /**
     * Parses a condition and checks that it only references known fields and parts.
     *
     * @param knownFields field names of the event
     * @param knownParts  part shortnames of the event
     * @throws FeeConditionException on syntax errors or unknown references
     */
    public static FeeCondition parseAndValidate(String condition, Set<String> knownFields, Set<String> knownParts) {
        FeeCondition parsed = parse(condition);

        Set<String> fields = new TreeSet<>();
        Set<String> parts = new TreeSet<>();
        parsed.collectReferences(fields, parts);
        fields.removeAll(knownFields);
        parts.removeAll(knownParts);

        List<String> problems = new ArrayList<>();
        if (!fields.isEmpty()) {
            problems.add("Unknown field(s): " + String.join(", ", fields));
        }
        if (!parts.isEmpty()) {
            problems.add("Unknown part shortname(s): " + String.join(", ", parts));
        }
        if (!problems.isEmpty()) {
            throw new FeeConditionException(String.join("; ", problems));
        }
        return parsed;
    }

    private FeeCondition parseOr() {
        FeeCondition left = parseXor();
        if (accept(TokenType.OR)) {
            return new FeeCondition.Or(left, parseOr());
        }
        return left;
    }

    private FeeCondition parseXor() {
        FeeCondition left = parseAnd();
        if (accept(TokenType.XOR)) {
            return new FeeCondition.Xor(left, parseXor());
        }
        return left;
    }

    private FeeCondition parseAnd() {
        FeeCondition left = parseUnary();
        if (accept(TokenType.AND)) {
            return new FeeCondition.And(left, parseAnd());
        }
        return left;
    }

    private FeeCondition parseUnary() {
        if (accept(TokenType.NOT)) {
            return new FeeCondition.Not(parseUnary());
        }
        return parseAtom();
    }

    private FeeCondition parseAtom() {
        Token token = next();
        return switch (token.type()) {
            case LPAREN -> {
                FeeCondition inner = parseOr();
                Token closing = next();
                if (closing.type() != TokenType.RPAREN) {
                    throw new FeeConditionException("Expected ')'", closing.position());
                }
                yield inner;
            }
            case PART -> new FeeCondition.PartRef(token.text());
            case FIELD -> new FeeCondition.FieldRef(token.text());
            case BOOL -> new FeeCondition.BoolRef(
                    FeeCondition.BoolRef.Name.valueOf(token.text().toUpperCase(Locale.ROOT)));
            case TRUE -> new FeeCondition.Literal(true);
            case FALSE -> new FeeCondition.Literal(false);
            case END -> throw new FeeConditionException("Unexpected end of condition", token.position());
            default -> throw new FeeConditionException("Unexpected '" + token.text() + "'", token.position());
        };
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            cursor++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(cursor);
    }

    private Token next() {
        Token token = tokens.get(cursor);
        if (token.type() != TokenType.END) {
            cursor++;
        }
        return token;
    }

    private static List<Token> tokenize(String source) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                result.add(new Token(TokenType.LPAREN, "(", i));
                i++;
            } else if (c == ')') {
                result.add(new Token(TokenType.RPAREN, ")", i));
                i++;
            } else if (c == '[' || c == ']') {
                throw new FeeConditionException("Unexpected '" + c + "'", i);
            } else {
                int start = i;
                while (i < length && isWordChar(source.charAt(i))) {
                    i++;
                }
                result.add(classify(source.substring(start, i), start));
            }
        }
        result.add(new Token(TokenType.END, "", length));
        return result;
    }

    private static boolean isWordChar(char c) {
        return !Character.isWhitespace(c) && c != '(' && c != ')' && c != '[' && c != ']';
    }

    private static Token classify(String word, int position) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.startsWith("part.")) {
            String shortname = word.substring("part.".length());
            if (shortname.isEmpty()) {
                throw new FeeConditionException("Missing part shortname", position);
            }
            return new Token(TokenType.PART, shortname, position);
        }
        if (lower.startsWith("field.")) {
            String name = word.substring("field.".length());
            if (!FIELD_NAME.matcher(name).matches()) {
                throw new FeeConditionException("Invalid field name '" + name + "'", position);
            }
            return new Token(TokenType.FIELD, name, position);
        }
        return switch (lower) {
            case "and" -> new Token(TokenType.AND, word, position);
            case "or" -> new Token(TokenType.OR, word, position);
            case "xor" -> new Token(TokenType.XOR, word, position);
            case "not" -> new Token(TokenType.NOT, word, position);
            case "true" -> new Token(TokenType.TRUE, word, position);
            case "false" -> new Token(TokenType.FALSE, word, position);
            case "any_part", "all_parts", "is_member", "is_orga" -> new Token(TokenType.BOOL, lower, position);
            default -> throw new FeeConditionException("Unknown term '" + word + "'", position);
        };
    }

    private enum TokenType {
        LPAREN, RPAREN, AND, OR, XOR, NOT, TRUE, FALSE, BOOL, PART, FIELD, END
    }

    private record Token(TokenType type, String text, int position) {}
}
