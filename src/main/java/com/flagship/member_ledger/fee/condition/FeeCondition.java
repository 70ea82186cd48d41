package com.flagship.member_ledger.fee.condition;

import java.util.Locale;
import java.util.Set;

/**
 * Compiled fee condition.
 *
 * A condition string is parsed once (when the fee definition is saved or loaded) into
 * this tree and then evaluated by plain traversal. Evaluation is side-effect free and
 * never fails: unknown references are rejected at save time, and at evaluation time a
 * reference missing from the context simply evaluates to false.
 *
 * Node types:
 * - {@link And}, {@link Or}, {@link Xor}, {@link Not}
 * - {@link PartRef} ({@code part.<shortname>}), {@link FieldRef} ({@code field.<name>})
 * - {@link BoolRef} ({@code any_part}, {@code all_parts}, {@code is_member}, {@code is_orga})
 * - {@link Literal} ({@code true}, {@code false})
 */
public interface FeeCondition {

    /** Condition of an unconditional fee. */
    FeeCondition ALWAYS = new Literal(true);

    boolean evaluate(FeeContext context);

    /**
     * Adds every referenced field name and part shortname to the given sets.
     */
    void collectReferences(Set<String> fields, Set<String> parts);

    /** Binding strength used when serializing; atoms bind tightest. */
    int precedence();

    void appendTo(StringBuilder out);

    /**
     * Normalized textual form. Parsing the result yields an equivalent condition.
     */
    default String toConditionString() {
        StringBuilder out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }

    int PRECEDENCE_OR = 1;
    int PRECEDENCE_XOR = 2;
    int PRECEDENCE_AND = 3;
    int PRECEDENCE_NOT = 4;
    int PRECEDENCE_ATOM = 5;

    record And(FeeCondition left, FeeCondition right) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return left.evaluate(context) && right.evaluate(context);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            left.collectReferences(fields, parts);
            right.collectReferences(fields, parts);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_AND;
        }

        @Override
        public void appendTo(StringBuilder out) {
            appendBinary(out, this, left, "and", right);
        }
    }

    record Or(FeeCondition left, FeeCondition right) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return left.evaluate(context) || right.evaluate(context);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            left.collectReferences(fields, parts);
            right.collectReferences(fields, parts);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_OR;
        }

        @Override
        public void appendTo(StringBuilder out) {
            appendBinary(out, this, left, "or", right);
        }
    }

    record Xor(FeeCondition left, FeeCondition right) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return left.evaluate(context) ^ right.evaluate(context);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            left.collectReferences(fields, parts);
            right.collectReferences(fields, parts);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_XOR;
        }

        @Override
        public void appendTo(StringBuilder out) {
            appendBinary(out, this, left, "xor", right);
        }
    }

    record Not(FeeCondition operand) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return !operand.evaluate(context);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            operand.collectReferences(fields, parts);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_NOT;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append("not ");
            appendOperand(out, operand, operand.precedence() < PRECEDENCE_NOT);
        }
    }

    record PartRef(String shortname) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return context.isPartPresent(shortname);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            parts.add(shortname);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_ATOM;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append("part.").append(shortname);
        }
    }

    record FieldRef(String name) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return context.isFieldSet(name);
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            fields.add(name);
        }

        @Override
        public int precedence() {
            return PRECEDENCE_ATOM;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append("field.").append(name);
        }
    }

    record BoolRef(Name name) implements FeeCondition {

        public enum Name {
            ANY_PART,
            ALL_PARTS,
            IS_MEMBER,
            IS_ORGA;

            public String keyword() {
                return name().toLowerCase(Locale.ROOT);
            }
        }

        @Override
        public boolean evaluate(FeeContext context) {
            return switch (name) {
                case ANY_PART -> context.isAnyPart();
                case ALL_PARTS -> context.isAllParts();
                case IS_MEMBER -> context.isMember();
                case IS_ORGA -> context.isOrga();
            };
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            // context flags are always known
        }

        @Override
        public int precedence() {
            return PRECEDENCE_ATOM;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append(name.keyword());
        }
    }

    record Literal(boolean value) implements FeeCondition {
        @Override
        public boolean evaluate(FeeContext context) {
            return value;
        }

        @Override
        public void collectReferences(Set<String> fields, Set<String> parts) {
            // nothing referenced
        }

        @Override
        public int precedence() {
            return PRECEDENCE_ATOM;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append(value ? "true" : "false");
        }
    }

    private static void appendBinary(StringBuilder out, FeeCondition self,
                                     FeeCondition left, String operator, FeeCondition right) {
        appendOperand(out, left, needsParentheses(self, left));
        out.append(' ').append(operator).append(' ');
        appendOperand(out, right, needsParentheses(self, right));
    }

    // A binary child keeps its parentheses unless it is the same operator.
    private static boolean needsParentheses(FeeCondition parent, FeeCondition child) {
        return child.precedence() < PRECEDENCE_NOT && child.getClass() != parent.getClass();
    }

    private static void appendOperand(StringBuilder out, FeeCondition operand, boolean parenthesize) {
        if (parenthesize) {
            out.append('(');
            operand.appendTo(out);
            out.append(')');
        } else {
            operand.appendTo(out);
        }
    }
}
