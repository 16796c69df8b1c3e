package net.littleredcomputer.propcheck;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;

/**
 * An immutable propositional formula. The set of node kinds is closed: the only
 * subclasses are the nested {@link Constant}, {@link Variable}, {@link Not} and
 * {@link Binary}, and code that needs to take a formula apart does so through
 * {@link Visitor}, which must handle every kind.
 * <p>
 * Nodes own their children and compare by structure, so two parses of equivalent
 * text are {@code equals}.
 */
public abstract class Expr {
    private Expr() {}

    public interface Visitor<R> {
        R visitConstant(Constant c);
        R visitVariable(Variable v);
        R visitNot(Not n);
        R visitBinary(Binary b);
    }

    public abstract <R> R accept(Visitor<R> v);

    public enum Op {
        AND("&"),
        OR("|"),
        XOR("^"),
        IMPLIES("=>"),
        IFF("<=>");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    public static Constant constant(boolean value) { return value ? TRUE : FALSE; }
    public static Variable variable(int index) { return new Variable(index); }
    public static Not not(Expr operand) { return new Not(operand); }
    public static Binary binary(Op op, Expr left, Expr right) { return new Binary(op, left, right); }
    public static Binary and(Expr left, Expr right) { return new Binary(Op.AND, left, right); }
    public static Binary or(Expr left, Expr right) { return new Binary(Op.OR, left, right); }
    public static Binary xor(Expr left, Expr right) { return new Binary(Op.XOR, left, right); }
    public static Binary implies(Expr left, Expr right) { return new Binary(Op.IMPLIES, left, right); }
    public static Binary iff(Expr left, Expr right) { return new Binary(Op.IFF, left, right); }

    public static final class Constant extends Expr {
        private final boolean value;

        private Constant(boolean value) { this.value = value; }

        public boolean value() { return value; }

        @Override public <R> R accept(Visitor<R> v) { return v.visitConstant(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant && ((Constant) o).value == value;
        }

        @Override public int hashCode() { return Boolean.hashCode(value); }

        @Override public String toString() { return value ? "T" : "F"; }
    }

    /**
     * A reference to the variable occupying bit {@code index} of an assignment word.
     * The variable's name is kept by the {@link VariableRegistry} that issued the index.
     */
    public static final class Variable extends Expr {
        private final int index;

        private Variable(int index) {
            if (index < 0 || index >= VariableRegistry.MAX_VARIABLES) {
                throw new IllegalArgumentException("variable index out of range: " + index);
            }
            this.index = index;
        }

        public int index() { return index; }

        @Override public <R> R accept(Visitor<R> v) { return v.visitVariable(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && ((Variable) o).index == index;
        }

        @Override public int hashCode() { return 31 + index; }

        @Override public String toString() { return "#" + index; }
    }

    public static final class Not extends Expr {
        private final Expr operand;

        private Not(Expr operand) {
            this.operand = Preconditions.checkNotNull(operand, "operand");
        }

        public Expr operand() { return operand; }

        @Override public <R> R accept(Visitor<R> v) { return v.visitNot(this); }

        /** Number of directly nested negations, this one included, and the first operand that is not a negation. */
        private int depth() {
            int d = 1;
            for (Expr e = operand; e instanceof Not; e = ((Not) e).operand) ++d;
            return d;
        }

        private Expr innermost() {
            Expr e = operand;
            while (e instanceof Not) e = ((Not) e).operand;
            return e;
        }

        // Chains of negation are walked iteratively; a parsed line may nest thousands of them.
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Not)) return false;
            Not that = (Not) o;
            return depth() == that.depth() && innermost().equals(that.innermost());
        }

        @Override
        public int hashCode() {
            int h = innermost().hashCode();
            return depth() % 2 == 0 ? h : ~h;
        }

        @Override
        public String toString() {
            return Strings.repeat("!", depth()) + innermost();
        }
    }

    public static final class Binary extends Expr {
        private final Op op;
        private final Expr left;
        private final Expr right;

        private Binary(Op op, Expr left, Expr right) {
            this.op = Preconditions.checkNotNull(op, "op");
            this.left = Preconditions.checkNotNull(left, "left");
            this.right = Preconditions.checkNotNull(right, "right");
        }

        public Op op() { return op; }
        public Expr left() { return left; }
        public Expr right() { return right; }

        @Override public <R> R accept(Visitor<R> v) { return v.visitBinary(this); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return op == b.op && left.equals(b.left) && right.equals(b.right);
        }

        @Override public int hashCode() { return Objects.hash(op, left, right); }

        @Override public String toString() { return "(" + left + " " + op.symbol() + " " + right + ")"; }
    }
}
