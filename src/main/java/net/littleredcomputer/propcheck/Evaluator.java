package net.littleredcomputer.propcheck;

/**
 * Evaluates a formula under one assignment, where bit i of the assignment word is the
 * truth value of variable i.
 */
public final class Evaluator implements Expr.Visitor<Boolean> {
    private final int assignment;

    private Evaluator(int assignment) {
        this.assignment = assignment;
    }

    public static boolean evaluate(Expr e, int assignment) {
        return e.accept(new Evaluator(assignment));
    }

    @Override
    public Boolean visitConstant(Expr.Constant c) {
        return c.value();
    }

    @Override
    public Boolean visitVariable(Expr.Variable v) {
        return ((assignment >>> v.index()) & 1) != 0;
    }

    @Override
    public Boolean visitNot(Expr.Not n) {
        boolean negate = true;
        Expr e = n.operand();
        while (e instanceof Expr.Not) {
            negate = !negate;
            e = ((Expr.Not) e).operand();
        }
        return e.accept(this) != negate;
    }

    @Override
    public Boolean visitBinary(Expr.Binary b) {
        boolean l = b.left().accept(this);
        boolean r = b.right().accept(this);
        switch (b.op()) {
            case AND: return l && r;
            case OR: return l || r;
            case XOR: return l ^ r;
            case IMPLIES: return !(l && !r);
            case IFF: return l == r;
            default: throw new AssertionError("unhandled operator " + b.op());
        }
    }
}
