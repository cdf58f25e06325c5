package cqual.hir;

import java.io.PrintWriter;

/**
* Represents an expression having an infix operator and two operand
* expressions.
*/
public class BinaryExpression extends Expression {

    /** The operator of the expression */
    protected BinaryOperator op;

    /**
    * Constructs a binary expression with the specified operands and operator.
    *
    * @param lhs the left operand.
    * @param op the operator.
    * @param rhs the right operand.
    * @throws NotAnOrphanException if an operand has a parent.
    */
    public BinaryExpression(Expression lhs, BinaryOperator op, Expression rhs) {
        super(2);
        this.op = op;
        addChild(lhs);
        addChild(rhs);
    }

    /** Returns the left operand. */
    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    /** Returns the right operand. */
    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    /** Returns the operator of the expression. */
    public BinaryOperator getOperator() {
        return op;
    }

    protected void printExpression(PrintWriter o) {
        getLHS().print(o);
        o.print(" ");
        op.print(o);
        o.print(" ");
        getRHS().print(o);
    }

}
