package cqual.hir;

import java.io.PrintWriter;

/**
* Represents an expression having a unary operator and an operand expression.
*/
public class UnaryExpression extends Expression {

    /** The unary operator of the expression */
    protected UnaryOperator op;

    /**
    * Constructs a unary expression with the specified operator and expression.
    *
    * @param op the unary operator.
    * @param expr the operand expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        this.op = op;
        addChild(expr);
    }

    /** Returns the operand expression. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /** Returns the operator of the expression. */
    public UnaryOperator getOperator() {
        return op;
    }

    protected void printExpression(PrintWriter o) {
        if (op.isPostfix()) {
            getExpression().print(o);
            op.print(o);
        } else {
            op.print(o);
            getExpression().print(o);
        }
    }

}
