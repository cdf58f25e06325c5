package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a statement consisting of one expression.
*/
public class ExpressionStatement extends Statement {

    public ExpressionStatement(Expression expr) {
        super(1);
        addChild(expr);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        getExpression().print(o);
        o.print(";");
    }

}
