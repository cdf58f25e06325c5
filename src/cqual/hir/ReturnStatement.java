package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a return statement within a procedure.
*/
public class ReturnStatement extends Statement {

    /** Creates a "return nothing" statement. */
    public ReturnStatement() {
        super(0);
    }

    /**
    * Creates a statement that returns an expression.
    *
    * @param expr The expression to return.
    */
    public ReturnStatement(Expression expr) {
        super(1);
        addChild(expr);
    }

    /**
    * Returns the expression that is being returned by this statement,
    * or null if nothing is being returned.
    */
    public Expression getExpression() {
        return children.isEmpty() ? null : (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        o.print("return");
        if (!children.isEmpty()) {
            o.print(" ");
            children.get(0).print(o);
        }
        o.print(";");
    }

}
