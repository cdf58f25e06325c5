package cqual.hir;

import java.io.PrintWriter;

/**
* Represents an if statement with an optional else part.
*/
public class IfStatement extends Statement {

    public IfStatement(Expression condition, Statement then_stmt,
                       Statement else_stmt) {
        super(3);
        addChild(condition);
        addChild(then_stmt);
        addChild(else_stmt);
    }

    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    public Statement getThenStatement() {
        return (Statement)children.get(1);
    }

    /** Returns the else part, or null. */
    public Statement getElseStatement() {
        return (Statement)children.get(2);
    }

    public void print(PrintWriter o) {
        o.print("if (");
        getControlExpression().print(o);
        o.println(")");
        getThenStatement().print(o);
        if (getElseStatement() != null) {
            o.println();
            o.println("else");
            getElseStatement().print(o);
        }
    }

}
