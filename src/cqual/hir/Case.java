package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a case label inside a switch body.
*/
public class Case extends Statement {

    public Case(Expression value) {
        super(1);
        addChild(value);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        o.print("case ");
        getExpression().print(o);
        o.print(":");
    }

}
