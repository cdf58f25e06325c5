package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a do-while loop.
*/
public class DoLoop extends Statement {

    public DoLoop(Statement body, Expression condition) {
        super(2);
        addChild(body);
        addChild(condition);
    }

    public Statement getBody() {
        return (Statement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        o.println("do");
        getBody().print(o);
        o.print(" while (");
        getCondition().print(o);
        o.print(");");
    }

}
