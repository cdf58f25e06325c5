package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a while loop.
*/
public class WhileLoop extends Statement {

    public WhileLoop(Expression condition, Statement body) {
        super(2);
        addChild(condition);
        addChild(body);
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public Statement getBody() {
        return (Statement)children.get(1);
    }

    public void print(PrintWriter o) {
        o.print("while (");
        getCondition().print(o);
        o.println(")");
        getBody().print(o);
    }

}
