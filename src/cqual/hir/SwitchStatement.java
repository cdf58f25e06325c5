package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a switch statement.
*/
public class SwitchStatement extends Statement {

    public SwitchStatement(Expression value, Statement body) {
        super(2);
        addChild(value);
        addChild(body);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public Statement getBody() {
        return (Statement)children.get(1);
    }

    public void print(PrintWriter o) {
        o.print("switch (");
        getExpression().print(o);
        o.println(")");
        getBody().print(o);
    }

}
