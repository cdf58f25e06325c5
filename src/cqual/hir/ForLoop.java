package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a for loop. The initial statement is an expression statement, a
* declaration statement or null; the condition and step may be null.
*/
public class ForLoop extends Statement {

    public ForLoop(Statement init, Expression condition, Expression step,
                   Statement body) {
        super(4);
        addChild(init);
        addChild(condition);
        addChild(step);
        addChild(body);
    }

    public Statement getInitialStatement() {
        return (Statement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public Expression getStep() {
        return (Expression)children.get(2);
    }

    public Statement getBody() {
        return (Statement)children.get(3);
    }

    public void print(PrintWriter o) {
        o.print("for (");
        if (getInitialStatement() != null) {
            getInitialStatement().print(o);
        } else {
            o.print(";");
        }
        o.print(" ");
        if (getCondition() != null) {
            getCondition().print(o);
        }
        o.print("; ");
        if (getStep() != null) {
            getStep().print(o);
        }
        o.println(")");
        getBody().print(o);
    }

}
