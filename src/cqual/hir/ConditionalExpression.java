package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a conditional expression <var>cond ? a : b</var>.
*/
public class ConditionalExpression extends Expression {

    public ConditionalExpression(Expression condition, Expression true_expr,
                                 Expression false_expr) {
        super(3);
        addChild(condition);
        addChild(true_expr);
        addChild(false_expr);
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public Expression getTrueExpression() {
        return (Expression)children.get(1);
    }

    public Expression getFalseExpression() {
        return (Expression)children.get(2);
    }

    protected void printExpression(PrintWriter o) {
        getCondition().print(o);
        o.print(" ? ");
        getTrueExpression().print(o);
        o.print(" : ");
        getFalseExpression().print(o);
    }

}
