package cqual.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Represents a sequence of expressions separated by the comma operator.
*/
public class CommaExpression extends Expression {

    public CommaExpression(List<Expression> exprs) {
        super(exprs.size());
        for (Expression e : exprs) {
            addChild(e);
        }
    }

    protected void printExpression(PrintWriter o) {
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                o.print(", ");
            }
            children.get(i).print(o);
        }
    }

}
