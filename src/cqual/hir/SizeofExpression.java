package cqual.hir;

import java.io.PrintWriter;

/**
* Represents <var>sizeof expr</var> or <var>sizeof(type)</var>.
*/
public class SizeofExpression extends Expression {

    private String type_name;

    /** Creates a sizeof of an expression. */
    public SizeofExpression(Expression expr) {
        super(1);
        addChild(expr);
    }

    /** Creates a sizeof of a type name. */
    public SizeofExpression(String type_name) {
        super(-1);
        this.type_name = type_name;
    }

    /**
    * Returns the operand expression.
    *
    * @return the operand, or null for the type form.
    */
    public Expression getExpression() {
        return children.isEmpty() ? null : (Expression)children.get(0);
    }

    protected void printExpression(PrintWriter o) {
        o.print("sizeof");
        if (type_name != null) {
            o.print("(");
            o.print(type_name);
            o.print(")");
        } else {
            o.print(" ");
            getExpression().print(o);
        }
    }

}
