package cqual.hir;

import java.io.PrintWriter;

/**
* Represents an array subscript <var>array[index]</var>.
*/
public class ArrayAccess extends Expression {

    public ArrayAccess(Expression array, Expression index) {
        super(2);
        addChild(array);
        addChild(index);
    }

    /** Returns the subscripted expression. */
    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    /** Returns the index expression. */
    public Expression getIndex() {
        return (Expression)children.get(1);
    }

    protected void printExpression(PrintWriter o) {
        getArrayName().print(o);
        o.print("[");
        getIndex().print(o);
        o.print("]");
    }

}
