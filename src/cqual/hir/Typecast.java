package cqual.hir;

import java.io.PrintWriter;

/**
* Represents an explicit cast <var>(type) expr</var>.
*/
public class Typecast extends Expression {

    private String type_name;

    private TypeStructure type;

    /**
    * Creates a cast.
    *
    * @param type_name the type name as written between the parentheses.
    * @param type the structure of the target type.
    * @param expr the operand.
    */
    public Typecast(String type_name, TypeStructure type, Expression expr) {
        super(1);
        this.type_name = type_name;
        this.type = type;
        addChild(expr);
    }

    /** Returns the target type. */
    public TypeStructure getType() {
        return type;
    }

    /** Returns the operand. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    protected void printExpression(PrintWriter o) {
        o.print("(");
        o.print(type_name);
        o.print(")");
        getExpression().print(o);
    }

}
