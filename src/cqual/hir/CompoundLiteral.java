package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a compound literal <var>(type){ ... }</var>. Its only child is
* the brace-enclosed initializer list.
*/
public class CompoundLiteral extends Expression {

    private String type_name;

    private TypeStructure type;

    /**
    * Creates a compound literal.
    *
    * @param type_name the type name as written between the parentheses.
    * @param type the structure of the literal's type.
    * @param init the initializer list.
    */
    public CompoundLiteral(String type_name, TypeStructure type,
            ListInitializer init) {
        super(1);
        this.type_name = type_name;
        this.type = type;
        addChild(init);
    }

    /** Returns the type of the literal. */
    public TypeStructure getType() {
        return type;
    }

    public ListInitializer getInitializer() {
        return (ListInitializer)children.get(0);
    }

    protected void printExpression(PrintWriter o) {
        o.print("(");
        o.print(type_name);
        o.print(")");
        getInitializer().print(o);
    }

}
