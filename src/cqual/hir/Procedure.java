package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a function definition: a declarator with a function type followed
* by a body.
*/
public class Procedure extends Declaration {

    private String specifiers;

    public Procedure(String specifiers, VariableDeclarator declarator,
                     CompoundStatement body) {
        super(2);
        this.specifiers = specifiers;
        addChild(declarator);
        addChild(body);
    }

    public VariableDeclarator getDeclarator() {
        return (VariableDeclarator)children.get(0);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    public String getName() {
        return getDeclarator().getSymbolName();
    }

    public String getSpecifiers() {
        return specifiers;
    }

    public void print(PrintWriter o) {
        o.print(specifiers);
        o.print(" ");
        getDeclarator().print(o);
        o.println();
        getBody().print(o);
    }

}
