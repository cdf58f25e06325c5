package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declaration of one or more variables, fields, parameters,
* function prototypes or typedef names sharing the same specifiers.
*/
public class VariableDeclaration extends Declaration {

    /** Declaration specifiers as written */
    private String specifiers;

    private boolean is_typedef;

    /**
    * Creates an empty declaration.
    *
    * @param specifiers the specifier text as written.
    * @param is_typedef true for a typedef declaration.
    */
    public VariableDeclaration(String specifiers, boolean is_typedef) {
        super(1);
        this.specifiers = specifiers;
        this.is_typedef = is_typedef;
    }

    /**
    * Appends a declarator.
    *
    * @param decl the new declarator.
    */
    public void addDeclarator(VariableDeclarator decl) {
        addChild(decl);
    }

    /** Returns the declarators in written order. */
    public List<VariableDeclarator> getDeclarators() {
        List<VariableDeclarator> ret =
                new ArrayList<VariableDeclarator>(children.size());
        for (Traversable t : children) {
            ret.add((VariableDeclarator)t);
        }
        return ret;
    }

    /** Returns the declarator at position <b>i</b>. */
    public VariableDeclarator getDeclarator(int i) {
        return (VariableDeclarator)children.get(i);
    }

    /** Returns the number of declarators. */
    public int getNumDeclarators() {
        return children.size();
    }

    public String getSpecifiers() {
        return specifiers;
    }

    /** Checks if this declaration introduces typedef names. */
    public boolean isTypedef() {
        return is_typedef;
    }

    public void print(PrintWriter o) {
        o.print(specifiers);
        if (!children.isEmpty()) {
            o.print(" ");
            PrintTools.printListWithComma(children, o);
        }
        if (!(parent instanceof VariableDeclarator)) {
            o.print(";");
        }
    }

}
