package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a struct or union. A record is created when its tag is first
* mentioned and is completed when its body is parsed; only completed records
* appear in the IR tree.
*/
public class ClassDeclaration extends Declaration {

    private boolean is_union;

    private String name;

    private boolean complete;

    /**
    * Creates an incomplete record.
    *
    * @param is_union true for a union, false for a struct.
    * @param name the tag, or null for an anonymous record.
    */
    public ClassDeclaration(boolean is_union, String name) {
        super(4);
        this.is_union = is_union;
        this.name = name;
        complete = false;
    }

    /**
    * Appends a member declaration. Nested record definitions are members too
    * but contribute no fields.
    *
    * @param decl the member declaration.
    */
    public void addDeclaration(Declaration decl) {
        addChild(decl);
    }

    /** Marks the body as parsed. */
    public void setComplete() {
        complete = true;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isUnion() {
        return is_union;
    }

    /** Returns the tag, or null. */
    public String getName() {
        return name;
    }

    /** Returns the field declarators in declaration order. */
    public List<VariableDeclarator> getFields() {
        List<VariableDeclarator> ret = new ArrayList<VariableDeclarator>();
        for (Traversable t : children) {
            if (t instanceof VariableDeclaration) {
                ret.addAll(((VariableDeclaration)t).getDeclarators());
            }
        }
        return ret;
    }

    /**
    * Looks up a field by name.
    *
    * @param field_name the field name.
    * @return the field declarator, or null.
    */
    public VariableDeclarator findField(String field_name) {
        for (VariableDeclarator field : getFields()) {
            if (field.getSymbolName().equals(field_name)) {
                return field;
            }
        }
        return null;
    }

    public void print(PrintWriter o) {
        o.print(is_union ? "union" : "struct");
        if (name != null) {
            o.print(" ");
            o.print(name);
        }
        o.println(" {");
        for (Traversable t : children) {
            t.print(o);
            o.println();
        }
        o.print("};");
    }

}
