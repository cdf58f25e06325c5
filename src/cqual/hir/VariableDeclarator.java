package cqual.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declarator of a variable, parameter, field or function. A
* declarator whose top type layer is a function lists its named parameters as
* child declarations, followed by its initializer if it has one.
*/
public class VariableDeclarator implements Symbol, Traversable {

    private Traversable parent;

    private List<Traversable> children;

    private int id;

    private String name;

    /** The declarator text as written, without the initializer */
    private String text;

    private TypeStructure type;

    private int line;

    private boolean primary;

    private Symbol previous;

    private int num_params;

    /**
    * Creates a declarator.
    *
    * @param id the program-wide id.
    * @param name the declared name; empty for an unnamed parameter.
    * @param text the declarator as written.
    * @param type the full type of the declared name.
    * @param line the line of the name.
    * @param primary true if declared in the primary file.
    */
    public VariableDeclarator(int id, String name, String text,
            TypeStructure type, int line, boolean primary) {
        this.id = id;
        this.name = name;
        this.text = text;
        this.type = type;
        this.line = line;
        this.primary = primary;
        children = new ArrayList<Traversable>(1);
        num_params = 0;
    }

    private void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(name);
        }
        children.add(t);
        t.setParent(this);
    }

    /**
    * Appends a parameter declaration. Parameters precede the initializer.
    *
    * @param param a declaration with exactly one declarator.
    */
    public void addParameter(VariableDeclaration param) {
        if (getInitializer() != null) {
            throw new IllegalStateException(
                    "parameter added after initializer of " + name);
        }
        addChild(param);
        num_params++;
    }

    /** Returns the parameter declarators in position order. */
    public List<VariableDeclarator> getParameters() {
        List<VariableDeclarator> ret =
                new ArrayList<VariableDeclarator>(num_params);
        for (int i = 0; i < num_params; i++) {
            ret.add(((VariableDeclaration)children.get(i)).getDeclarator(0));
        }
        return ret;
    }

    /** Returns the initializer, or null. */
    public Initializer getInitializer() {
        if (children.size() > num_params) {
            return (Initializer)children.get(num_params);
        }
        return null;
    }

    /**
    * Attaches the initializer.
    *
    * @param init the initializer.
    * @throws IllegalStateException if an initializer is present.
    */
    public void setInitializer(Initializer init) {
        if (getInitializer() != null) {
            throw new IllegalStateException(name + " is already initialized");
        }
        addChild(init);
    }

    /** Checks if this declarator names a typedef. */
    public boolean isTypedef() {
        return (parent instanceof VariableDeclaration &&
                ((VariableDeclaration)parent).isTypedef());
    }

    /**
    * Links this declarator to an earlier declaration of the same entity.
    *
    * @param prev the earlier declarator.
    */
    public void setPreviousDeclaration(Symbol prev) {
        previous = prev;
    }

    /* Symbol interface */
    public int getId() {
        return id;
    }

    /* Symbol interface */
    public String getSymbolName() {
        return name;
    }

    /* Symbol interface */
    public TypeStructure getTypeStructure() {
        return type;
    }

    /* Symbol interface */
    public Declaration getDeclaration() {
        Traversable t = parent;
        while (t != null && !(t instanceof Declaration)) {
            t = t.getParent();
        }
        return (Declaration)t;
    }

    /* Symbol interface */
    public int getLine() {
        return line;
    }

    /* Symbol interface */
    public boolean isInPrimaryFile() {
        return primary;
    }

    /* Symbol interface */
    public Symbol getPreviousDeclaration() {
        return previous;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        if (t != null && !t.getChildren().contains(this)) {
            throw new NotAChildException();
        }
        parent = t;
    }

    public void print(PrintWriter o) {
        o.print(text);
        Initializer init = getInitializer();
        if (init != null) {
            o.print(" = ");
            init.print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
