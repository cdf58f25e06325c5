package cqual.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all declarations.
*/
public abstract class Declaration implements Traversable {

    /** The parent object */
    protected Traversable parent;

    /** The children of the declaration */
    protected List<Traversable> children;

    /** Empty child list for declarations with no child */
    protected static final List<Traversable> empty_list =
            Collections.unmodifiableList(new ArrayList<Traversable>(0));

    /** Constructor for derived classes. */
    protected Declaration() {
        this(1);
    }

    /**
    * Constructor for derived classes that preallocates space for children.
    *
    * @param size the expected number of children; negative for none.
    */
    protected Declaration(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
    }

    /**
    * Appends a child.
    *
    * @param t the new child.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        t.setParent(this);
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

    /**
    * Returns the translation unit that contains this declaration.
    *
    * @return the translation unit, or null for a detached declaration.
    */
    public TranslationUnit getTranslationUnit() {
        return IRTools.getAncestorOfType(this, TranslationUnit.class);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
