package cqual.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all statements.
* Statement is the base class of numerous specific statement classes.
*/
public abstract class Statement implements Traversable {

    /** The parent traversable object */
    protected Traversable parent;

    /** The list of children of the statement; optional parts may be null. */
    protected List<Traversable> children;

    /** The position of the statement */
    protected int line_number = -1;

    /** Empty child list for statements with no child */
    protected static final List<Traversable> empty_list =
            Collections.unmodifiableList(new ArrayList<Traversable>(0));

    /** Constructor for derived classes. */
    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Constructor for derived classes that preallocates
    * space for multiple children.
    *
    * @param size The expected number of children for this statement.
    */
    protected Statement(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
    }

    /**
    * Appends a child, which may be null for an omitted optional part.
    *
    * @param t the new child.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t != null && t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        if (t != null) {
            t.setParent(this);
        }
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
    * Returns the procedure in which this statement is located.
    *
    * @return the procedure in which this statement is located,
    *   or null if it is not in a procedure.
    */
    public Procedure getProcedure() {
        Traversable p = getParent();
        while (p != null) {
            if (p instanceof Procedure) {
                return (Procedure)p;
            } else {
                p = p.getParent();
            }
        }
        return null;
    }

    /** Returns the source line of the statement, or -1 if unknown. */
    public int getLineNumber() {
        return line_number;
    }

    /** Sets the source line of the statement. */
    public void setLineNumber(int line) {
        line_number = line;
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
