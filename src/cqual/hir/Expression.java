package cqual.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions. Every expression carries an integer id that
* is assigned once by the parser and is unique within its {@link Program};
* analyses key their side tables by this id instead of by object identity.
*/
public abstract class Expression implements Traversable {

    /** Empty child list for expressions having no children */
    protected static final List<Traversable> empty_list =
            Collections.unmodifiableList(new ArrayList<Traversable>(0));

    /** The parent object of the expression */
    protected Traversable parent;

    /** All children are Expressions, except the list of a CompoundLiteral. */
    protected List<Traversable> children;

    /**
    * Determines whether this expression was written with a set of parentheses
    * around it. Parentheses do not create a separate IR node.
    */
    protected boolean needs_parens;

    /** The id assigned at parse time; -1 until assigned. */
    private int id;

    /**
    * Constructor for derived classes.
    *
    * @param size The initial size for the child list; a negative size
    *   selects the shared empty list.
    */
    protected Expression(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
        needs_parens = false;
        id = -1;
    }

    /**
    * Adds the specified expression as the last child.
    *
    * @param child the new child.
    * @throws NotAnOrphanException if <b>child</b> has a parent.
    */
    protected void addChild(Traversable child) {
        if (child.getParent() != null) {
            throw new NotAnOrphanException(child.toString());
        }
        children.add(child);
        child.setParent(this);
    }

    /**
    * Returns the id of this expression.
    *
    * @return the id, or -1 if the expression has not been numbered.
    */
    public int getId() {
        return id;
    }

    /**
    * Assigns the id of this expression. Ids are assigned once.
    *
    * @param id the new id.
    * @throws IllegalStateException if the expression already has an id.
    */
    public void setId(int id) {
        if (this.id >= 0) {
            throw new IllegalStateException("expression " + this +
                                            " is already numbered " + this.id);
        }
        this.id = id;
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        if (t != null && !t.getChildren().contains(this)) {
            throw new NotAChildException();
        }
        parent = t;
    }

    /**
    * Get the parent Statement containing this Expression.
    *
    * @return the enclosing Statement or null if this Expression
    *   is not inside a Statement.
    */
    public Statement getStatement() {
        Traversable t = this;
        do {
            t = t.getParent();
        } while (t != null && !(t instanceof Statement));
        return (Statement)t;
    }

    /**
    * Sets the parenthesization flag.
    *
    * @param f true if the expression was written in parentheses.
    */
    public void setParens(boolean f) {
        needs_parens = f;
    }

    /** Prints the expression with its parentheses, if any. */
    public void print(PrintWriter o) {
        if (needs_parens) {
            o.print("(");
        }
        printExpression(o);
        if (needs_parens) {
            o.print(")");
        }
    }

    /**
    * Prints the expression itself, without the enclosing parentheses.
    *
    * @param o the target writer.
    */
    protected abstract void printExpression(PrintWriter o);

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
