package cqual.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Base class of declarator initializers. An initializer inside a brace list
* may carry a designator such as <var>.field</var> or <var>[2]</var>.
*/
public abstract class Initializer implements Traversable {

    protected Traversable parent;

    protected List<Traversable> children;

    private String designator;

    protected Initializer(int size) {
        parent = null;
        children = new ArrayList<Traversable>(size);
        designator = null;
    }

    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /** Returns the designator text, or null if none was written. */
    public String getDesignator() {
        return designator;
    }

    public void setDesignator(String designator) {
        this.designator = designator;
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
        if (designator != null) {
            o.print(designator);
            o.print(" = ");
        }
        printInitializer(o);
    }

    protected abstract void printInitializer(PrintWriter o);

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
