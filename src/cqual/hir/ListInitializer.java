package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/** A brace-enclosed list of initializers. */
public class ListInitializer extends Initializer {

    public ListInitializer(List<Initializer> elements) {
        super(elements.size());
        for (Initializer init : elements) {
            addChild(init);
        }
    }

    /** Returns the elements in written order. */
    public List<Initializer> getElements() {
        List<Initializer> ret = new ArrayList<Initializer>(children.size());
        for (Traversable t : children) {
            ret.add((Initializer)t);
        }
        return ret;
    }

    /** Checks if any element carries a designator. */
    public boolean hasDesignators() {
        for (Traversable t : children) {
            if (((Initializer)t).getDesignator() != null) {
                return true;
            }
        }
        return false;
    }

    protected void printInitializer(PrintWriter o) {
        o.print("{");
        PrintTools.printListWithComma(children, o);
        o.print("}");
    }

}
