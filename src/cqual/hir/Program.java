package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents the entire program: the root of the IR tree. The program also
* hands out the ids of expressions and declarators.
*/
public class Program implements Traversable {

    private List<Traversable> children;

    private int next_id;

    public Program() {
        children = new ArrayList<Traversable>(1);
        next_id = 0;
    }

    /**
    * Adds a translation unit to the program.
    *
    * @param tunit the parsed unit.
    */
    public void addTranslationUnit(TranslationUnit tunit) {
        if (tunit.getParent() != null) {
            throw new NotAnOrphanException(tunit.getInputFilename());
        }
        children.add(tunit);
        tunit.setParent(this);
    }

    /** Returns the translation units in the order they were added. */
    public List<TranslationUnit> getTranslationUnits() {
        List<TranslationUnit> ret =
                new ArrayList<TranslationUnit>(children.size());
        for (Traversable t : children) {
            ret.add((TranslationUnit)t);
        }
        return ret;
    }

    /** Returns a fresh id, increasing in allocation order. */
    public int nextId() {
        return next_id++;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return null;
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException(
                "Program is the root of the IR and has no parent");
    }

    public void print(PrintWriter o) {
        PrintTools.printlnList(children, o);
    }

}
