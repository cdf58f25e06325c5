package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a single source file and the declarations it contains. The unit
* keeps the original text so transformations can rewrite it by offset.
*/
public class TranslationUnit implements Traversable {

    private Traversable parent;

    private List<Traversable> children;

    private String file_name;

    private String source;

    /**
    * Creates an empty translation unit.
    *
    * @param file_name the name of the source file.
    * @param source the complete source text.
    */
    public TranslationUnit(String file_name, String source) {
        this.file_name = file_name;
        this.source = source;
        children = new ArrayList<Traversable>();
    }

    /**
    * Appends a file-scope declaration.
    *
    * @param decl the declaration.
    */
    public void addDeclaration(Declaration decl) {
        if (decl.getParent() != null) {
            throw new NotAnOrphanException(file_name);
        }
        children.add(decl);
        decl.setParent(this);
    }

    /** Returns the declarations in source order. */
    public List<Declaration> getDeclarations() {
        List<Declaration> ret = new ArrayList<Declaration>(children.size());
        for (Traversable t : children) {
            ret.add((Declaration)t);
        }
        return ret;
    }

    public String getInputFilename() {
        return file_name;
    }

    public String getSource() {
        return source;
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
        PrintTools.printlnList(children, o);
    }

}
