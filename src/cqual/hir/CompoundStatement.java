package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a block of statements enclosed in braces.
*/
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super(4);
    }

    /**
    * Appends a statement to the block.
    *
    * @param stmt the statement to add.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    public void print(PrintWriter o) {
        o.println("{");
        for (Traversable t : children) {
            t.print(o);
            o.println();
        }
        o.print("}");
    }

}
