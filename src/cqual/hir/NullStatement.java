package cqual.hir;

import java.io.PrintWriter;

/** Represents an empty statement. */
public class NullStatement extends Statement {

    public NullStatement() {
        super(-1);
    }

    public void print(PrintWriter o) {
        o.print(";");
    }

}
