package cqual.hir;

import java.io.PrintWriter;

/** Represents a break statement. */
public class BreakStatement extends Statement {

    public BreakStatement() {
        super(-1);
    }

    public void print(PrintWriter o) {
        o.print("break;");
    }

}
