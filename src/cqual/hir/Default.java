package cqual.hir;

import java.io.PrintWriter;

/** Represents the default label of a switch body. */
public class Default extends Statement {

    public Default() {
        super(-1);
    }

    public void print(PrintWriter o) {
        o.print("default:");
    }

}
