package cqual.hir;

import java.io.PrintWriter;

/** Represents a named label. */
public class Label extends Statement {

    private String name;

    public Label(String name) {
        super(-1);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void print(PrintWriter o) {
        o.print(name);
        o.print(":");
    }

}
