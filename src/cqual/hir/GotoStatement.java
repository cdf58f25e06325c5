package cqual.hir;

import java.io.PrintWriter;

/** Represents a goto statement. */
public class GotoStatement extends Statement {

    private String target;

    public GotoStatement(String target) {
        super(-1);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }

    public void print(PrintWriter o) {
        o.print("goto ");
        o.print(target);
        o.print(";");
    }

}
