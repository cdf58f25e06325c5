package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a numeric, character or string literal, kept as written.
*/
public class Literal extends Expression {

    private String text;

    public Literal(String text) {
        super(-1);
        this.text = text;
    }

    /** Returns the literal as written in the source. */
    public String getText() {
        return text;
    }

    protected void printExpression(PrintWriter o) {
        o.print(text);
    }

}
