package cqual.hir;

import java.io.PrintWriter;

/** An initializer consisting of one expression. */
public class ValueInitializer extends Initializer {

    public ValueInitializer(Expression value) {
        super(1);
        addChild(value);
    }

    public Expression getValue() {
        return (Expression)children.get(0);
    }

    protected void printInitializer(PrintWriter o) {
        getValue().print(o);
    }

}
