package cqual.hir;

import java.io.PrintWriter;

/**
* Operators that act on a single expression. All possible operators are
* provided as static members.
*/
public class UnaryOperator implements Printable {

    /** &amp; */
    public static final UnaryOperator ADDRESS_OF = new UnaryOperator("&", false);

    /** ~ */
    public static final UnaryOperator BITWISE_COMPLEMENT =
            new UnaryOperator("~", false);

    /** * */
    public static final UnaryOperator DEREFERENCE =
            new UnaryOperator("*", false);

    /** ! */
    public static final UnaryOperator LOGICAL_NEGATION =
            new UnaryOperator("!", false);

    /** - */
    public static final UnaryOperator MINUS = new UnaryOperator("-", false);

    /** + */
    public static final UnaryOperator PLUS = new UnaryOperator("+", false);

    /** -- (prefix) */
    public static final UnaryOperator PRE_DECREMENT =
            new UnaryOperator("--", false);

    /** ++ (prefix) */
    public static final UnaryOperator PRE_INCREMENT =
            new UnaryOperator("++", false);

    /** -- (postfix) */
    public static final UnaryOperator POST_DECREMENT =
            new UnaryOperator("--", true);

    /** ++ (postfix) */
    public static final UnaryOperator POST_INCREMENT =
            new UnaryOperator("++", true);

    private final String name;

    private final boolean postfix;

    private UnaryOperator(String name, boolean postfix) {
        this.name = name;
        this.postfix = postfix;
    }

    /** Checks if the operator is written after its operand. */
    public boolean isPostfix() {
        return postfix;
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public String toString() {
        return name;
    }

}
