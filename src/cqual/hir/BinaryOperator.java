package cqual.hir;

import java.io.PrintWriter;

/**
* Infix operators that act on two expressions. All possible operators are
* provided as static members.
*/
public class BinaryOperator implements Printable {

    /** * */
    public static final BinaryOperator MULTIPLY = new BinaryOperator("*");

    /** / */
    public static final BinaryOperator DIVIDE = new BinaryOperator("/");

    /** % */
    public static final BinaryOperator MODULUS = new BinaryOperator("%");

    /** + */
    public static final BinaryOperator ADD = new BinaryOperator("+");

    /** - */
    public static final BinaryOperator SUBTRACT = new BinaryOperator("-");

    /** &lt;&lt; */
    public static final BinaryOperator SHIFT_LEFT = new BinaryOperator("<<");

    /** &gt;&gt; */
    public static final BinaryOperator SHIFT_RIGHT = new BinaryOperator(">>");

    /** &lt; */
    public static final BinaryOperator COMPARE_LT = new BinaryOperator("<");

    /** &gt; */
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(">");

    /** &lt;= */
    public static final BinaryOperator COMPARE_LE = new BinaryOperator("<=");

    /** &gt;= */
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(">=");

    /** == */
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator("==");

    /** != */
    public static final BinaryOperator COMPARE_NE = new BinaryOperator("!=");

    /** &amp; */
    public static final BinaryOperator BITWISE_AND = new BinaryOperator("&");

    /** ^ */
    public static final BinaryOperator BITWISE_EXCLUSIVE_OR =
            new BinaryOperator("^");

    /** | */
    public static final BinaryOperator BITWISE_INCLUSIVE_OR =
            new BinaryOperator("|");

    /** &amp;&amp; */
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator("&&");

    /** || */
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator("||");

    /** The written form of the operator. */
    protected final String name;

    /**
    * Used internally and by derived operator classes -- arbitrary operators
    * may not be created.
    *
    * @param name the written form.
    */
    protected BinaryOperator(String name) {
        this.name = name;
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public String toString() {
        return name;
    }

}
