package cqual.hir;

/**
* Infix operators that assign a value to a location.
*/
public class AssignmentOperator extends BinaryOperator {

    /** = */
    public static final AssignmentOperator NORMAL = new AssignmentOperator("=");

    /** += */
    public static final AssignmentOperator ADD = new AssignmentOperator("+=");

    /** -= */
    public static final AssignmentOperator SUBTRACT =
            new AssignmentOperator("-=");

    /** *= */
    public static final AssignmentOperator MULTIPLY =
            new AssignmentOperator("*=");

    /** /= */
    public static final AssignmentOperator DIVIDE = new AssignmentOperator("/=");

    /** %= */
    public static final AssignmentOperator MODULUS =
            new AssignmentOperator("%=");

    /** &lt;&lt;= */
    public static final AssignmentOperator SHIFT_LEFT =
            new AssignmentOperator("<<=");

    /** &gt;&gt;= */
    public static final AssignmentOperator SHIFT_RIGHT =
            new AssignmentOperator(">>=");

    /** &amp;= */
    public static final AssignmentOperator BITWISE_AND =
            new AssignmentOperator("&=");

    /** ^= */
    public static final AssignmentOperator BITWISE_EXCLUSIVE_OR =
            new AssignmentOperator("^=");

    /** |= */
    public static final AssignmentOperator BITWISE_INCLUSIVE_OR =
            new AssignmentOperator("|=");

    private AssignmentOperator(String name) {
        super(name);
    }

}
