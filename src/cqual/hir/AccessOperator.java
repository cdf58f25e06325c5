package cqual.hir;

/**
* Operators that select a member of a struct or union.
*/
public class AccessOperator extends BinaryOperator {

    /** . */
    public static final AccessOperator MEMBER_ACCESS = new AccessOperator(".");

    /** -&gt; */
    public static final AccessOperator POINTER_ACCESS = new AccessOperator("->");

    private AccessOperator(String name) {
        super(name);
    }

}
