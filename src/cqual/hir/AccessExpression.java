package cqual.hir;

import java.io.PrintWriter;

/**
* Represents a member access <var>base.member</var> or
* <var>base-&gt;member</var>. The member is an {@link Identifier} linked to
* the field's declarator.
*/
public class AccessExpression extends BinaryExpression {

    public AccessExpression(Expression base, AccessOperator op,
                            Identifier member) {
        super(base, op, member);
    }

    @Override
    public AccessOperator getOperator() {
        return (AccessOperator)op;
    }

    /** Returns the base expression. */
    public Expression getBase() {
        return getLHS();
    }

    /** Returns the member identifier. */
    public Identifier getMember() {
        return (Identifier)getRHS();
    }

    @Override
    protected void printExpression(PrintWriter o) {
        getLHS().print(o);
        op.print(o);
        getRHS().print(o);
    }

}
