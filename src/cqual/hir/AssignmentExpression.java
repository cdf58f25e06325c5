package cqual.hir;

/**
* Represents an assignment of the right operand to the location denoted by
* the left operand, with either the plain or a compound operator.
*/
public class AssignmentExpression extends BinaryExpression {

    public AssignmentExpression(Expression lhs, AssignmentOperator op,
                                Expression rhs) {
        super(lhs, op, rhs);
    }

    @Override
    public AssignmentOperator getOperator() {
        return (AssignmentOperator)op;
    }

}
