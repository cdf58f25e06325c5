package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a function call. The first child is the called expression and the
* remaining children are the arguments.
*/
public class FunctionCall extends Expression {

    /**
    * Creates a function call.
    *
    * @param function the called expression, typically an identifier.
    * @param args the argument list.
    */
    public FunctionCall(Expression function, List<Expression> args) {
        super(args.size() + 1);
        addChild(function);
        for (Expression arg : args) {
            addChild(arg);
        }
    }

    /** Returns the called expression. */
    public Expression getName() {
        return (Expression)children.get(0);
    }

    /** Returns the number of arguments. */
    public int getNumArguments() {
        return children.size() - 1;
    }

    /** Returns the argument at position <b>n</b>. */
    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns the arguments as a new list. */
    public List<Expression> getArguments() {
        List<Expression> ret = new ArrayList<Expression>(getNumArguments());
        for (int i = 1; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    /**
    * Returns the declarator of the directly called function, if the callee is
    * written as a function name.
    *
    * @return the function's declarator, or null for calls through pointers
    *   and calls to undeclared functions.
    */
    public VariableDeclarator getProcedureDeclarator() {
        Expression callee = getName();
        if (!(callee instanceof Identifier)) {
            return null;
        }
        Symbol symbol = ((Identifier)callee).getSymbol();
        if (symbol instanceof VariableDeclarator &&
            symbol.getTypeStructure().getKind() ==
                TypeStructure.Kind.FUNCTION) {
            return (VariableDeclarator)symbol;
        }
        return null;
    }

    protected void printExpression(PrintWriter o) {
        getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(getArguments(), o);
        o.print(")");
    }

}
