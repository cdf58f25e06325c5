//============================================================================//
//    FCUDA
//    Copyright (c) <2016> 
//    <University of Illinois at Urbana-Champaign>
//    <University of California at Los Angeles> 
//    All rights reserved.
// 
//    Developed by:
// 
//        <ES CAD Group & IMPACT Research Group>
//            <University of Illinois at Urbana-Champaign>
//            <http://dchen.ece.illinois.edu/>
//            <http://impact.crhc.illinois.edu/>
// 
//        <VAST Laboratory>
//            <University of California at Los Angeles>
//            <http://vast.cs.ucla.edu/>
// 
//        <Hardware Research Group>
//            <Advanced Digital Sciences Center>
//            <http://adsc.illinois.edu/>
//============================================================================//

package addatomic.analysis;

import java.util.BitSet;
import java.util.List;

import cqual.hir.*;

/**
 * Computes the identity set of each expression, that is, the declarations
 * (at some indirection level) whose storage the expression's value comes
 * from. Evaluation is post-order and returns the set to the caller; every
 * expression is evaluated exactly once, which is checked through the
 * expression ids. Constructs that make two identity sets equivalent are
 * reported to a {@link Listener}.
 */
public class IdentityResolver
{
  /**
   * Receives the assignment-like constructs met during evaluation, after
   * both operand sets are known.
   */
  public interface Listener
  {
    /** An assignment <b>lhs = rhs</b>. */
    void assignment(IdentitySet lhs, IdentitySet rhs);

    /** A comparison other than <b>!=</b>. */
    void comparison(IdentitySet lhs, IdentitySet rhs);

    /** An argument passed to a parameter of a directly called function. */
    void argument(Symbol param, IdentitySet arg);
  }

  private final Listener listener;

  /** Ids of the expressions evaluated so far. */
  private final BitSet evaluated;

  public IdentityResolver(Listener listener)
  {
    this.listener = listener;
    evaluated = new BitSet();
  }

  /**
   * Evaluates an expression and all of its subexpressions.
   *
   * @param e the expression.
   * @return the identity set of <b>e</b>.
   * @throws IllegalStateException if <b>e</b> was already evaluated.
   */
  public IdentitySet evaluate(Expression e)
  {
    int id = e.getId();
    if (id >= 0) {
      if (evaluated.get(id))
        throw new IllegalStateException("expression " + id + " (" + e +
            ") evaluated twice");
      evaluated.set(id);
    }
    IdentitySet ret = compute(e);
    PrintTools.printlnStatus(4, "[IdentityResolver]", e, "=>", ret);
    return ret;
  }

  public boolean isEvaluated(Expression e)
  {
    return e.getId() >= 0 && evaluated.get(e.getId());
  }

  private IdentitySet compute(Expression e)
  {
    if (e instanceof Identifier) {
      Symbol symbol = ((Identifier)e).getSymbol();
      return (symbol == null) ? IdentitySet.EMPTY : IdentitySet.of(symbol, 0);
    }
    else if (e instanceof AccessExpression) {
      AccessExpression ae = (AccessExpression)e;
      evaluate(ae.getBase());
      return evaluate(ae.getMember());
    }
    else if (e instanceof AssignmentExpression) {
      AssignmentExpression ae = (AssignmentExpression)e;
      IdentitySet lhs = evaluate(ae.getLHS());
      IdentitySet rhs = evaluate(ae.getRHS());
      if (ae.getOperator() != AssignmentOperator.NORMAL)
        return IdentitySet.EMPTY;
      listener.assignment(lhs, rhs);
      return lhs;
    }
    else if (e instanceof BinaryExpression) {
      BinaryExpression be = (BinaryExpression)e;
      IdentitySet lhs = evaluate(be.getLHS());
      IdentitySet rhs = evaluate(be.getRHS());
      if (isLinkingComparison(be.getOperator()))
        listener.comparison(lhs, rhs);
      return IdentitySet.EMPTY;
    }
    else if (e instanceof UnaryExpression) {
      UnaryExpression ue = (UnaryExpression)e;
      IdentitySet operand = evaluate(ue.getExpression());
      if (ue.getOperator() == UnaryOperator.ADDRESS_OF)
        return operand.shift(-1);
      if (ue.getOperator() == UnaryOperator.DEREFERENCE)
        return operand.shift(1);
      return IdentitySet.EMPTY;
    }
    else if (e instanceof ArrayAccess) {
      ArrayAccess aa = (ArrayAccess)e;
      IdentitySet base = evaluate(aa.getArrayName());
      evaluate(aa.getIndex());
      return base.shift(1);
    }
    else if (e instanceof ConditionalExpression) {
      ConditionalExpression ce = (ConditionalExpression)e;
      evaluate(ce.getCondition());
      IdentitySet t = evaluate(ce.getTrueExpression());
      IdentitySet f = evaluate(ce.getFalseExpression());
      return t.union(f);
    }
    else if (e instanceof FunctionCall) {
      return computeCall((FunctionCall)e);
    }
    else if (e instanceof CompoundLiteral) {
      evaluateElements(((CompoundLiteral)e).getInitializer());
      return IdentitySet.EMPTY;
    }
    // casts, sizeof, comma, literals: children only
    for (Traversable child : e.getChildren())
      evaluate((Expression)child);
    return IdentitySet.EMPTY;
  }

  /* Evaluates every element value of a compound literal for its side links. */
  private void evaluateElements(ListInitializer list)
  {
    for (Initializer element : list.getElements()) {
      if (element instanceof ListInitializer)
        evaluateElements((ListInitializer)element);
      else
        evaluate(((ValueInitializer)element).getValue());
    }
  }

  private IdentitySet computeCall(FunctionCall call)
  {
    evaluate(call.getName());
    List<Expression> args = call.getArguments();
    IdentitySet[] arg_sets = new IdentitySet[args.size()];
    for (int i = 0; i < args.size(); i++)
      arg_sets[i] = evaluate(args.get(i));

    VariableDeclarator callee = call.getProcedureDeclarator();
    if (callee == null)
      return IdentitySet.EMPTY;
    List<VariableDeclarator> params = callee.getParameters();
    int n = Math.min(params.size(), arg_sets.length);
    for (int i = 0; i < n; i++)
      listener.argument(params.get(i), arg_sets[i]);
    return IdentitySet.of(callee, 0);
  }

  private static boolean isLinkingComparison(BinaryOperator op)
  {
    return op == BinaryOperator.COMPARE_EQ ||
        op == BinaryOperator.COMPARE_LT || op == BinaryOperator.COMPARE_LE ||
        op == BinaryOperator.COMPARE_GT || op == BinaryOperator.COMPARE_GE;
  }
}
