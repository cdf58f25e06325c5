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

import java.io.PrintWriter;
import java.util.List;

import addatomic.UnsupportedInitializerShapeException;
import cqual.analysis.AnalysisPass;
import cqual.hir.*;

/**
 * Builds the {@link EquivalenceGraph} of a program in one traversal.
 *
 * Every top-level expression is handed to an {@link IdentityResolver}; the
 * assignments, comparisons and call arguments it reports become edges
 * between the identity sets of both sides. Initialized declarations and
 * return statements are linked here, and redeclarations of a file-scope
 * name are recorded as same-entity links unless disabled.
 */
public class EquivalenceGraphBuilder extends AnalysisPass
  implements IdentityResolver.Listener
{
  private static String pass_name = "[EquivalenceGraphBuilder]";

  private final EquivalenceGraph graph;

  private final IdentityResolver resolver;

  private final boolean link_redeclarations;

  private final boolean dump_graph;

  public EquivalenceGraphBuilder(Program program, boolean link_redeclarations,
      boolean dump_graph)
  {
    super(program);
    this.link_redeclarations = link_redeclarations;
    this.dump_graph = dump_graph;
    graph = new EquivalenceGraph();
    resolver = new IdentityResolver(this);
  }

  public EquivalenceGraphBuilder(Program program)
  {
    this(program, true, false);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public EquivalenceGraph getGraph()
  {
    return graph;
  }

  public void start()
  {
    DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>(program);
    iter.pruneOn(Expression.class);
    iter.pruneOn(Initializer.class);

    while (iter.hasNext())
    {
      Traversable t = iter.next();
      if (t instanceof VariableDeclarator)
        visitDeclarator((VariableDeclarator)t);
      else if (t instanceof Expression)
        visitExpression((Expression)t);
    }

    PrintTools.printlnStatus(pass_name + " " + graph.getNumEdges() + " edges", 1);
    if (dump_graph || PrintTools.getVerbosity() >= 2)
    {
      System.err.println(pass_name + " equivalence graph:");
      graph.print(new PrintWriter(System.err));
    }
  }

  private void visitDeclarator(VariableDeclarator decl)
  {
    if (decl.isTypedef())
      return;
    Initializer init = decl.getInitializer();
    if (init != null)
      handleAssignment(decl, 0, init);
    Symbol prev = decl.getPreviousDeclaration();
    if (link_redeclarations && prev != null)
      linkRedeclaration(decl, prev);
  }

  private void visitExpression(Expression e)
  {
    Traversable parent = e.getParent();
    IdentitySet set = resolver.evaluate(e);
    if (parent instanceof ReturnStatement)
    {
      Procedure proc = ((ReturnStatement)parent).getProcedure();
      if (proc != null)
        link(IdentitySet.of(proc.getDeclarator(), 0), set);
    }
  }

  private void linkRedeclaration(VariableDeclarator decl, Symbol prev)
  {
    graph.addRedeclaration(decl, prev);
    if (!(prev instanceof VariableDeclarator))
      return;
    List<VariableDeclarator> params = decl.getParameters();
    List<VariableDeclarator> prev_params = ((VariableDeclarator)prev).getParameters();
    if (params.size() != prev_params.size())
    {
      PrintTools.printlnStatus(2, pass_name, "parameter counts of", decl,
          "and its earlier declaration differ; parameters not linked");
      return;
    }
    for (int i = 0; i < params.size(); i++)
      graph.addRedeclaration(params.get(i), prev_params.get(i));
  }

  /**
   * Links <b>target</b> at <b>level</b> with the value(s) of an initializer.
   * Brace lists are matched against the type of the target at that level:
   * a struct takes one element per field, a union exactly one element for its
   * first field, and an array links each element one level deeper.
   *
   * @param target the initialized declaration.
   * @param level the indirection level the initializer writes to.
   * @param init the initializer.
   * @throws UnsupportedInitializerShapeException for designators, element
   *   counts that do not match a record, or braces around a scalar.
   */
  public void handleAssignment(Symbol target, int level, Initializer init)
  {
    if (init instanceof ValueInitializer)
    {
      IdentitySet value = resolver.evaluate(((ValueInitializer)init).getValue());
      link(IdentitySet.of(target, level), value);
      return;
    }

    ListInitializer list = (ListInitializer)init;
    if (list.hasDesignators())
      throw new UnsupportedInitializerShapeException(target, level,
          "designated initializers are not supported");
    List<Initializer> elements = list.getElements();
    TypeStructure type = SymbolTools.getTypeAtLevel(target.getTypeStructure(), level);
    ClassDeclaration record = SymbolTools.getRecord(type);

    if (record != null)
    {
      List<VariableDeclarator> fields = record.getFields();
      if (record.isUnion())
      {
        if (elements.size() != 1 || fields.isEmpty())
          throw new UnsupportedInitializerShapeException(target, level,
              "a union initializer needs exactly one element, found " +
              elements.size());
        handleAssignment(fields.get(0), 0, elements.get(0));
      }
      else
      {
        if (elements.size() != fields.size())
          throw new UnsupportedInitializerShapeException(target, level,
              elements.size() + " elements for " + fields.size() + " fields");
        for (int i = 0; i < elements.size(); i++)
          handleAssignment(fields.get(i), 0, elements.get(i));
      }
    }
    else if (type != null && type.getKind() == TypeStructure.Kind.ARRAY)
    {
      for (Initializer element : elements)
        handleAssignment(target, level + 1, element);
    }
    else
    {
      throw new UnsupportedInitializerShapeException(target, level,
          "brace list for a non-aggregate type");
    }
  }

  private void link(IdentitySet lhs, IdentitySet rhs)
  {
    for (SymbolIndirection l : lhs)
      for (SymbolIndirection r : rhs)
        if (graph.addEdge(l, r))
          PrintTools.printlnStatus(3, pass_name, l, "~", r);
  }

  public void assignment(IdentitySet lhs, IdentitySet rhs)
  {
    link(lhs, rhs);
  }

  public void comparison(IdentitySet lhs, IdentitySet rhs)
  {
    link(lhs, rhs);
  }

  public void argument(Symbol param, IdentitySet arg)
  {
    link(IdentitySet.of(param, 0), arg);
  }
}
