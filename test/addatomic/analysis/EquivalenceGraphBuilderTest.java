package addatomic.analysis;

import addatomic.UnsupportedInitializerShapeException;
import cqual.analysis.AnalysisPass;
import cqual.hir.*;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeSet;

import static cqual.ParsedSources.*;
import static org.junit.jupiter.api.Assertions.*;

public class EquivalenceGraphBuilderTest
{
  private static EquivalenceGraph build(Program program, boolean redeclarations)
  {
    EquivalenceGraphBuilder builder =
        new EquivalenceGraphBuilder(program, redeclarations, false);
    AnalysisPass.run(builder);
    return builder.getGraph();
  }

  private static EquivalenceGraph build(Program program)
  {
    return build(program, true);
  }

  private static SymbolIndirection at(Program program, String name, int level)
  {
    return new SymbolIndirection(symbol(program, name), level);
  }

  private static void assertLinked(EquivalenceGraph graph, SymbolIndirection a,
      SymbolIndirection b)
  {
    assertTrue(graph.hasEdge(a, b), a + " ~ " + b);
    assertTrue(graph.hasEdge(b, a), b + " ~ " + a);
  }

  @Test
  public void structInitializerLinksFields() throws Exception
  {
    Program program = parse(
        "struct S { int a; int b; };\n" +
        "int x, y;\n" +
        "struct S s = {x, y};\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "a", 0), at(program, "x", 0));
    assertLinked(graph, at(program, "b", 0), at(program, "y", 0));
    assertFalse(graph.hasEdge(at(program, "a", 0), at(program, "y", 0)));
    assertTrue(graph.getEdges(symbol(program, "s")).isEmpty());
    assertEquals(2, graph.getNumEdges());
  }

  @Test
  public void structInitializerThroughTypedef() throws Exception
  {
    Program program = parse(
        "struct S { int *a; int b; };\n" +
        "typedef struct S T;\n" +
        "int *x, y;\n" +
        "T t = {x, y};\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "a", 0), at(program, "x", 0));
  }

  @Test
  public void unionInitializerLinksFirstField() throws Exception
  {
    Program program = parse(
        "union U { int *a; long b; };\n" +
        "int *p;\n" +
        "union U u = {p};\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "a", 0), at(program, "p", 0));
    assertTrue(graph.getEdges(symbol(program, "b")).isEmpty());
  }

  @Test
  public void arrayInitializerLinksElementLevel() throws Exception
  {
    Program program = parse("int x, y;\nint *arr[2] = {&x, &y};\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "arr", 1), at(program, "x", -1));
    assertLinked(graph, at(program, "arr", 1), at(program, "y", -1));
  }

  @Test
  public void arrayOfStructsInitializerLinksFields() throws Exception
  {
    Program program = parse(
        "struct S { int *a; };\n" +
        "int *x, *y;\n" +
        "struct S arr[] = { {x}, {y} };\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "a", 0), at(program, "x", 0));
    assertLinked(graph, at(program, "a", 0), at(program, "y", 0));
  }

  @Test
  public void scalarInitializerLinksDeclaration() throws Exception
  {
    Program program = parse("int x;\nint *p = &x;\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "p", 0), at(program, "x", -1));
  }

  @Test
  public void designatorsAreRejected() throws Exception
  {
    Program program = parse("struct S { int a; int b; };\nint x;\nstruct S s = {.a = x};\n");
    assertThrows(UnsupportedInitializerShapeException.class, () -> build(program));
  }

  @Test
  public void wrongFieldCountIsRejected() throws Exception
  {
    Program program = parse("struct S { int a; int b; };\nint x;\nstruct S s = {x};\n");
    UnsupportedInitializerShapeException e = assertThrows(
        UnsupportedInitializerShapeException.class, () -> build(program));
    assertTrue(e.getMessage().contains("'s'"), e.getMessage());
  }

  @Test
  public void bracedScalarIsRejected() throws Exception
  {
    Program program = parse("int z = {1};\n");
    assertThrows(UnsupportedInitializerShapeException.class, () -> build(program));
  }

  @Test
  public void assignmentsLinkBothSides() throws Exception
  {
    Program program = parse("int x;\nint *p;\nvoid f(void) { p = &x; }\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "p", 0), at(program, "x", -1));
  }

  @Test
  public void returnLinksFunctionSymbol() throws Exception
  {
    Program program = parse("int *g;\nint *h(void) { return g; }\nvoid k(void) { return; }\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "h", 0), at(program, "g", 0));
    assertTrue(graph.getEdges(symbol(program, "k")).isEmpty());
  }

  @Test
  public void argumentsLinkParameters() throws Exception
  {
    Program program = parse("void k(int *a, int n);\nint *q;\nvoid f(void) { k(q, 1, 2); }\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "a", 0), at(program, "q", 0));
    assertTrue(graph.getEdges(symbol(program, "n")).isEmpty());
  }

  @Test
  public void callsInsideCompoundLiteralLinkArguments() throws Exception
  {
    Program program = parse("int g(int *q);\nint x;\nstruct S { int a; };\n" +
        "void f(void) { struct S s = (struct S){ g(&x) }; }\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "q", 0), at(program, "x", -1));
    assertTrue(graph.getEdges(symbol(program, "s")).isEmpty());
  }

  @Test
  public void comparisonsLinkExceptInequality() throws Exception
  {
    Program program = parse("int *p, *q, *r;\nvoid f(void) { if (p == q) ; while (p != r) ; }\n");
    EquivalenceGraph graph = build(program);
    assertLinked(graph, at(program, "p", 0), at(program, "q", 0));
    assertFalse(graph.hasEdge(at(program, "p", 0), at(program, "r", 0)));
  }

  @Test
  public void castsHideValues() throws Exception
  {
    Program program = parse("int *p;\nlong *q;\nvoid f(void) { p = (int *)q; }\n");
    EquivalenceGraph graph = build(program);
    assertTrue(graph.getEdges(symbol(program, "p")).isEmpty());
  }

  @Test
  public void redeclarationsAreLinked() throws Exception
  {
    Program program = parse("void k(int *a);\nvoid k(int *b) { }\nextern int v;\nint v;\n");
    EquivalenceGraph graph = build(program);
    assertTrue(graph.getRedeclarations(symbol(program, "k", 1)).contains(symbol(program, "k", 0)));
    assertTrue(graph.getRedeclarations(symbol(program, "a")).contains(symbol(program, "b")));
    assertTrue(graph.getRedeclarations(symbol(program, "v", 0)).contains(symbol(program, "v", 1)));
  }

  @Test
  public void redeclarationsCanBeDisabled() throws Exception
  {
    Program program = parse("void k(int *a);\nvoid k(int *b) { }\n");
    EquivalenceGraph graph = build(program, false);
    assertTrue(graph.getRedeclarations(symbol(program, "k", 1)).isEmpty());
    assertTrue(graph.getRedeclarations(symbol(program, "a")).isEmpty());
  }

  @Test
  public void edgesAreSymmetric() throws Exception
  {
    Program program = parse(
        "struct N { struct N *next; int *v; };\n" +
        "int x, *p, **pp;\n" +
        "struct N n, *np;\n" +
        "int *id(int *a) { return a; }\n" +
        "void f(void)\n" +
        "{\n" +
        "  p = &x; pp = &p; *pp = id(p);\n" +
        "  np = n.next; np->v = *pp;\n" +
        "  if (np == &n) p = np->v ? np->v : p;\n" +
        "}\n");
    EquivalenceGraph graph = build(program);
    assertTrue(graph.getNumEdges() > 0);
    for (Symbol symbol : SymbolTools.getSymbols(program))
    {
      for (Map.Entry<Integer, TreeSet<SymbolIndirection>> entry :
          graph.getEdges(symbol).entrySet())
      {
        SymbolIndirection from = new SymbolIndirection(symbol, entry.getKey());
        for (SymbolIndirection to : entry.getValue())
          assertTrue(graph.hasEdge(to, from), to + " ~ " + from);
      }
    }
  }
}
