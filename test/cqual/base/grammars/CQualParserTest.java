package cqual.base.grammars;

import cqual.ParsedSources;
import cqual.exec.ParseException;
import cqual.hir.*;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static cqual.ParsedSources.*;
import static org.junit.jupiter.api.Assertions.*;

public class CQualParserTest
{
  @Test
  public void buildsTypeLayersWithEndOffsets() throws Exception
  {
    Program program = parse("int *p[3];");
    TypeStructure type = symbol(program, "p").getTypeStructure();
    assertEquals(TypeStructure.Kind.ARRAY, type.getKind());
    assertEquals(9, type.getEndOffset());
    TypeStructure pointer = type.getInner();
    assertEquals(TypeStructure.Kind.POINTER, pointer.getKind());
    assertEquals(5, pointer.getEndOffset());
    TypeStructure base = pointer.getInner();
    assertEquals(TypeStructure.Kind.BASE, base.getKind());
    assertEquals(3, base.getEndOffset());
  }

  @Test
  public void parsesFunctionPointerDeclarator() throws Exception
  {
    Program program = parse("int (*fp)(int, char *);");
    TypeStructure type = symbol(program, "fp").getTypeStructure();
    assertEquals(TypeStructure.Kind.POINTER, type.getKind());
    TypeStructure function = type.getInner();
    assertEquals(TypeStructure.Kind.FUNCTION, function.getKind());
    assertEquals(2, ((TypeStructure.Function)function).getParameterTypes().size());
    assertEquals(TypeStructure.Kind.BASE, function.getInner().getKind());
    // a pointer to function declares no parameters of its own
    assertTrue(((VariableDeclarator)symbol(program, "fp")).getParameters().isEmpty());
  }

  @Test
  public void recordsQualifiersSizesAndVarargs() throws Exception
  {
    Program program = parse("int *const q;\nint b[2 + 1];\nint pf(const char *, ...);\n" +
        "void g(void) {\n  q = 0;\n}\n");
    TypeStructure.Pointer pointer = (TypeStructure.Pointer)symbol(program, "q").getTypeStructure();
    assertEquals(List.of("const"), pointer.getQualifiers());
    TypeStructure.Array array = (TypeStructure.Array)symbol(program, "b").getTypeStructure();
    assertEquals("2 + 1", array.getSize());
    TypeStructure.Function function = (TypeStructure.Function)symbol(program, "pf").getTypeStructure();
    assertTrue(function.isVariadic());
    assertEquals(1, function.getParameterTypes().size());
    assertEquals(5, statements(program).get(0).getLineNumber());
  }

  @Test
  public void linksDefinitionToPrototype() throws Exception
  {
    Program program = parse("int f(int a);\nint f(int b) { return b; }\n");
    VariableDeclarator proto = (VariableDeclarator)symbol(program, "f", 0);
    VariableDeclarator def = (VariableDeclarator)symbol(program, "f", 1);
    assertSame(proto, def.getPreviousDeclaration());
    assertNull(proto.getPreviousDeclaration());
    assertEquals("a", proto.getParameters().get(0).getSymbolName());
    assertEquals("b", def.getParameters().get(0).getSymbolName());
    assertEquals(2, def.getLine());
  }

  @Test
  public void resolvesMembersThroughBaseType() throws Exception
  {
    Program program = parse(
        "struct S { int a; };\n" +
        "struct T { int a; };\n" +
        "struct S s;\n" +
        "struct T *t;\n" +
        "void g(void) { s.a; t->a; }\n");
    AccessExpression sa = (AccessExpression)expression(program, 0);
    AccessExpression ta = (AccessExpression)expression(program, 1);
    assertSame(symbol(program, "a", 0), sa.getMember().getSymbol());
    assertSame(symbol(program, "a", 1), ta.getMember().getSymbol());
  }

  @Test
  public void resolvesInnermostScope() throws Exception
  {
    Program program = parse("int x;\nvoid f(void) { int x; x = 1; }\nvoid g(void) { x = 2; }\n");
    AssignmentExpression inner = (AssignmentExpression)expression(program, 0);
    AssignmentExpression outer = (AssignmentExpression)expression(program, 1);
    assertSame(symbol(program, "x", 1), ((Identifier)inner.getLHS()).getSymbol());
    assertSame(symbol(program, "x", 0), ((Identifier)outer.getLHS()).getSymbol());
  }

  @Test
  public void enumeratorsAreNotSymbols() throws Exception
  {
    Program program = parse("enum E { RED, GREEN };\nint v = GREEN;\n");
    VariableDeclarator v = (VariableDeclarator)symbol(program, "v");
    Expression value = ((ValueInitializer)v.getInitializer()).getValue();
    assertNull(((Identifier)value).getSymbol());
    assertTrue(SymbolTools.getSymbolsByName(program, "GREEN").isEmpty());
  }

  @Test
  public void typedefNamesAreNotSymbols() throws Exception
  {
    Program program = parse("typedef int *ip;\nip v;\n");
    assertTrue(SymbolTools.getSymbolsByName(program, "ip").isEmpty());
    TypeStructure.Base base = (TypeStructure.Base)symbol(program, "v").getTypeStructure();
    assertEquals("ip", base.getTypedefName());
    assertEquals(TypeStructure.Kind.POINTER, base.getTypedefType().getKind());
  }

  @Test
  public void marksDeclarationsFromOtherFiles() throws Exception
  {
    Program program = parse("# 1 \"lib.h\"\nint lib_var;\n# 3 \"input.c\"\nint mine;\n");
    assertFalse(symbol(program, "lib_var").isInPrimaryFile());
    assertTrue(symbol(program, "mine").isInPrimaryFile());
    assertEquals(3, symbol(program, "mine").getLine());
  }

  @Test
  public void parsesStatementForms() throws Exception
  {
    Program program = parse(
        "int g(int n)\n" +
        "{\n" +
        "  int i, sum = 0;\n" +
        "  for (int k = 0; k < n; k++) sum += k;\n" +
        "  while (n > 0) { n--; if (n == 3) break; else continue; }\n" +
        "  do sum++; while (sum < 10);\n" +
        "  switch (n) { case 1: sum = 2; break; default: ; }\n" +
        "again:\n" +
        "  if (sum < 0) goto again;\n" +
        "  return sum ? sum : (int)sizeof(int);\n" +
        "}\n");
    Procedure proc = (Procedure)unit(program).getDeclarations().get(0);
    assertEquals("g", proc.getName());
    List<Statement> stmts = new DepthFirstIterator<Traversable>(proc)
        .getList(Statement.class);
    Set<Class<?>> kinds = new HashSet<Class<?>>();
    for (Statement s : stmts)
      kinds.add(s.getClass());
    assertTrue(kinds.contains(ForLoop.class));
    assertTrue(kinds.contains(WhileLoop.class));
    assertTrue(kinds.contains(DoLoop.class));
    assertTrue(kinds.contains(SwitchStatement.class));
    assertTrue(kinds.contains(Case.class));
    assertTrue(kinds.contains(Default.class));
    assertTrue(kinds.contains(Label.class));
    assertTrue(kinds.contains(GotoStatement.class));
    assertTrue(kinds.contains(ReturnStatement.class));
  }

  @Test
  public void numbersEveryExpressionOnce() throws Exception
  {
    Program program = parse("int a[4], *p;\nvoid f(void) { p = &a[1] + (a[2] ? 1 : 2), f(); }\n");
    List<Expression> exprs = new DepthFirstIterator<Traversable>(program)
        .getList(Expression.class);
    assertFalse(exprs.isEmpty());
    Set<Integer> ids = new HashSet<Integer>();
    for (Expression e : exprs) {
      assertTrue(e.getId() >= 0, "unnumbered " + e);
      assertTrue(ids.add(e.getId()), "duplicate id on " + e);
    }
    assertTrue(IRTools.checkConsistency(program));
  }

  @Test
  public void reportsSyntaxErrorsWithPosition()
  {
    ParseException e = assertThrows(ParseException.class,
        () -> ParsedSources.parse("int x = ;\n"));
    assertTrue(e.getMessage().contains("input.c"), e.getMessage());
    assertTrue(e.getMessage().contains("input.c:1:9"), e.getMessage());
    assertTrue(e.getMessage().contains("unexpected token"), e.getMessage());
  }

  @Test
  public void reportsUnsupportedStatementExpression()
  {
    ParseException e = assertThrows(ParseException.class,
        () -> ParsedSources.parse("int f(void) { return ({ 1; }); }\n"));
    assertTrue(e.getMessage().contains("statement expressions are not supported"),
        e.getMessage());
  }

  @Test
  public void keepsCompoundLiteralElements() throws Exception
  {
    Program program = parse(
        "int g(int *q);\n" +
        "int x;\n" +
        "struct S { int a; };\n" +
        "void f(void) { struct S s = (struct S){ .a = g(&x) }; }\n");
    VariableDeclarator s = (VariableDeclarator)symbol(program, "s");
    Expression value = ((ValueInitializer)s.getInitializer()).getValue();
    CompoundLiteral literal = (CompoundLiteral)value;
    assertEquals(TypeStructure.Kind.BASE, literal.getType().getKind());
    ListInitializer init = literal.getInitializer();
    assertEquals(1, init.getElements().size());
    assertEquals(".a", init.getElements().get(0).getDesignator());
    List<FunctionCall> calls = new DepthFirstIterator<Traversable>(literal)
        .getList(FunctionCall.class);
    assertEquals(1, calls.size());
    UnaryExpression arg = (UnaryExpression)calls.get(0).getArgument(0);
    assertSame(symbol(program, "x"), ((Identifier)arg.getExpression()).getSymbol());
    assertTrue(IRTools.checkConsistency(program));
  }

  @Test
  public void parsesCastsAndTypeNames() throws Exception
  {
    Program program = parse("typedef unsigned long ul;\nul v;\n" +
        "void f(void) { v = (ul)sizeof(struct { int a; } *) + (v); }\n");
    AssignmentExpression assign = (AssignmentExpression)expression(program, 0);
    BinaryExpression sum = (BinaryExpression)assign.getRHS();
    assertTrue(sum.getLHS() instanceof Typecast);
    assertTrue(sum.getRHS() instanceof Identifier);
  }
}
