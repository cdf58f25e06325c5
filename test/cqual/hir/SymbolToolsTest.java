package cqual.hir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static cqual.ParsedSources.*;
import static org.junit.jupiter.api.Assertions.*;

public class SymbolToolsTest
{
  @Test
  public void collectsSymbolsInDeclarationOrder() throws Exception
  {
    Program program = parse("struct S { int a; } s;\nint f(int p) { int x; return x; }\nint y;\n");
    List<Symbol> symbols = SymbolTools.getSymbols(program);
    String[] expected = { "a", "s", "f", "p", "x", "y" };
    assertEquals(expected.length, symbols.size());
    for (int i = 0; i < expected.length; i++)
      assertEquals(expected[i], symbols.get(i).getSymbolName());
  }

  @Test
  public void getTypeAtLevelSeesThroughTypedefs() throws Exception
  {
    Program program = parse("struct S { int a; };\ntypedef struct S *SP;\nSP arr[2];\n");
    TypeStructure type = symbol(program, "arr").getTypeStructure();
    assertEquals(TypeStructure.Kind.ARRAY, SymbolTools.getTypeAtLevel(type, 0).getKind());
    assertEquals(TypeStructure.Kind.POINTER, SymbolTools.getTypeAtLevel(type, 1).getKind());
    ClassDeclaration record = SymbolTools.getRecord(SymbolTools.getTypeAtLevel(type, 2));
    assertNotNull(record);
    assertEquals("S", record.getName());
    assertNull(SymbolTools.getTypeAtLevel(type, 3));
    assertNull(SymbolTools.getTypeAtLevel(type, -1));
  }

  @Test
  public void functionTypeStandsForItsReturnType() throws Exception
  {
    Program program = parse("char **h(void);\n");
    TypeStructure type = symbol(program, "h").getTypeStructure();
    assertEquals(TypeStructure.Kind.FUNCTION, type.getKind());
    assertEquals(TypeStructure.Kind.POINTER, SymbolTools.getTypeAtLevel(type, 0).getKind());
    assertEquals(TypeStructure.Kind.BASE, SymbolTools.getTypeAtLevel(type, 2).getKind());
  }

  @Test
  public void computesExpressionTypes() throws Exception
  {
    Program program = parse("int *p;\nint **pp;\nvoid f(void) { *pp; &p; p + 1; pp[0][0]; }\n");
    assertEquals(TypeStructure.Kind.POINTER,
        SymbolTools.getExpressionType(expression(program, 0)).getKind());
    TypeStructure addr = SymbolTools.getExpressionType(expression(program, 1));
    assertEquals(TypeStructure.Kind.POINTER, addr.getKind());
    assertEquals(TypeStructure.Kind.POINTER, addr.getInner().getKind());
    assertSame(symbol(program, "p").getTypeStructure(),
        SymbolTools.getExpressionType(expression(program, 2)));
    assertEquals(TypeStructure.Kind.BASE,
        SymbolTools.getExpressionType(expression(program, 3)).getKind());
  }
}
