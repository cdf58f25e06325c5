package addatomic.transforms;

import addatomic.UnsupportedTypeShapeException;
import addatomic.analysis.UpgradeMap;
import cqual.hir.*;
import cqual.transforms.TransformPass;
import org.junit.jupiter.api.Test;

import static cqual.ParsedSources.*;
import static org.junit.jupiter.api.Assertions.*;

public class QualifierInserterTest
{
  private static String insert(Program program, UpgradeMap map)
  {
    QualifierInserter inserter = new QualifierInserter(program, map, "_Atomic");
    TransformPass.run(inserter);
    return inserter.getOutput(unit(program));
  }

  private static String qualify(String source, String name, int level)
      throws Exception
  {
    Program program = parse(source);
    UpgradeMap map = new UpgradeMap();
    map.put(symbol(program, name), level);
    return insert(program, map);
  }

  @Test
  public void qualifiesBaseType() throws Exception
  {
    assertEquals("int _Atomic  x;\n", qualify("int x;\n", "x", 0));
  }

  @Test
  public void qualifiesPointerItself() throws Exception
  {
    assertEquals("int * _Atomic p;\n", qualify("int *p;\n", "p", 0));
  }

  @Test
  public void qualifiesPointee() throws Exception
  {
    assertEquals("int _Atomic  *p;\n", qualify("int *p;\n", "p", 1));
    assertEquals("char * _Atomic *pp;\n", qualify("char **pp;\n", "pp", 1));
  }

  @Test
  public void qualifiesArrayElements() throws Exception
  {
    assertEquals("int _Atomic  a[4];\n", qualify("int a[4];\n", "a", 1));
  }

  @Test
  public void descendsIntoReturnType() throws Exception
  {
    assertEquals("int * _Atomic h(void);\n", qualify("int *h(void);\n", "h", 0));
    assertEquals("int _Atomic  *h(void);\n", qualify("int *h(void);\n", "h", 1));
  }

  @Test
  public void qualifiesFunctionPointer() throws Exception
  {
    assertEquals("int (* _Atomic fp)(int);\n", qualify("int (*fp)(int);\n", "fp", 0));
  }

  @Test
  public void qualifiesAfterInlineStructBody() throws Exception
  {
    assertEquals("struct { int a; } _Atomic  *sp;\n",
        qualify("struct { int a; } *sp;\n", "sp", 1));
  }

  @Test
  public void qualifiesParameter() throws Exception
  {
    assertEquals("void f(int _Atomic  *p) { }\n",
        qualify("void f(int *p) { }\n", "p", 1));
  }

  @Test
  public void hiddenPointerIsUnsupported() throws Exception
  {
    UnsupportedTypeShapeException e = assertThrows(UnsupportedTypeShapeException.class,
        () -> qualify("typedef int *ip;\nip v;\n", "v", 1));
    assertEquals(1, e.getRemainingLevel());
    assertEquals("v", e.getSymbol().getSymbolName());
  }

  @Test
  public void sharedInsertionPointIsEditedOnce() throws Exception
  {
    Program program = parse("int x, y;\n");
    UpgradeMap map = new UpgradeMap();
    map.put(symbol(program, "x"), 0);
    map.put(symbol(program, "y"), 0);
    assertEquals("int _Atomic  x, y;\n", insert(program, map));
  }

  @Test
  public void skipsNegativeLevels() throws Exception
  {
    Program program = parse("int x;\nint *p;\n");
    UpgradeMap map = new UpgradeMap();
    map.put(symbol(program, "p"), 0);
    map.put(symbol(program, "x"), -1);
    assertEquals("int x;\nint * _Atomic p;\n", insert(program, map));
  }

  @Test
  public void skipsDeclarationsOfOtherFiles() throws Exception
  {
    String source = "# 1 \"lib.h\"\nint *shared;\n# 3 \"input.c\"\nint *mine;\n";
    Program program = parse(source);
    UpgradeMap map = new UpgradeMap();
    map.put(symbol(program, "shared"), 1);
    map.put(symbol(program, "mine"), 1);
    String expected = "# 1 \"lib.h\"\nint *shared;\n# 3 \"input.c\"\nint _Atomic  *mine;\n";
    assertEquals(expected, insert(program, map));
  }

  @Test
  public void leavesCommentsAndLayoutAlone() throws Exception
  {
    String source = "/* counter */\nstatic   int   hits ; // total\n";
    assertEquals("/* counter */\nstatic   int _Atomic    hits ; // total\n",
        qualify(source, "hits", 0));
  }

  @Test
  public void computesInsertionOffset() throws Exception
  {
    Program program = parse("long **pp;\n");
    Symbol pp = symbol(program, "pp");
    assertEquals(7, QualifierInserter.insertionOffset(pp, 0));
    assertEquals(6, QualifierInserter.insertionOffset(pp, 1));
    assertEquals(4, QualifierInserter.insertionOffset(pp, 2));
    assertThrows(UnsupportedTypeShapeException.class,
        () -> QualifierInserter.insertionOffset(pp, 3));
  }
}
