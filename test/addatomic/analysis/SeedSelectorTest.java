package addatomic.analysis;

import addatomic.SeedNotFoundException;
import cqual.hir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static cqual.ParsedSources.*;
import static org.junit.jupiter.api.Assertions.*;

public class SeedSelectorTest
{
  private static final String SOURCE =
      "# 1 \"lib.h\"\n" +
      "int lib_counter;\n" +
      "# 3 \"input.c\"\n" +
      "int x;\n" +
      "void f(int);\n" +
      "void g(void) { int x; }\n";

  @Test
  public void selectsFirstDeclarationByName() throws Exception
  {
    Program program = parse(SOURCE);
    Symbol seed = new SeedSelector(program).selectByName("x");
    assertSame(symbol(program, "x", 0), seed);
  }

  @Test
  public void unknownNameIsNotFound() throws Exception
  {
    Program program = parse(SOURCE);
    SeedNotFoundException e = assertThrows(SeedNotFoundException.class,
        () -> new SeedSelector(program).selectByName("nope"));
    assertTrue(e.getMessage().contains("nope"));
  }

  @Test
  public void candidatesExcludeOtherFilesAndUnnamedParameters() throws Exception
  {
    Program program = parse(SOURCE);
    List<Symbol> candidates = new SeedSelector(program).getCandidates();
    assertEquals(4, candidates.size());
    for (Symbol symbol : candidates) {
      assertTrue(symbol.isInPrimaryFile());
      assertFalse(symbol.getSymbolName().isEmpty());
    }
  }

  @Test
  public void randomSelectionIsReproducible() throws Exception
  {
    Program program = parse(SOURCE);
    SeedSelector selector = new SeedSelector(program);
    for (long seed = 0; seed < 20; seed++)
      assertSame(selector.selectRandom(seed), selector.selectRandom(seed));
  }

  @Test
  public void randomSelectionNeedsCandidates() throws Exception
  {
    Program program = parse("# 1 \"lib.h\"\nint lib_counter;\n");
    assertThrows(SeedNotFoundException.class,
        () -> new SeedSelector(program).selectRandom(7));
  }
}
