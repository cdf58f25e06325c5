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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import addatomic.SeedNotFoundException;
import cqual.hir.*;

/**
 * Chooses the declaration propagation starts from, either by name or at
 * random among the declarations of the primary file.
 */
public class SeedSelector
{
  private final Program program;

  public SeedSelector(Program program)
  {
    this.program = program;
  }

  /**
   * Finds the first declaration named <b>name</b> in declaration order.
   *
   * @throws SeedNotFoundException if nothing has that name.
   */
  public Symbol selectByName(String name)
  {
    List<Symbol> matches = SymbolTools.getSymbolsByName(program, name);
    if (matches.isEmpty())
      throw new SeedNotFoundException("no declaration named '" + name + "'");
    Symbol seed = matches.get(0);
    if (matches.size() > 1)
      PrintTools.printlnWarning("'" + name + "' is declared " + matches.size() +
          " times; using the declaration at line " + seed.getLine());
    return seed;
  }

  /**
   * Picks a named declaration of the primary file uniformly at random.
   *
   * @param seed the random seed.
   * @throws SeedNotFoundException if the primary file declares nothing.
   */
  public Symbol selectRandom(long seed)
  {
    List<Symbol> candidates = getCandidates();
    if (candidates.isEmpty())
      throw new SeedNotFoundException("no candidate declarations in the input");
    Random random = new Random(seed);
    return candidates.get(random.nextInt(candidates.size()));
  }

  /** Returns the named declarations of the primary file in declaration order. */
  public List<Symbol> getCandidates()
  {
    List<Symbol> ret = new ArrayList<Symbol>();
    for (Symbol symbol : SymbolTools.getSymbols(program))
      if (symbol.isInPrimaryFile() && symbol.getSymbolName().length() > 0)
        ret.add(symbol);
    return ret;
  }
}
