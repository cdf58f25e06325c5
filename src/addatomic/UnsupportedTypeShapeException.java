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

package addatomic;

import cqual.hir.Symbol;
import cqual.hir.TypeStructure;

/**
 * Thrown when the written type of a declaration has no layer for the level
 * the qualifier must be placed at, for example when a typedef name hides a
 * pointer.
 */
public class UnsupportedTypeShapeException extends AddAtomicException
{
  private static final long serialVersionUID = 1;

  private final transient Symbol symbol;

  private final int remaining_level;

  public UnsupportedTypeShapeException(Symbol symbol, int remaining_level,
      TypeStructure layer)
  {
    super("unsupported type shape: cannot descend " + remaining_level +
        " more level(s) into '" + layer + "' in the type of " +
        describe(symbol));
    this.symbol = symbol;
    this.remaining_level = remaining_level;
  }

  public Symbol getSymbol()
  {
    return symbol;
  }

  public int getRemainingLevel()
  {
    return remaining_level;
  }
}
