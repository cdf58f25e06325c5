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

/**
 * Thrown when propagation reaches a declaration that already has a different
 * qualifier level; no consistent qualification exists.
 */
public class ContradictionException extends AddAtomicException
{
  private static final long serialVersionUID = 1;

  private final transient Symbol symbol;

  private final int existing_level;

  private final int required_level;

  public ContradictionException(Symbol symbol, int existing_level,
      int required_level, Symbol via)
  {
    super("contradiction: " + describe(symbol) + " needs the qualifier at "
        + "indirection level " + required_level + " through " + describe(via)
        + " but already has it at level " + existing_level);
    this.symbol = symbol;
    this.existing_level = existing_level;
    this.required_level = required_level;
  }

  public Symbol getSymbol()
  {
    return symbol;
  }

  public int getExistingLevel()
  {
    return existing_level;
  }

  public int getRequiredLevel()
  {
    return required_level;
  }
}
