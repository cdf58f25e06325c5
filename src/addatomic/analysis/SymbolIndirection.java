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

import cqual.hir.Symbol;

/**
 * A declaration viewed through a number of indirections. Level 0 is the
 * declaration itself, level 1 what it points to, and level -1 its address.
 */
public final class SymbolIndirection implements Comparable<SymbolIndirection>
{
  private final Symbol symbol;

  private final int level;

  public SymbolIndirection(Symbol symbol, int level)
  {
    this.symbol = symbol;
    this.level = level;
  }

  public Symbol getSymbol()
  {
    return symbol;
  }

  public int getLevel()
  {
    return level;
  }

  /**
   * Returns this declaration at a level moved by <b>delta</b>.
   *
   * @param delta +1 for a dereference, -1 for taking the address.
   * @return the shifted pair.
   */
  public SymbolIndirection shift(int delta)
  {
    return new SymbolIndirection(symbol, level + delta);
  }

  public int compareTo(SymbolIndirection other)
  {
    int c = Integer.compare(symbol.getId(), other.symbol.getId());
    return (c != 0) ? c : Integer.compare(level, other.level);
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof SymbolIndirection))
      return false;
    SymbolIndirection other = (SymbolIndirection)o;
    return symbol.getId() == other.symbol.getId() && level == other.level;
  }

  @Override
  public int hashCode()
  {
    return 31 * symbol.getId() + level;
  }

  /** Prints the pair as C would spell it, such as <b>**p</b> or <b>&x</b>. */
  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    int n = Math.abs(level);
    for (int i = 0; i < n; i++)
      sb.append(level > 0 ? '*' : '&');
    String name = symbol.getSymbolName();
    sb.append(name.length() == 0 ? "<unnamed>" : name);
    return sb.toString();
  }
}
