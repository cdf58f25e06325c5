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

import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;

import cqual.hir.Symbol;

/**
 * The set of declarations, each at some indirection level, that an
 * expression names. Sets are immutable and ordered by symbol id and level.
 */
public final class IdentitySet implements Iterable<SymbolIndirection>
{
  public static final IdentitySet EMPTY =
      new IdentitySet(new TreeSet<SymbolIndirection>());

  private final Set<SymbolIndirection> elements;

  private IdentitySet(TreeSet<SymbolIndirection> elements)
  {
    this.elements = Collections.unmodifiableSet(elements);
  }

  /** Returns the singleton set of <b>symbol</b> at level <b>level</b>. */
  public static IdentitySet of(Symbol symbol, int level)
  {
    TreeSet<SymbolIndirection> set = new TreeSet<SymbolIndirection>();
    set.add(new SymbolIndirection(symbol, level));
    return new IdentitySet(set);
  }

  /**
   * Moves every element by the same number of indirections.
   *
   * @param delta the level change.
   * @return the shifted set.
   */
  public IdentitySet shift(int delta)
  {
    if (delta == 0 || elements.isEmpty())
      return this;
    TreeSet<SymbolIndirection> set = new TreeSet<SymbolIndirection>();
    for (SymbolIndirection si : elements)
      set.add(si.shift(delta));
    return new IdentitySet(set);
  }

  public IdentitySet union(IdentitySet other)
  {
    if (other.isEmpty())
      return this;
    if (isEmpty())
      return other;
    TreeSet<SymbolIndirection> set = new TreeSet<SymbolIndirection>(elements);
    set.addAll(other.elements);
    return new IdentitySet(set);
  }

  public boolean isEmpty()
  {
    return elements.isEmpty();
  }

  public int size()
  {
    return elements.size();
  }

  public boolean contains(Symbol symbol, int level)
  {
    return elements.contains(new SymbolIndirection(symbol, level));
  }

  public Iterator<SymbolIndirection> iterator()
  {
    return elements.iterator();
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof IdentitySet) &&
        elements.equals(((IdentitySet)o).elements);
  }

  @Override
  public int hashCode()
  {
    return elements.hashCode();
  }

  @Override
  public String toString()
  {
    return elements.toString();
  }
}
