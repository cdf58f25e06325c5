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

import java.util.*;

import cqual.hir.Symbol;

/**
 * The result of propagation: for each declaration that must receive the
 * qualifier, the indirection level it goes to. A declaration has at most one
 * level. Iteration follows discovery order.
 */
public class UpgradeMap implements Iterable<Map.Entry<Symbol, Integer>>
{
  private final LinkedHashMap<Symbol, Integer> levels;

  public UpgradeMap()
  {
    levels = new LinkedHashMap<Symbol, Integer>();
  }

  /**
   * Returns the level recorded for a declaration.
   *
   * @return the level, or null if the declaration is not upgraded.
   */
  public Integer getLevel(Symbol symbol)
  {
    return levels.get(symbol);
  }

  public boolean contains(Symbol symbol)
  {
    return levels.containsKey(symbol);
  }

  /**
   * Records a level for a declaration that has none yet.
   *
   * @throws IllegalStateException if the declaration already has a level.
   */
  public void put(Symbol symbol, int level)
  {
    if (levels.containsKey(symbol))
      throw new IllegalStateException(symbol.getSymbolName() + " already upgraded");
    levels.put(symbol, level);
  }

  public int size()
  {
    return levels.size();
  }

  public Iterator<Map.Entry<Symbol, Integer>> iterator()
  {
    return Collections.unmodifiableMap(levels).entrySet().iterator();
  }

  /** Returns the entries ordered by symbol id, which is declaration order. */
  public List<Map.Entry<Symbol, Integer>> getSortedEntries()
  {
    List<Map.Entry<Symbol, Integer>> ret =
        new ArrayList<Map.Entry<Symbol, Integer>>(levels.entrySet());
    Collections.sort(ret, new Comparator<Map.Entry<Symbol, Integer>>() {
      public int compare(Map.Entry<Symbol, Integer> a, Map.Entry<Symbol, Integer> b)
      {
        return Integer.compare(a.getKey().getId(), b.getKey().getId());
      }
    });
    return ret;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder("{");
    String sep = "";
    for (Map.Entry<Symbol, Integer> entry : getSortedEntries())
    {
      sb.append(sep).append(entry.getKey().getSymbolName()).append(" -> ")
          .append(entry.getValue());
      sep = ", ";
    }
    return sb.append("}").toString();
  }
}
