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

import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import addatomic.ContradictionException;
import cqual.analysis.AnalysisPass;
import cqual.hir.PrintTools;
import cqual.hir.Symbol;

/**
 * Spreads the qualifier from a seed declaration across the equivalence graph
 * in breadth-first order.
 *
 * When <b>d</b> is qualified at level <b>L</b>, an edge from <b>(d, k)</b> to
 * <b>(d2, r)</b> is followed if the mode admits <b>L - k</b>, and gives
 * <b>d2</b> the level <b>L + r - k</b>. Redeclarations get level <b>L</b>.
 * Reaching a declaration that already has another level is a contradiction.
 */
public class UpgradePropagator extends AnalysisPass
{
  private static String pass_name = "[UpgradePropagator]";

  /** Which edges of a qualified declaration are followed. */
  public enum Mode
  {
    /** Edges below the qualified level only: {@code L - k > 0}. */
    POINTEE,
    /** Edges at or below the qualified level: {@code L - k >= 0}. */
    VALUE;

    boolean follows(int level, int local_level)
    {
      int depth = level - local_level;
      return (this == POINTEE) ? depth > 0 : depth >= 0;
    }

    /**
     * Parses the option value.
     *
     * @return the mode, or null if <b>name</b> names none.
     */
    public static Mode fromOption(String name)
    {
      for (Mode mode : values())
        if (mode.name().equalsIgnoreCase(name))
          return mode;
      return null;
    }
  }

  private final EquivalenceGraph graph;

  private final Mode mode;

  private Symbol seed;

  private UpgradeMap upgrades;

  public UpgradePropagator(EquivalenceGraph graph, Symbol seed, Mode mode)
  {
    super(null);
    this.graph = graph;
    this.seed = seed;
    this.mode = mode;
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void start()
  {
    upgrades = propagate(seed);
    PrintTools.printlnStatus(1, pass_name, "seed", seed.getSymbolName(),
        "(line " + seed.getLine() + "):", upgrades);
  }

  public UpgradeMap getUpgradeMap()
  {
    return upgrades;
  }

  /**
   * Computes the levels of every declaration reachable from <b>start</b>
   * qualified at level 0.
   *
   * @throws ContradictionException if some declaration would need two levels.
   */
  public UpgradeMap propagate(Symbol start)
  {
    UpgradeMap map = new UpgradeMap();
    LinkedList<SymbolIndirection> work = new LinkedList<SymbolIndirection>();
    map.put(start, 0);
    work.add(new SymbolIndirection(start, 0));

    while (!work.isEmpty())
    {
      SymbolIndirection current = work.removeFirst();
      Symbol symbol = current.getSymbol();
      int level = current.getLevel();

      for (Map.Entry<Integer, TreeSet<SymbolIndirection>> entry :
          graph.getEdges(symbol).entrySet())
      {
        int k = entry.getKey();
        if (!mode.follows(level, k))
          continue;
        for (SymbolIndirection neighbor : entry.getValue())
          visit(map, work, neighbor.getSymbol(),
              level + neighbor.getLevel() - k, symbol);
      }

      Set<Symbol> redeclarations = graph.getRedeclarations(symbol);
      for (Symbol other : redeclarations)
        visit(map, work, other, level, symbol);
    }
    return map;
  }

  private void visit(UpgradeMap map, LinkedList<SymbolIndirection> work,
      Symbol target, int level, Symbol via)
  {
    Integer existing = map.getLevel(target);
    if (existing == null)
    {
      map.put(target, level);
      work.add(new SymbolIndirection(target, level));
      PrintTools.printlnStatus(3, pass_name, target.getSymbolName(), "->",
          level, "via", via.getSymbolName());
    }
    else if (existing != level)
    {
      throw new ContradictionException(target, existing, level, via);
    }
  }
}
