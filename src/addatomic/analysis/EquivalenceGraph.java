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

import java.io.PrintWriter;
import java.util.*;

import cqual.hir.Symbol;

/**
 * Undirected graph over (declaration, level) pairs. An edge between
 * <b>(a, i)</b> and <b>(b, j)</b> states that the type of <b>a</b> after
 * <b>i</b> indirections and the type of <b>b</b> after <b>j</b> indirections
 * must carry the same qualifiers. Edges are stored under both endpoints.
 *
 * A second relation links redeclarations of the same entity; those links
 * hold at every level.
 */
public class EquivalenceGraph
{
  /** Symbol id to local level to the pairs linked with it. */
  private final Map<Integer, TreeMap<Integer, TreeSet<SymbolIndirection>>> edges;

  private final Map<Integer, TreeSet<SymbolIndirection>> redeclarations;

  private final Map<Integer, Symbol> symbols;

  private int num_edges;

  public EquivalenceGraph()
  {
    edges = new HashMap<Integer, TreeMap<Integer, TreeSet<SymbolIndirection>>>();
    redeclarations = new HashMap<Integer, TreeSet<SymbolIndirection>>();
    symbols = new TreeMap<Integer, Symbol>();
    num_edges = 0;
  }

  /**
   * Links two pairs in both directions. Linking a pair with itself is a no-op.
   *
   * @return true if the edge is new.
   */
  public boolean addEdge(SymbolIndirection a, SymbolIndirection b)
  {
    if (a.equals(b))
      return false;
    boolean added = insert(a, b);
    insert(b, a);
    if (added)
      num_edges++;
    return added;
  }

  private boolean insert(SymbolIndirection from, SymbolIndirection to)
  {
    Symbol symbol = from.getSymbol();
    symbols.put(symbol.getId(), symbol);
    TreeMap<Integer, TreeSet<SymbolIndirection>> by_level = edges.get(symbol.getId());
    if (by_level == null) {
      by_level = new TreeMap<Integer, TreeSet<SymbolIndirection>>();
      edges.put(symbol.getId(), by_level);
    }
    TreeSet<SymbolIndirection> targets = by_level.get(from.getLevel());
    if (targets == null) {
      targets = new TreeSet<SymbolIndirection>();
      by_level.put(from.getLevel(), targets);
    }
    return targets.add(to);
  }

  /** Records that <b>a</b> and <b>b</b> declare the same entity. */
  public void addRedeclaration(Symbol a, Symbol b)
  {
    if (a.getId() == b.getId())
      return;
    addRedeclaration0(a, b);
    addRedeclaration0(b, a);
  }

  private void addRedeclaration0(Symbol from, Symbol to)
  {
    symbols.put(from.getId(), from);
    TreeSet<SymbolIndirection> set = redeclarations.get(from.getId());
    if (set == null) {
      set = new TreeSet<SymbolIndirection>();
      redeclarations.put(from.getId(), set);
    }
    set.add(new SymbolIndirection(to, 0));
  }

  public boolean hasEdge(SymbolIndirection a, SymbolIndirection b)
  {
    return getNeighbors(a.getSymbol(), a.getLevel()).contains(b);
  }

  /**
   * Returns the edges of a symbol keyed by its local level.
   *
   * @return an unmodifiable view, empty if the symbol has no edges.
   */
  public SortedMap<Integer, TreeSet<SymbolIndirection>> getEdges(Symbol symbol)
  {
    TreeMap<Integer, TreeSet<SymbolIndirection>> by_level = edges.get(symbol.getId());
    if (by_level == null)
      return Collections.unmodifiableSortedMap(
          new TreeMap<Integer, TreeSet<SymbolIndirection>>());
    return Collections.unmodifiableSortedMap(by_level);
  }

  /** Returns the pairs linked with <b>symbol</b> at <b>level</b>. */
  public Set<SymbolIndirection> getNeighbors(Symbol symbol, int level)
  {
    TreeSet<SymbolIndirection> set = getEdges(symbol).get(level);
    if (set == null)
      return Collections.emptySet();
    return Collections.unmodifiableSet(set);
  }

  /** Returns the other declarations of the same entity. */
  public Set<Symbol> getRedeclarations(Symbol symbol)
  {
    TreeSet<SymbolIndirection> set = redeclarations.get(symbol.getId());
    if (set == null)
      return Collections.emptySet();
    Set<Symbol> ret = new LinkedHashSet<Symbol>();
    for (SymbolIndirection si : set)
      ret.add(si.getSymbol());
    return ret;
  }

  public int getNumEdges()
  {
    return num_edges;
  }

  /**
   * Prints every edge once, as <b>*p ~ &x</b>, followed by the
   * redeclaration links.
   */
  public void print(PrintWriter o)
  {
    for (Symbol symbol : symbols.values())
    {
      for (Map.Entry<Integer, TreeSet<SymbolIndirection>> entry :
          getEdges(symbol).entrySet())
      {
        SymbolIndirection from = new SymbolIndirection(symbol, entry.getKey());
        for (SymbolIndirection to : entry.getValue())
          if (from.compareTo(to) < 0)
            o.println(from + " ~ " + to);
      }
    }
    for (Symbol symbol : symbols.values())
      for (Symbol other : getRedeclarations(symbol))
        if (symbol.getId() < other.getId())
          o.println(symbol.getSymbolName() + " == " + other.getSymbolName() +
              " (lines " + symbol.getLine() + ", " + other.getLine() + ")");
    o.flush();
  }
}
