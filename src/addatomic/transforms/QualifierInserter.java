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

package addatomic.transforms;

import java.util.*;

import addatomic.UnsupportedTypeShapeException;
import addatomic.analysis.UpgradeMap;
import cqual.hir.*;
import cqual.transforms.Rewriter;
import cqual.transforms.TransformPass;

/**
 * Writes the qualifier into the source text of every upgraded declaration.
 *
 * The insertion point of a declaration at level <b>n</b> is found by
 * descending its written type: function layers lead to the return type,
 * pointer and array layers consume one level each, and at level 0 the
 * qualifier goes right after the layer's last token. All insertion points
 * are computed before the first edit.
 */
public class QualifierInserter extends TransformPass
{
  private static String pass_name = "[QualifierInserter]";

  private final UpgradeMap upgrades;

  private final String qualifier;

  /** Rewritten text of each translation unit. */
  private final Map<TranslationUnit, String> outputs;

  public QualifierInserter(Program program, UpgradeMap upgrades, String qualifier)
  {
    super(program);
    this.upgrades = upgrades;
    this.qualifier = qualifier;
    outputs = new LinkedHashMap<TranslationUnit, String>();
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void start()
  {
    Map<TranslationUnit, TreeSet<Integer>> points =
      new LinkedHashMap<TranslationUnit, TreeSet<Integer>>();
    for (TranslationUnit tu : program.getTranslationUnits())
      points.put(tu, new TreeSet<Integer>());

    for (Map.Entry<Symbol, Integer> entry : upgrades.getSortedEntries())
    {
      Symbol symbol = entry.getKey();
      int level = entry.getValue();
      if (level < 0)
      {
        PrintTools.printlnStatus(1, pass_name, "skipping", symbol.getSymbolName(),
            "at level", level, "(address only, nothing to qualify)");
        continue;
      }
      if (!symbol.isInPrimaryFile())
      {
        PrintTools.printlnWarning(symbol.getSymbolName() + " (line " +
            symbol.getLine() + ") is declared outside the input file; not qualified");
        continue;
      }
      int offset = insertionOffset(symbol, level);
      TranslationUnit tu = symbol.getDeclaration().getTranslationUnit();
      if (!points.get(tu).add(offset))
        PrintTools.printlnStatus(2, pass_name, symbol.getSymbolName(),
            "shares insertion point", offset);
    }

    String text = " " + qualifier + " ";
    for (Map.Entry<TranslationUnit, TreeSet<Integer>> entry : points.entrySet())
    {
      Rewriter rewriter = new Rewriter(entry.getKey().getSource());
      for (int offset : entry.getValue())
        rewriter.insertText(offset, text);
      PrintTools.printlnStatus(1, pass_name, rewriter.getEditCount(), "insertion(s) in",
          entry.getKey().getInputFilename());
      outputs.put(entry.getKey(), rewriter.getRewrittenText());
    }
  }

  /**
   * Finds the source offset where the qualifier for <b>symbol</b> at
   * <b>level</b> goes.
   *
   * @param symbol the declaration.
   * @param level a non-negative indirection level.
   * @return the offset just past the token ending the type layer.
   * @throws UnsupportedTypeShapeException if the written type has no layer
   *   at that level.
   */
  public static int insertionOffset(Symbol symbol, int level)
  {
    TypeStructure type = symbol.getTypeStructure();
    int remaining = level;
    while (true)
    {
      TypeStructure.Kind kind = type.getKind();
      if (kind == TypeStructure.Kind.FUNCTION)
        type = type.getInner();
      else if (remaining == 0)
        return type.getEndOffset();
      else if (kind == TypeStructure.Kind.POINTER || kind == TypeStructure.Kind.ARRAY)
      {
        type = type.getInner();
        remaining--;
      }
      else
        throw new UnsupportedTypeShapeException(symbol, remaining, type);
    }
  }

  /**
   * Returns the rewritten source of a translation unit.
   *
   * @throws IllegalStateException if the pass has not run.
   */
  public String getOutput(TranslationUnit tu)
  {
    String ret = outputs.get(tu);
    if (ret == null)
      throw new IllegalStateException(pass_name + " has not run on " +
          tu.getInputFilename());
    return ret;
  }
}
