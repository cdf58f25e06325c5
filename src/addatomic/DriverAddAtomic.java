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

import java.io.IOException;
import java.util.Random;

import cqual.analysis.AnalysisPass;
import cqual.exec.Driver;
import cqual.exec.Parser;
import cqual.hir.*;
import cqual.transforms.TransformPass;

import addatomic.analysis.*;
import addatomic.transforms.*;

/**
 * Entry point of the add-atomic tool. It reads one C file, finds every
 * declaration that must share the qualifier of a seed declaration, and
 * writes the file with the qualifier inserted into each of them.
 */
public class DriverAddAtomic extends Driver
{
  private static final String VERSION = "1.0";

  public DriverAddAtomic()
  {
    super();
    tool_name = "add-atomic";
    options_file_name = "options.addatomic";
    options.add(options.UTILITY, "output", null, "FILE",
        "Write the qualified program to FILE (required)");
    options.add(options.ANALYSIS, "name", null, "DECL",
        "Seed declaration; when absent a declaration is chosen at random");
    options.add(options.ANALYSIS, "seed", null, "N",
        "Random seed for choosing the seed declaration (default is nondeterministic)");
    options.add(options.ANALYSIS, "propagation", "pointee", "pointee|value",
        "Follow links below the qualified level only (pointee) or also at it (value)");
    options.add(options.ANALYSIS, "redeclarations", "1", "0|1",
        "Treat redeclarations of a file-scope name as the same declaration");
    options.add(options.ANALYSIS, "dump-graph",
        "Print the equivalence graph to stderr");
    options.add(options.TRANSFORM, "qualifier", "_Atomic", "Q",
        "Qualifier to insert (default is _Atomic)");
  }

  protected void checkOptions()
  {
    if (getOptionValue("output") == null)
      fail("no output file given (use -output=FILE)");
    if (filenames.size() != 1)
      fail("expected exactly one input file, got " + filenames.size());
    if (UpgradePropagator.Mode.fromOption(getOptionValue("propagation")) == null)
      fail("unknown propagation mode '" + getOptionValue("propagation") + "'");
    String seed = getOptionValue("seed");
    if (seed != null)
    {
      try {
        Long.parseLong(seed);
      } catch (NumberFormatException e) {
        fail("invalid random seed '" + seed + "'");
      }
    }
    String redecl = getOptionValue("redeclarations");
    if (!"0".equals(redecl) && !"1".equals(redecl))
      fail("-redeclarations must be 0 or 1");
    String qualifier = getOptionValue("qualifier");
    if (qualifier == null || qualifier.trim().length() == 0)
      fail("empty qualifier");
  }

  /**
   * Runs the graph builder, the propagator and the inserter, then writes the
   * output. Nothing is written if any stage fails.
   */
  public void runPasses()
  {
    try {
      EquivalenceGraphBuilder builder = new EquivalenceGraphBuilder(program,
          "1".equals(getOptionValue("redeclarations")),
          getOptionValue("dump-graph") != null);
      AnalysisPass.run(builder);

      Symbol seed = selectSeed();

      UpgradePropagator propagator = new UpgradePropagator(builder.getGraph(),
          seed, UpgradePropagator.Mode.fromOption(getOptionValue("propagation")));
      AnalysisPass.run(propagator);

      QualifierInserter inserter = new QualifierInserter(program,
          propagator.getUpgradeMap(), getOptionValue("qualifier").trim());
      TransformPass.run(inserter);

      TranslationUnit tu = program.getTranslationUnits().get(0);
      Parser.writeFile(getOptionValue("output"), inserter.getOutput(tu));
    } catch (AddAtomicException e) {
      fail(e.getMessage());
    } catch (IOException e) {
      fail("cannot write " + getOptionValue("output") + ": " + e.getMessage());
    }
  }

  private Symbol selectSeed()
  {
    SeedSelector selector = new SeedSelector(program);
    String name = getOptionValue("name");
    if (name != null)
      return selector.selectByName(name);

    long random_seed;
    if (getOptionValue("seed") != null)
    {
      random_seed = Long.parseLong(getOptionValue("seed"));
      PrintTools.printlnStatus("[SeedSelector] random seed " + random_seed, 1);
    }
    else
    {
      random_seed = new Random().nextLong();
      PrintTools.printlnStatus("[SeedSelector] random seed " + random_seed +
          " (pass -seed=" + random_seed + " to repeat this run)", 0);
    }
    Symbol seed = selector.selectRandom(random_seed);
    PrintTools.printlnStatus("[SeedSelector] chose " + seed.getSymbolName() +
        " (line " + seed.getLine() + ")", 0);
    return seed;
  }

  public void printVersion()
  {
    System.err.println(tool_name + " " + VERSION);
  }

  /**
   * Entry point; creates a new driver and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    (new DriverAddAtomic()).run(args);
  }
}
