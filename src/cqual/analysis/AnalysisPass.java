package cqual.analysis;

import cqual.hir.IRTools;
import cqual.hir.PrintTools;
import cqual.hir.Program;
import cqual.hir.Tools;

/**
* Base class of analysis passes. An analysis reads the IR and publishes its
* result through accessors of the concrete pass.
*/
public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    this.program = program;
  }

  public abstract String getPassName();

  /**
  * Runs the pass with timing messages and checks the IR afterwards.
  *
  * @param pass the pass to run.
  */
  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.printlnStatus(pass.getPassName() + " begin", 1);
    pass.start();
    PrintTools.printlnStatus(pass.getPassName() + " end in " +
        String.format("%.2f seconds", Tools.getTime(timer)), 1);
    if (pass.program != null && !IRTools.checkConsistency(pass.program))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  public abstract void start();
}
