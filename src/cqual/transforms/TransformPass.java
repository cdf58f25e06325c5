package cqual.transforms;

import cqual.hir.*;

/**
* Base class of all transformation passes. Transformations in this framework
* rewrite the source text of translation units and leave the IR unchanged,
* which is checked at the end of every pass.
*/
public abstract class TransformPass {

    /** The associated program */
    protected Program program;

    /** Flags for skipping consistency checking */
    protected boolean disable_protection;

    /** Constructs a transform pass with the given program */
    protected TransformPass(Program program) {
        this.program = program;
        disable_protection = false;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    *
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(pass.getPassName() + " begin", 1);
        pass.start();
        PrintTools.printlnStatus(pass.getPassName() + " end in " +
                String.format("%.2f seconds", Tools.getTime(timer)), 1);
        if (!pass.disable_protection && pass.program != null) {
            if (!IRTools.checkConsistency(pass.program)) {
                throw new InternalError("Inconsistent IR after " +
                                        pass.getPassName());
            }
        }
    }

    /** Starts a transform pass */
    public abstract void start();

}
