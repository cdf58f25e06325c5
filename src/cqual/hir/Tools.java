package cqual.hir;

/**
* <b>Tools</b> provides process-level helpers shared by the passes: timing
* and the single exit point of the tool.
*/
public final class Tools {

    /** Flag for selecting how exit() is handled. */
    private static boolean exit_throws_exception = false;

    private Tools() {
    }

    /**
    * Selects how Tools.exit() behaves.
    * Setting <b>flag = true</b> causes <b>Tools.exit()</b> to throw a runtime
    * exception instead of invoking <b>System.exit()</b>.
    *
    * @param flag the boolean flag.
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Invokes exit operation.
    * Depending on the flag set by {@link #exitThrowsException(boolean)}, this
    * method either calls {@link System#exit(int)} or throws an
    * {@link ExitException} carrying the status.
    *
    * @param status the exit status.
    * @throws ExitException if the last call to
    *       {@link #exitThrowsException(boolean)} is with <b>true</b>.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new ExitException(status);
        } else {
            System.exit(status);
        }
    }

    /**
    * Returns the current system time in seconds.
    *
    * @return the time in seconds.
    */
    public static double getTime() {
        return System.currentTimeMillis() / 1000.0;
    }

    /**
    * Returns the elapsed time in seconds since the given time stamp.
    *
    * @param since a time stamp obtained by {@link #getTime()}.
    * @return the elapsed seconds.
    */
    public static double getTime(double since) {
        return getTime() - since;
    }

    /**
    * Thrown by {@link Tools#exit(int)} instead of terminating the JVM when
    * exits are redirected to exceptions.
    */
    public static class ExitException extends RuntimeException {

        private static final long serialVersionUID = 1;

        private final int status;

        public ExitException(int status) {
            super("Exiting with status " + status);
            this.status = status;
        }

        /** Returns the requested exit status. */
        public int getStatus() {
            return status;
        }

    }

}
