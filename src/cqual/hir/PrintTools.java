package cqual.hir;

import cqual.exec.Driver;

import java.io.PrintWriter;
import java.util.Collection;
import java.util.Iterator;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of IR
* or status messages gated by the <b>-verbosity</b> command-line option.
*/
public final class PrintTools {

    /** Short name for the line separator system property. */
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Returns the global verbosity taken from the command-line option, or zero
    * if no valid value has been set.
    *
    * @return the verbosity level.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            return 0;
        }
    }

    /**
    * Prints a string to System.err if the verbosity level is at least
    * min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is at least {@code min_verbosity}. String
    * composition happens only if the verbosity level is met.
    *
    * @param min_verbosity the minimum verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity() && items.length > 0) {
            StringBuilder sb = new StringBuilder(80);
            sb.append(items[0]);
            for (int i = 1; i < items.length; i++) {
                sb.append(" ").append(items[i]);
            }
            System.err.println(sb.toString());
        }
    }

    /**
    * Prints a string to System.err regardless of the verbosity, prefixed so
    * that warnings stand out from status messages.
    *
    * @param message the warning text.
    */
    public static void printlnWarning(String message) {
        System.err.println("[WARNING] " + message);
    }

    /**
    * Prints a list of printable objects separated by the given separator.
    *
    * @param list the objects to be printed; null entries are skipped.
    * @param o the target writer.
    * @param sep the separator.
    */
    public static void printListWithSeparator(
            Collection<? extends Printable> list, PrintWriter o, String sep) {
        if (list == null) {
            return;
        }
        boolean first = true;
        Iterator<? extends Printable> iter = list.iterator();
        while (iter.hasNext()) {
            Printable p = iter.next();
            if (p == null) {
                continue;
            }
            if (!first) {
                o.print(sep);
            }
            p.print(o);
            first = false;
        }
    }

    /**
    * Prints a list of printable objects separated by commas.
    *
    * @param list the objects to be printed.
    * @param o the target writer.
    */
    public static void printListWithComma(
            Collection<? extends Printable> list, PrintWriter o) {
        printListWithSeparator(list, o, ", ");
    }

    /**
    * Prints a list of printable objects, one per line.
    *
    * @param list the objects to be printed.
    * @param o the target writer.
    */
    public static void printlnList(
            Collection<? extends Printable> list, PrintWriter o) {
        if (list == null) {
            return;
        }
        for (Printable p : list) {
            if (p != null) {
                p.print(o);
                o.println();
            }
        }
    }

}
