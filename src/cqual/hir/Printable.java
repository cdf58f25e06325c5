package cqual.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface has the ability to print itself
* to a writer.
*/
public interface Printable {

    /**
    * Prints the object on the specified writer.
    *
    * @param o the target writer.
    */
    void print(PrintWriter o);

}
