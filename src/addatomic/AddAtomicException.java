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

import cqual.hir.Symbol;

/**
 * Base class of the fatal conditions of the add-atomic tool. The driver
 * reports the message and exits without writing output.
 */
public class AddAtomicException extends RuntimeException
{
  private static final long serialVersionUID = 1;

  public AddAtomicException(String message)
  {
    super(message);
  }

  /**
   * Formats a symbol for diagnostics as its name and declaration line.
   *
   * @param symbol the symbol to describe.
   * @return a short description.
   */
  public static String describe(Symbol symbol)
  {
    String name = symbol.getSymbolName();
    if (name.length() == 0)
      name = "<unnamed parameter>";
    return "'" + name + "' (line " + symbol.getLine() + ")";
  }
}
