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
 * Thrown for a brace initializer whose shape does not match its target:
 * designators, a wrong element count for a record, or braces around a
 * scalar.
 */
public class UnsupportedInitializerShapeException extends AddAtomicException
{
  private static final long serialVersionUID = 1;

  public UnsupportedInitializerShapeException(Symbol target, int level,
      String reason)
  {
    super("unsupported initializer for " + describe(target) + " at level " +
        level + ": " + reason);
  }
}
