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

/**
 * Thrown when no declaration matches the requested seed name, or when a
 * random seed is requested and the primary file declares nothing.
 */
public class SeedNotFoundException extends AddAtomicException
{
  private static final long serialVersionUID = 1;

  public SeedNotFoundException(String message)
  {
    super(message);
  }
}
