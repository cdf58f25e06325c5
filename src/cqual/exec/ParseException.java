package cqual.exec;

/**
* Thrown when an input file cannot be parsed. The message carries the file,
* line and column of the offending token.
*/
public class ParseException extends Exception
{
  private static final long serialVersionUID = 1;

  public ParseException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
