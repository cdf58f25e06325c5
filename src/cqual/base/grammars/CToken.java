package cqual.base.grammars;

import antlr.CommonToken;

/**
* A token that remembers where it came from: the character offsets in the
* translation unit's text and the file named by the last linemarker.
* {@link CQualLexer} creates these through its token object class.
*/
public class CToken extends CommonToken
{
  private int offset;

  private int end_offset;

  private String file_name;

  public CToken()
  {
    super();
  }

  /** Returns the offset of the first character. */
  public int getOffset()
  {
    return offset;
  }

  public void setOffset(int offset)
  {
    this.offset = offset;
  }

  /** Returns the offset just past the last character. */
  public int getEndOffset()
  {
    return end_offset;
  }

  public void setEndOffset(int end_offset)
  {
    this.end_offset = end_offset;
  }

  public String getFilename()
  {
    return file_name;
  }

  public void setFilename(String file_name)
  {
    this.file_name = file_name;
  }

  public String toString()
  {
    return "[\"" + getText() + "\",<" + getType() + ">,line=" + getLine() +
        ",col=" + getColumn() + "]";
  }
}
