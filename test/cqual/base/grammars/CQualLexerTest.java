package cqual.base.grammars;

import antlr.Token;
import antlr.TokenStreamException;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CQualLexerTest
{
  private static List<CToken> lex(String text) throws TokenStreamException
  {
    CQualLexer lexer = new CQualLexer(new StringReader(text));
    lexer.initialize(text, "input.c");
    List<CToken> ret = new ArrayList<CToken>();
    while (true) {
      CToken t = (CToken)lexer.nextToken();
      if (t.getType() == Token.EOF_TYPE)
        return ret;
      ret.add(t);
    }
  }

  @Test
  public void classifiesTokensAndRecordsOffsets() throws Exception
  {
    List<CToken> tokens = lex("int *p;");
    assertEquals(4, tokens.size());
    assertEquals(CQualTokenTypes.LITERAL_int, tokens.get(0).getType());
    assertEquals(CQualTokenTypes.STAR, tokens.get(1).getType());
    assertEquals(CQualTokenTypes.ID, tokens.get(2).getType());
    assertEquals(CQualTokenTypes.SEMI, tokens.get(3).getType());
    assertEquals(0, tokens.get(0).getOffset());
    assertEquals(3, tokens.get(0).getEndOffset());
    assertEquals(4, tokens.get(1).getOffset());
    assertEquals(5, tokens.get(1).getEndOffset());
    assertEquals("p", tokens.get(2).getText());
    assertEquals(1, tokens.get(2).getLine());
    assertEquals(6, tokens.get(2).getColumn());
    assertEquals("input.c", tokens.get(2).getFilename());
  }

  @Test
  public void offsetsCountFromStartOfText() throws Exception
  {
    List<CToken> tokens = lex("int a;\n\tlong b;");
    CToken b = tokens.get(4);
    assertEquals("b", b.getText());
    assertEquals(2, b.getLine());
    assertEquals(13, b.getOffset());
    assertEquals(14, b.getEndOffset());
  }

  @Test
  public void takesLongestOperator() throws Exception
  {
    List<CToken> tokens = lex("a->b <<= c ... d");
    assertEquals(CQualTokenTypes.PTR, tokens.get(1).getType());
    assertEquals(CQualTokenTypes.LSHIFT_ASSIGN, tokens.get(3).getType());
    assertEquals(CQualTokenTypes.ELLIPSIS, tokens.get(5).getType());
    assertEquals("...", tokens.get(5).getText());
  }

  @Test
  public void skipsCommentsAndDirectives() throws Exception
  {
    List<CToken> tokens = lex("#include <stdio.h>\n" +
        "#define M(x) \\\n  (x + 1)\n" +
        "/* block\n comment */ int // line comment\nx;");
    assertEquals(3, tokens.size());
    assertEquals("int", tokens.get(0).getText());
    assertEquals(5, tokens.get(0).getLine());
    assertEquals("x", tokens.get(1).getText());
    assertEquals(6, tokens.get(1).getLine());
  }

  @Test
  public void scansLiterals() throws Exception
  {
    List<CToken> tokens = lex("1.5e-3 0x1p+4 'a' \"s\\\"t\" L\"w\" 42u .5");
    assertEquals(7, tokens.size());
    assertEquals("1.5e-3", tokens.get(0).getText());
    assertEquals(CQualTokenTypes.NUMBER, tokens.get(0).getType());
    assertEquals("0x1p+4", tokens.get(1).getText());
    assertEquals(CQualTokenTypes.CHAR_LITERAL, tokens.get(2).getType());
    assertEquals("\"s\\\"t\"", tokens.get(3).getText());
    assertEquals(CQualTokenTypes.STRING_LITERAL, tokens.get(4).getType());
    assertEquals("L\"w\"", tokens.get(4).getText());
    assertEquals("42u", tokens.get(5).getText());
    assertEquals(CQualTokenTypes.NUMBER, tokens.get(6).getType());
  }

  @Test
  public void signAfterPlainDigitEndsNumber() throws Exception
  {
    List<CToken> tokens = lex("1+2");
    assertEquals(3, tokens.size());
    assertEquals(CQualTokenTypes.PLUS, tokens.get(1).getType());
  }

  @Test
  public void followsLinemarkers() throws Exception
  {
    List<CToken> tokens = lex("# 1 \"header.h\"\nint a;\n" +
        "#line 7 \"input.c\"\nint b;\n");
    CToken a = tokens.get(1);
    assertEquals("a", a.getText());
    assertEquals("header.h", a.getFilename());
    assertEquals(1, a.getLine());
    CToken b = tokens.get(4);
    assertEquals("input.c", b.getFilename());
    assertEquals(7, b.getLine());
  }

  @Test
  public void reportsUnexpectedCharacter()
  {
    TokenStreamException e = assertThrows(TokenStreamException.class,
        () -> lex("int @;"));
    assertTrue(e.toString().startsWith("input.c:1:5:"), e.toString());
    assertTrue(e.toString().contains("'@'"), e.toString());
  }

  @Test
  public void reportsUnterminatedComment()
  {
    assertThrows(TokenStreamException.class, () -> lex("int x; /* open"));
  }

  @Test
  public void reportsUnterminatedString()
  {
    assertThrows(TokenStreamException.class, () -> lex("char *s = \"abc\n;"));
  }
}
