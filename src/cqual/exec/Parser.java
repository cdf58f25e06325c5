package cqual.exec;

import antlr.RecognitionException;
import antlr.TokenStreamException;
import antlr.TokenStreamRecognitionException;
import cqual.base.grammars.CQualLexer;
import cqual.base.grammars.CQualParser;
import cqual.hir.PrintTools;
import cqual.hir.Program;
import cqual.hir.Tools;
import cqual.hir.TranslationUnit;

import java.io.*;
import java.nio.charset.StandardCharsets;

/**
* Front-end facade: reads a source file and builds its translation unit with
* the lexer and parser generated from CQualParser.g. Text is read as ISO-8859-1 so that every byte maps
* to one character and offsets can be written back unchanged.
*/
public class Parser
{
  /**
   * Parses the named file.
   *
   * @param program the program that hands out ids.
   * @param input_filename name of file to parse.
   * @return the parsed translation unit.
   * @throws IOException if the file cannot be read.
   * @throws ParseException if the file is not valid input.
   */
  public TranslationUnit parse(Program program, String input_filename)
      throws IOException, ParseException
  {
    return parse(program, input_filename, readFile(input_filename));
  }

  /**
   * Parses source text that is attributed to the given file name.
   *
   * @param program the program that hands out ids.
   * @param input_filename the name the text is reported under.
   * @param text the source text.
   * @return the parsed translation unit.
   * @throws ParseException if the text is not valid input.
   */
  public TranslationUnit parse(Program program, String input_filename,
      String text) throws ParseException
  {
    double timer = Tools.getTime();
    TranslationUnit tu = new TranslationUnit(input_filename, text);
    CQualLexer lexer = new CQualLexer(new StringReader(text));
    lexer.initialize(text, input_filename);
    CQualParser parser = new CQualParser(lexer);
    parser.setFilename(input_filename);
    try {
      parser.translationUnit(program, tu);
    } catch (TokenStreamRecognitionException e) {
      throw new ParseException(e.recog.toString(), e);
    } catch (RecognitionException e) {
      throw new ParseException(e.toString(), e);
    } catch (TokenStreamException e) {
      throw new ParseException(e.getMessage(), e);
    }
    PrintTools.printlnStatus(1, "[Parser]", input_filename, "parsed in",
        String.format("%.2f seconds", Tools.getTime(timer)));
    return tu;
  }

  /** Reads a whole file as ISO-8859-1 text. */
  public static String readFile(String file_name) throws IOException
  {
    InputStream in = new FileInputStream(file_name);
    try {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      byte[] buf = new byte[8192];
      int n;
      while ((n = in.read(buf)) > 0)
        bytes.write(buf, 0, n);
      return new String(bytes.toByteArray(), StandardCharsets.ISO_8859_1);
    } finally {
      in.close();
    }
  }

  /** Writes text as ISO-8859-1, the inverse of {@link #readFile}. */
  public static void writeFile(String file_name, String text)
      throws IOException
  {
    OutputStream out = new FileOutputStream(file_name);
    try {
      out.write(text.getBytes(StandardCharsets.ISO_8859_1));
    } finally {
      out.close();
    }
  }
}
