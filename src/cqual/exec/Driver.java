package cqual.exec;

import cqual.hir.PrintTools;
import cqual.hir.Program;
import cqual.hir.Tools;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line handling and pass sequencing shared by the tools. Tools extend this class by registering their options and overriding
 * runPasses.  The derived class should pass its command line to the run
 * method.  Derived classes have access to a protected
 * {@link Program Program} object.
 */
public class Driver
{
  /** Registered options and their current values. */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  /** The parsed input; set before runPasses is called. */
  protected Program program;

  /** The filenames supplied on the command line. */
  protected List<String> filenames;

  /** Prefix of fatal diagnostics. */
  protected String tool_name = "cqual";

  /** Name of the file used by -dump-options and -load-options. */
  protected String options_file_name = "options.cqual";

  /** Creates a driver with the common options registered. */
  protected Driver()
  {
    registerOptions();
  }

  /**
   * Registers the options every tool accepts with their default values.
   * Registration resets values left over from an earlier driver.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "dump-options",
                "Create the options file with default options in the working directory");
    options.add(options.UTILITY, "load-options",
                "Load options from the options file in the working directory or else the home directory");
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "version",
                "Print the version information");
  }

  /**
   * Looks up an option given as <b>-name=value</b> on the command line or
   * in the options file.
   *
   * @param key the option name.
   * @return the option value, or null when the option is unset.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Overrides the value of an option.
   *
   * @param key the option name.
   * @param value the new value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /** Parses one line of an options file. */
  protected void parseOption(String opt)
  {
    opt = opt.trim();
    // empty line
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');
    String option_name = (eq == -1) ? opt : opt.substring(0, eq);
    if (!options.contains(option_name)) {
      PrintTools.printlnWarning("ignoring unrecognized option " + option_name);
      return;
    }
    setOptionValue(option_name, (eq == -1) ? "1" : opt.substring(eq + 1));
  }

  /**
   * Parses the command line. Options come first, in the form
   * <b>-name=value</b> or <b>-name</b>, and the file names follow.
   *
   * @param args the arguments given to main.
   */
  protected void parseCommandLine(String[] args)
  {
    // nothing to do without input files
    if (args.length == 0)
    {
      printUsage();
      Tools.exit(1);
    }

    int i;
    for (i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
        break;

      int eq = opt.indexOf('=');
      String option_name = (eq == -1) ? opt.substring(1) : opt.substring(1, eq);
      if (options.contains(option_name))
        // a bare flag means "1"
        setOptionValue(option_name, (eq == -1) ? "1" : opt.substring(eq + 1));
      else
        PrintTools.printlnWarning("ignoring unrecognized option " + option_name);

      if (getOptionValue("help") != null)
      {
        printUsage();
        Tools.exit(0);
      }

      if (getOptionValue("version") != null)
      {
        printVersion();
        Tools.exit(0);
      }

      if (getOptionValue("dump-options") != null)
      {
        setOptionValue("dump-options", null);
        dumpOptionsFile();
        Tools.exit(0);
      }

      // options after -load-options override the file
      if (getOptionValue("load-options") != null)
      {
        setOptionValue("load-options", null);
        loadOptionsFile();
      }
    }

    filenames = new ArrayList<String>(args.length - i);
    for (; i < args.length; ++i)
      filenames.add(args[i]);
    if (filenames.isEmpty())
      fail("no input files");
  }

  /**
   * Checks option values after the command line is parsed. The default
   * accepts everything.
   */
  protected void checkOptions()
  {
  }

  /** Parses every input file into one {@link Program}. */
  protected void parseFiles()
  {
    program = new Program();
    Parser parser = new Parser();
    for (String file : filenames) {
      try {
        program.addTranslationUnit(parser.parse(program, file));
      } catch (IOException e) {
        fail("cannot read " + file + ": " + e.getMessage());
      } catch (ParseException e) {
        fail(e.getMessage());
      }
    }
  }

  /**
   * Prints a one-line diagnostic and exits with status 1.
   *
   * @param message the diagnostic.
   */
  protected void fail(String message)
  {
    System.err.println(tool_name + ": " + message);
    Tools.exit(1);
  }

  /**
   * Prints the list of options that the tool accepts.
   */
  public void printUsage()
  {
    String usage = "\n" + getClass().getName() + " [option]... [file]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Dumps default options to the options file in the working directory;
   * an existing file is not overwritten.
   */
  public void dumpOptionsFile()
  {
    File optionsFile = new File(options_file_name);
    try {
      if (optionsFile.createNewFile()) {
        PrintStream ps = new PrintStream(new FileOutputStream(optionsFile));
        try {
          ps.println(options.dumpOptions().trim());
        } finally {
          ps.close();
        }
      } else {
        PrintTools.printlnWarning(options_file_name + " exists; not overwritten");
      }
    } catch (IOException e) {
      fail("failed to dump " + options_file_name + ": " + e.getMessage());
    }
  }

  /**
   * Loads the options file; the search order is the working directory and
   * then the home directory.
   */
  public void loadOptionsFile()
  {
    File optionsFile = new File(options_file_name);
    if (!optionsFile.exists()) {
      String homePath = System.getProperty("user.home");
      optionsFile = new File(homePath, options_file_name);
    }
    if (!optionsFile.exists()) {
      System.err.println("Use option -dump-options to create " +
          options_file_name + " with default values");
      fail("failed to load " + options_file_name);
      return;
    }
    try {
      BufferedReader br = new BufferedReader(new FileReader(optionsFile));
      try {
        String line;
        while ((line = br.readLine()) != null) {
          // Remove comments
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      fail("error while loading " + options_file_name + ": " + e.getMessage());
    }
  }

  /**
   * Prints the tool version.
   */
  public void printVersion()
  {
    System.err.println(tool_name);
  }

  /**
   * Parses the options and inputs, then runs the passes.
   *
   * @param args the arguments given to main.
   */
  public void run(String[] args)
  {
    parseCommandLine(args);

    checkOptions();

    parseFiles();

    runPasses();
  }

  /**
   * Runs analysis and transformation passes on the program. The default
   * runs none.
   */
  public void runPasses()
  {
  }
}
