package cqual.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineOptionSetTest
{
  @Test
  public void registersValuesAndTypes()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "mode", "fast", "M", "Analysis mode");
    options.add(options.TRANSFORM, "flag", "Some flag");
    assertTrue(options.contains("mode"));
    assertEquals("fast", options.getValue("mode"));
    assertNull(options.getValue("flag"));
    assertEquals(options.ANALYSIS, options.getType("mode"));
    assertEquals(0, options.getType("missing"));

    options.setValue("flag", "1");
    assertEquals("1", options.getValue("flag"));
    options.setValue("missing", "1");
    assertFalse(options.contains("missing"));
  }

  @Test
  public void reregistrationResetsValue()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.UTILITY, "level", "0", "N", "Level");
    options.setValue("level", "3");
    options.add(options.UTILITY, "level", "0", "N", "Level");
    assertEquals("0", options.getValue("level"));
  }

  @Test
  public void usageGroupsOptionsByType()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "mode", "fast", "M", "Analysis mode");
    options.add(options.UTILITY, "help", "Print help");
    assertTrue(options.getUsage(options.ANALYSIS).contains("-mode=M"));
    assertFalse(options.getUsage(options.ANALYSIS).contains("-help"));
    String usage = options.getUsage();
    assertTrue(usage.indexOf("UTILITY") < usage.indexOf("ANALYSIS"));
  }

  @Test
  public void dumpCommentsOutFlagsWithoutDefault()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "mode", "fast", "M", "Analysis mode");
    options.add(options.UTILITY, "verbose", "Talk more");
    String dump = options.dumpOptions();
    assertTrue(dump.contains("\nmode=fast\n"), dump);
    assertTrue(dump.contains("\n#verbose\n"), dump);
    assertFalse(dump.contains("\nverbose\n"), dump);
  }
}
