package cqual.exec;

import java.util.*;
import cqual.hir.PrintTools;

/**
* Registry of the options a driver accepts. Each option has a type that
* groups it in the usage text, an optional default value, an optional
* argument placeholder and a usage description.
*/
public class CommandLineOptionSet
{
  public final int ANALYSIS = 1;
  public final int TRANSFORM = 2;
  public final int UTILITY = 3;

  private class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(String name, String usage)
  {
    add(UTILITY, name, null, null, usage);
  }

  public void add(int type, String name, String usage)
  {
    add(type, name, null, null, usage);
  }

  public void add(int type, String name, String arg, String usage)
  {
    add(type, name, null, arg, usage);
  }

  /**
  * Registers an option, replacing any earlier registration and its value.
  *
  * @param type one of ANALYSIS, TRANSFORM or UTILITY.
  * @param name the option name without the leading dash.
  * @param value the default value, or null.
  * @param arg the argument placeholder shown in the usage, or null.
  * @param usage the description.
  */
  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
  * Returns the contents of an options file holding every option with its
  * default value; usage lines are commented out.
  */
  public String dumpOptions()
  {
    StringBuilder sb = new StringBuilder(2000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      sb.append("#Option: ").append(entry.getKey()).append("\n#");
      sb.append(entry.getKey());
      if (record.arg != null)
        sb.append("=").append(record.arg);
      sb.append("\n#").append(record.usage.replaceAll("\n", "\n#"));
      sb.append("\n");
      // a flag without a default stays commented out so loading keeps it off
      if (record.value == null)
        sb.append("#");
      sb.append(entry.getKey());
      if (record.value != null)
        sb.append("=").append(record.value);
      sb.append("\n");
    }
    return sb.toString();
  }

  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(4000);
    String sep = PrintTools.line_sep;
    String[] titles = { "UTILITY", "ANALYSIS", "TRANSFORM" };
    int[] types = { UTILITY, ANALYSIS, TRANSFORM };
    for (int t = 0; t < types.length; t++) {
      for (int i = 0; i < 80; i++) sb.append("-");
      sb.append(sep).append(titles[t]).append(sep);
      for (int i = 0; i < 80; i++) sb.append("-");
      sb.append(sep).append(getUsage(types[t]));
    }
    return sb.toString();
  }

  public String getUsage(int type)
  {
    StringBuilder usage = new StringBuilder(1000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type == type) {
        usage.append("-").append(entry.getKey());
        if (record.arg != null)
          usage.append("=").append(record.arg);
        usage.append("\n    ").append(record.usage).append("\n\n");
      }
    }
    return usage.toString();
  }

  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    else
      return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }

  public int getType(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return 0;
    else
      return record.option_type;
  }
}
