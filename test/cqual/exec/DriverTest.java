package cqual.exec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DriverTest
{
  @TempDir
  Path dir;

  private Driver driverWritingTo(Path file)
  {
    Driver driver = new Driver();
    driver.options_file_name = file.toString();
    return driver;
  }

  @Test
  public void dumpWritesCompleteOptionsFile() throws Exception
  {
    Path file = dir.resolve("options.cqual");
    driverWritingTo(file).dumpOptionsFile();
    String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    assertTrue(text.contains("verbosity=0"), text);
    assertTrue(text.endsWith("\n"), text);
  }

  @Test
  public void dumpKeepsExistingFile() throws Exception
  {
    Path file = dir.resolve("options.cqual");
    Files.write(file, "mine\n".getBytes(StandardCharsets.UTF_8));
    driverWritingTo(file).dumpOptionsFile();
    assertEquals("mine\n",
        new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
  }
}
