package ca.gc.cra.filedrop.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesSwitchesFromSettings() {
    CliInput input =
        CliInput.parse(new String[] {"root=/srv/drop", " --DRY-RUN ", "-v", "port=9090", "--create-roots"});

    assertArrayEquals(new String[] {"root=/srv/drop", "port=9090"}, input.keyValueArgs());
    assertTrue(input.dryRun());
    assertTrue(input.createRoots());
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void settingSwitchesBecomeOverrides() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--create-roots", "--verbose"});

    assertEquals(Map.of("createRoots", "true", "dryRun", "true"), input.switchSettings());
    assertTrue(CliInput.parse(new String[] {"--help"}).switchSettings().isEmpty());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void reportsSwitchesTheCommandDoesNotAccept() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--force", "-x", "--help"});

    assertEquals(List.of("--force", "-x", "--dry-run"), input.unsupported());
    assertEquals(List.of("--force", "-x"), input.unsupported(CliInput.Switch.DRY_RUN));
  }

  @Test
  void dashedValueWithEqualsStaysASetting() {
    CliInput input = CliInput.parse(new String[] {"--port=9090"});

    assertArrayEquals(new String[] {"--port=9090"}, input.keyValueArgs());
    assertTrue(input.unsupported().isEmpty());
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    CliInput input = CliInput.parse(new String[] {null, " ", ""});

    assertEquals(0, input.keyValueArgs().length);
    assertTrue(CliInput.parse(null).unsupported().isEmpty());
  }
}
