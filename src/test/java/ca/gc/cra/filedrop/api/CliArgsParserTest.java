package ca.gc.cra.filedrop.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"port=9090", "root=/srv/drop", "port=9191"});
    assertEquals("9191", map.get("port"));
    assertEquals("/srv/drop", map.get("root"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod,site=east"});
    assertEquals("env=prod,site=east", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsInvalidArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9port=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"user=a\u0007b"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
