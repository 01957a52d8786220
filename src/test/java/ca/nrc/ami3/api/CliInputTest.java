package ca.nrc.ami3.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"in=asn.json", "--DRY-RUN", "-v", "out=l3", " "});

    assertArrayEquals(new String[] {"in=asn.json", "out=l3"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognizesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void debugIsAVerboseAlias() {
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void nullArgumentsYieldEmptyInput() {
    CliInput input = CliInput.parse(null);
    assertArrayEquals(new String[0], input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(null));
  }
}
