package ca.gc.cra.salvage.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromPairs() {
    CliInput input = CliInput.parse(new String[] {"in=/evidence", "--DRY-RUN", "-v", "out=/case", "--allow-overwrite"});

    assertArrayEquals(new String[] {"in=/evidence", "out=/case"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--allow-overwrite"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void dashedPairIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"--config=/etc/salvage.yaml"});

    assertArrayEquals(new String[] {"--config=/etc/salvage.yaml"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag(" "));
  }
}
