package ca.gc.cra.salvage.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into bare flags and {@code key=value} pairs.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Splits raw arguments. Tokens starting with {@code -} and carrying no {@code '='} are flags; everything else is
   * kept, in order, for {@link CliArgsParser}.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }
    List<String> remaining = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    boolean helpRequested = false;
    boolean verboseRequested = false;
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        helpRequested = true;
        seen.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verboseRequested = true;
        seen.add("--verbose");
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        seen.add(lower);
      } else {
        remaining.add(arg);
      }
    }
    return new CliInput(remaining.toArray(String[]::new), Set.copyOf(seen), helpRequested, verboseRequested);
  }

  /** Returns a copy of the non-flag arguments. */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was given.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
