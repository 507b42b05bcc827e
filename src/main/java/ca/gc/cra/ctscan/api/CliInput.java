package ca.gc.cra.ctscan.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into recognised flags and {@code key=value} tokens.
 * <p>Flags are tokens starting with {@code -} that carry no {@code =}; they are normalised to lower
 * case, with {@code -h}/{@code help} mapped to {@code --help} and {@code -v}/{@code --debug} to
 * {@code --verbose}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments; blank and {@code null} tokens are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Returns the non-flag tokens in their original order.
   *
   * @return copy of the {@code key=value} tokens (and any positional command)
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Indicates whether help was requested.
   *
   * @return {@code true} for {@code --help}, {@code -h} or {@code help}
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} for {@code --verbose}, {@code -v} or {@code --debug}
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag such as {@code --dry-run}, case-insensitively.
   *
   * @param flag flag to look up
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "CliInput{args=" + Arrays.toString(keyValueArgs()) + ", flags=" + flags + '}';
  }
}
