package ca.gc.cra.diagsink.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: an optional leading command ({@code record}, {@code upload}), flags such as
 * {@code --dry-run}, and {@code key=value} arguments.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> arguments;
  private final Set<String> flags;

  private CliInput(List<String> arguments, Set<String> flags) {
    this.arguments = arguments;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. Help and verbose aliases are normalised to {@code --help} and
   * {@code --verbose}; other flags are kept lower-cased.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of());
    }
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        arguments.add(arg);
      }
    }
    return new CliInput(List.copyOf(arguments), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments, in order.
   *
   * @return positional and {@code key=value} arguments
   */
  public String[] keyValueArgs() {
    return arguments.toArray(String[]::new);
  }

  /**
   * First argument when it is a bare word rather than a {@code key=value} pair.
   *
   * @return lower-cased command name, or empty
   */
  public Optional<String> command() {
    if (arguments.isEmpty() || arguments.get(0).contains("=")) {
      return Optional.empty();
    }
    return Optional.of(arguments.get(0).toLowerCase(Locale.ROOT));
  }

  /**
   * Arguments for the command's own CLI: everything after the command, followed by every flag.
   *
   * @return arguments to hand to the subcommand
   */
  public String[] commandArgs() {
    List<String> rest = new ArrayList<>(arguments.subList(command().isPresent() ? 1 : 0, arguments.size()));
    rest.addAll(flags);
    return rest.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "CliInput{arguments=" + arguments.size() + ", flags=" + flags + '}';
  }
}
