package ca.gc.cra.chipper.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into recognised flags and {@code key=value} options.
 * <p>Unrecognised flags are rejected so typos do not silently change behaviour.</p>
 */
final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v");
  private static final Set<String> QUIET_FLAGS = Set.of("--quiet", "-q");

  private final List<String> options;
  private final List<String> unknownFlags;
  private final boolean help;
  private final boolean verbose;
  private final boolean quiet;

  private CliInput(List<String> options, List<String> unknownFlags, boolean help, boolean verbose, boolean quiet) {
    this.options = options;
    this.unknownFlags = unknownFlags;
    this.help = help;
    this.verbose = verbose;
    this.quiet = quiet;
  }

  /**
   * Partitions raw arguments. Blank and {@code null} entries are ignored.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed arguments
   */
  static CliInput parse(String[] args) {
    List<String> options = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean quiet = false;
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (QUIET_FLAGS.contains(lower)) {
          quiet = true;
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(arg);
        } else {
          // keep the untrimmed value so message=" padded " survives
          options.add(raw.stripLeading());
        }
      }
    }
    return new CliInput(List.copyOf(options), List.copyOf(unknown), help, verbose, quiet);
  }

  /**
   * Returns the non-flag arguments in order, the subcommand name included when present.
   *
   * @return immutable list of arguments
   */
  List<String> options() {
    return options;
  }

  List<String> unknownFlags() {
    return unknownFlags;
  }

  boolean help() {
    return help;
  }

  boolean verbose() {
    return verbose;
  }

  boolean quiet() {
    return quiet;
  }
}
