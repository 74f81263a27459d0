package ca.gc.cra.filedrop.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line arguments split into FILEDROP switches and {@code key=value} settings.
 *
 * <p>Switches that stand for a setting ({@code --create-roots}, {@code --dry-run}) are surfaced through
 * {@link #switchSettings()} so they overlay YAML and defaults like any other command-line value.</p>
 */
public final class CliInput {

  /** Switches understood by at least one FILEDROP command. */
  public enum Switch {
    HELP(null, "--help", "-h", "help"),
    VERBOSE(null, "--verbose", "-v", "--debug"),
    CREATE_ROOTS("createRoots", "--create-roots"),
    DRY_RUN("dryRun", "--dry-run");

    private final String setting;
    private final List<String> spellings;

    Switch(String setting, String... spellings) {
      this.setting = setting;
      this.spellings = List.of(spellings);
    }

    /**
     * Canonical spelling shown in messages.
     *
     * @return first accepted spelling, for example {@code --dry-run}
     */
    public String spelling() {
      return spellings.get(0);
    }

    static Optional<Switch> lookup(String lowerCaseToken) {
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(lowerCaseToken)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  private final String[] keyValueArgs;
  private final Set<Switch> switches;
  private final List<String> unrecognized;

  private CliInput(String[] keyValueArgs, Set<Switch> switches, List<String> unrecognized) {
    this.keyValueArgs = keyValueArgs;
    this.switches = switches;
    this.unrecognized = unrecognized;
  }

  /**
   * Splits raw arguments. Anything that is not a dash-prefixed word without {@code =} is kept as a
   * {@code key=value} candidate, including a leading subcommand.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    List<String> unrecognized = new ArrayList<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      Optional<Switch> known = Switch.lookup(arg.toLowerCase(Locale.ROOT));
      if (known.isPresent()) {
        switches.add(known.get());
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        unrecognized.add(arg);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), switches, List.copyOf(unrecognized));
  }

  /**
   * Returns a defensive copy of the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return switches.contains(Switch.HELP);
  }

  public boolean verbose() {
    return switches.contains(Switch.VERBOSE);
  }

  public boolean createRoots() {
    return switches.contains(Switch.CREATE_ROOTS);
  }

  public boolean dryRun() {
    return switches.contains(Switch.DRY_RUN);
  }

  /**
   * Settings implied by the switches present, each mapped to {@code "true"}.
   *
   * @return ordered map such as {@code createRoots=true}
   */
  public Map<String, String> switchSettings() {
    Map<String, String> settings = new LinkedHashMap<>();
    for (Switch present : switches) {
      if (present.setting != null) {
        settings.put(present.setting, "true");
      }
    }
    return settings;
  }

  /**
   * Lists switches a command cannot honour: unknown dash words plus known switches outside {@code accepted}.
   * Help and verbose are accepted everywhere.
   *
   * @param accepted command-specific switches
   * @return offending arguments as typed, or canonical spellings for known switches
   */
  public List<String> unsupported(Switch... accepted) {
    Set<Switch> allowed = EnumSet.of(Switch.HELP, Switch.VERBOSE);
    allowed.addAll(Arrays.asList(accepted));
    List<String> offending = new ArrayList<>(unrecognized);
    for (Switch present : switches) {
      if (!allowed.contains(present)) {
        offending.add(present.spelling());
      }
    }
    return offending;
  }
}
