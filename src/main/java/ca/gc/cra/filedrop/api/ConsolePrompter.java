package ca.gc.cra.filedrop.api;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * {@link Prompter} backed by the system console, falling back to standard input when no console is attached.
 * Without a console, secrets are echoed.
 */
final class ConsolePrompter implements Prompter {
  private final Console console;
  private final BufferedReader stdin;

  ConsolePrompter() {
    this.console = System.console();
    this.stdin = console == null
        ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
        : null;
  }

  @Override
  public Optional<String> readLine(String prompt) {
    if (console != null) {
      return Optional.ofNullable(console.readLine("%s", prompt));
    }
    CliPrinter.print(prompt);
    try {
      return Optional.ofNullable(stdin.readLine());
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to read from standard input", ex);
    }
  }

  @Override
  public Optional<String> readSecret(String prompt) {
    if (console != null) {
      char[] secret = console.readPassword("%s", prompt);
      return secret == null ? Optional.empty() : Optional.of(new String(secret));
    }
    return readLine(prompt);
  }
}
