package ca.gc.cra.filedrop.api;

import java.util.Optional;

/**
 * Interactive source for values the upload command was not given on the command line.
 */
interface Prompter {
  /**
   * Shows {@code prompt} and reads one line.
   *
   * @param prompt text shown before reading
   * @return line without terminator, or empty at end of input
   */
  Optional<String> readLine(String prompt);

  /**
   * Shows {@code prompt} and reads one line without echo where the terminal allows it.
   *
   * @param prompt text shown before reading
   * @return secret, or empty at end of input
   */
  Optional<String> readSecret(String prompt);
}
