package com.codeheadsystems.interlock.server.login;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a prompt from the login client is a verification challenge.
 * <p>
 * The prompt is matched together with the last non-empty line the client printed, because the
 * "code sent" notice and the question usually arrive separately. Rules, first match wins:
 * <ol>
 *   <li>"confirmation code" and "sent" → {@link ChallengeType#CONFIRMATION_CODE}</li>
 *   <li>"email address" and "verify", or "verify your identity" →
 *       {@link ChallengeType#EMAIL_VERIFICATION}</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class PromptClassifier {

  // Masked addresses such as te*****@g****.com
  private static final Pattern MASKED_EMAIL =
      Pattern.compile("[a-zA-Z0-9*]+@[a-zA-Z0-9*]+\\.[a-zA-Z0-9*]+");

  /**
   * Classifies a prompt.
   *
   * @param lastLine most recent non-empty output line, may be null or empty
   * @param prompt   the prompt text, may be null
   * @return the challenge, or empty if the prompt is not one
   */
  public Optional<VerificationChallenge> classify(String lastLine, String prompt) {
    String line = lastLine == null ? "" : lastLine.strip();
    String question = prompt == null ? "" : prompt;
    String combined = (line + " " + question).toLowerCase(Locale.ROOT);

    ChallengeType type;
    if (combined.contains("confirmation code") && combined.contains("sent")) {
      type = ChallengeType.CONFIRMATION_CODE;
    } else if ((combined.contains("email address") && combined.contains("verify"))
        || combined.contains("verify your identity")) {
      type = ChallengeType.EMAIL_VERIFICATION;
    } else {
      return Optional.empty();
    }

    String message = line.isEmpty() ? question : line;
    return Optional.of(new VerificationChallenge(type, message, extractHint(combined).orElse(null)));
  }

  /**
   * Finds the first masked email address in the text.
   *
   * @param text text to search
   * @return the address, or empty
   */
  public Optional<String> extractHint(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = MASKED_EMAIL.matcher(text);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }

  /**
   * Returns the last line of the output that has any non-whitespace content.
   *
   * @param output everything the login client printed so far
   * @return the line, stripped, or an empty string
   */
  public static String lastNonEmptyLine(CharSequence output) {
    String[] lines = output.toString().split("\\R");
    for (int i = lines.length - 1; i >= 0; i--) {
      String line = lines[i].strip();
      if (!line.isEmpty()) {
        return line;
      }
    }
    return "";
  }
}
