package com.codeheadsystems.interlock.server.login;

/**
 * The interactive surface a {@link LoginClient} talks to instead of a terminal.
 * <p>
 * Everything the client would print goes through {@link #print(String)}; every question it would
 * ask a human goes through {@link #prompt(String)}.
 */
public interface LoginConsole {

  /**
   * Records output the login client would have shown the user.
   *
   * @param text one or more lines of output
   */
  void print(String text);

  /**
   * Asks for input.
   * <p>
   * May abort the login by throwing an unchecked exception instead of returning. Login clients
   * must let such exceptions propagate out of {@link LoginClient#authenticate}.
   *
   * @param text the prompt
   * @return the answer
   */
  String prompt(String text);
}
