package com.codeheadsystems.interlock.server.exceptions;

/**
 * The login client asked for input that is neither a recognized verification challenge nor
 * covered by a queued answer.
 */
public class UnexpectedPromptException extends LoginFaultException {

  private final String prompt;

  /**
   * Instantiates a new Unexpected prompt exception.
   *
   * @param prompt the prompt text the login client showed
   */
  public UnexpectedPromptException(final String prompt) {
    super("Unexpected input prompt: " + prompt, null);
    this.prompt = prompt;
  }

  /**
   * Prompt string.
   *
   * @return the prompt text the login client showed
   */
  public String prompt() {
    return prompt;
  }
}
