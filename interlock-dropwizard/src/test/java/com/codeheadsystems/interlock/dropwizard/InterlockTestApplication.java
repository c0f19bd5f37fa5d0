package com.codeheadsystems.interlock.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class InterlockTestApplication extends Application<InterlockConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new InterlockTestApplication().run(args);
  }

  @Override
  public String getName() {
    return "interlock-test";
  }

  @Override
  public void initialize(Bootstrap<InterlockConfiguration> bootstrap) {
    bootstrap.addBundle(new InterlockBundle<>(new ScriptedLoginClient()));
  }

  @Override
  public void run(InterlockConfiguration configuration, Environment environment) {
    // everything is registered by the bundle
  }
}
