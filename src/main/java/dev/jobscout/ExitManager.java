package dev.jobscout;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Manages application exit after a one-shot run.
 * Separated to allow mocking in tests and avoid killing the test runner.
 */
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ApplicationContext applicationContext;

  public void exit(int status) {
    if (!isTest()) {
      System.exit(SpringApplication.exit(applicationContext, () -> status));
    }
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
