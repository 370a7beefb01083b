package com.flamingo.ai.checklist.exception;

/** Exception thrown when a pipeline setting is out of range. */
public class PipelineConfigurationException extends RuntimeException {

  private final String key;

  public PipelineConfigurationException(String key, String message) {
    super(key + ": " + message);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
