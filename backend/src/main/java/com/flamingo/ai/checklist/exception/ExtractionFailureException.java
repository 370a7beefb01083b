package com.flamingo.ai.checklist.exception;

/** Exception thrown when the extraction backend fails for a single node. */
public class ExtractionFailureException extends RuntimeException {

  private final String nodeId;

  public ExtractionFailureException(String nodeId, String message) {
    super(message);
    this.nodeId = nodeId;
  }

  public ExtractionFailureException(String nodeId, String message, Throwable cause) {
    super(message, cause);
    this.nodeId = nodeId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
