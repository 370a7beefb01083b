package com.flamingo.ai.checklist.exception;

/** Exception thrown when the ingested document tree is not a tree. */
public class MalformedTreeException extends RuntimeException {

  private final String nodeId;

  public MalformedTreeException(String nodeId, String message) {
    super(message);
    this.nodeId = nodeId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
