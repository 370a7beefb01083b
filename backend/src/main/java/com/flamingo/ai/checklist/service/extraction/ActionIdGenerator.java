package com.flamingo.ai.checklist.service.extraction;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds deterministic, content-derived identifiers for actions and tables. Identical input always
 * yields identical ids, which is what makes reruns comparable.
 */
@Component
public class ActionIdGenerator {

  private static final int ID_HEX_LENGTH = 16;

  public String actionId(String nodeId, int actionIndex, String who, String what, String when) {
    String raw =
        nodeId + "|" + actionIndex + "|" + nullToEmpty(who) + "|" + nullToEmpty(what) + "|"
            + nullToEmpty(when);
    return "act-" + sha256(raw).substring(0, ID_HEX_LENGTH);
  }

  public String tableId(String nodeId, int tableIndex, String title, List<String> header) {
    String raw =
        nodeId + "|" + tableIndex + "|" + nullToEmpty(title) + "|"
            + (header == null ? "" : String.join(",", header));
    return "tbl-" + sha256(raw).substring(0, ID_HEX_LENGTH);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private String sha256(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
