package com.flamingo.ai.checklist.domain.model;

import java.util.List;

/**
 * A table extracted from a subject. Passed through deduplication and selection unchanged.
 *
 * @param id content-derived identifier
 * @param title table caption, may be empty
 * @param header header row
 * @param rows body rows in source order
 * @param reference where the table was found
 */
public record Table(
    String id, String title, List<String> header, List<List<String>> rows,
    SourceReference reference) {

  public Table {
    title = title == null ? "" : title;
    header = header == null ? List.of() : List.copyOf(header);
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
  }
}
