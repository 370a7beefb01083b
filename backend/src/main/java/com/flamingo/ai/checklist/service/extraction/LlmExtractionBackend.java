package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.agent.ActionExtractionAgent;
import com.flamingo.ai.checklist.agent.dto.ExtractionResponse;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link ExtractionBackend} backed by the LangChain4j {@link ActionExtractionAgent}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmExtractionBackend implements ExtractionBackend {

  private static final String NONE = "(none)";

  private final ActionExtractionAgent actionExtractionAgent;

  @Override
  public ExtractionResponse extract(ExtractionRequest request) {
    log.debug(
        "Calling extraction agent for node {} ({} chars, {} tables, {} formulas)",
        request.nodeId(),
        request.text().length(),
        request.tables().size(),
        request.formulas().size());

    ExtractionResponse response;
    try {
      response =
          actionExtractionAgent.extract(
              request.nodeId(),
              request.title() == null ? "" : request.title(),
              request.text(),
              formatTables(request.tables()),
              formatFormulas(request.formulas()));
    } catch (RuntimeException e) {
      throw new ExtractionFailureException(
          request.nodeId(), "Extraction agent call failed: " + e.getMessage(), e);
    }

    if (response == null) {
      throw new ExtractionFailureException(request.nodeId(), "Extraction agent returned no output");
    }
    return response;
  }

  private String formatTables(List<String> tables) {
    if (tables.isEmpty()) {
      return NONE;
    }
    return String.join("\n\n", tables);
  }

  private String formatFormulas(List<String> formulas) {
    if (formulas.isEmpty()) {
      return NONE;
    }
    return IntStream.range(0, formulas.size())
        .mapToObj(i -> ExtractionRequest.formulaLabel(i) + ": " + formulas.get(i))
        .collect(Collectors.joining("\n"));
  }
}
