package com.flamingo.ai.checklist.agent;

import com.flamingo.ai.checklist.agent.dto.ExtractionResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for extracting atomic who/what/when actions, formulas and tables from a single document
 * subject. Uses LangChain4j AI Services for structured LLM interaction.
 */
public interface ActionExtractionAgent {

  @SystemMessage(
      """
        You extract atomic, executable actions from one section of an emergency preparedness
        document.

        For each action return:
        - who: the responsible organizational role or unit, never a named person
        - what: exactly what to do, with the values, tools and forms the text names
        - when: the deadline, schedule or trigger as written in the text
        - context: a short quote from the section supporting the action
        - formulaRef: the label (F1, F2, ...) of the formula the action uses, or null
        - operationalLevel: "national", "regional" or "local" if the text says so, else null
        - spanStart, spanEnd: character offsets of the supporting text, or null

        Rules:
        - Break compound actions into separate atomic actions
        - Leave who, what or when as an empty string when the text does not state it
        - Do not invent roles, deadlines or values
        - Report every formula, reusing the given label when it is one of the listed formulas
        - Give each formula a worked example and sample result when the text allows it
        - Report every table or checklist with its headers and rows
        - Return ONLY valid JSON
        """)
  @UserMessage(
      """
        Section: {{title}} [{{nodeId}}]

        Text:
        {{text}}

        Tables:
        {{tables}}

        Formulas:
        {{formulas}}

        Return JSON:
        {"actions": [{"who": "", "what": "", "when": "", "context": "", "formulaRef": null,
          "operationalLevel": null, "spanStart": null, "spanEnd": null}],
         "formulas": [{"ref": "F1", "formula": "", "computationExample": "",
          "sampleResult": "", "formulaContext": ""}],
         "tables": [{"title": "", "headers": [], "rows": [[]]}]}
        """)
  ExtractionResponse extract(
      @V("nodeId") String nodeId,
      @V("title") String title,
      @V("text") String text,
      @V("tables") String tables,
      @V("formulas") String formulas);
}
