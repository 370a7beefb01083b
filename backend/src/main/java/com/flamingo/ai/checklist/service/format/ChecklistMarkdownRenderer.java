package com.flamingo.ai.checklist.service.format;

import com.flamingo.ai.checklist.service.format.model.ChecklistAppendix;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.format.model.ChecklistRow;
import com.flamingo.ai.checklist.service.format.model.ChecklistSection;
import com.flamingo.ai.checklist.service.format.model.ChecklistSpecification;
import com.flamingo.ai.checklist.service.format.model.ExecutionConfirmation;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders a {@link ChecklistDocument} as Markdown in the standard checklist layout. */
@Component
public class ChecklistMarkdownRenderer {

  public String render(ChecklistDocument document) {
    StringBuilder md = new StringBuilder();
    ChecklistSpecification spec = document.specification();

    md.append("# ").append(escape(spec.checklistName())).append("\n\n");
    md.append("## Checklist Specifications\n\n");
    md.append("| Field | Value |\n|---|---|\n");
    specRow(md, "Checklist Name", spec.checklistName());
    specRow(md, "Scope", spec.scope());
    specRow(md, "Relevant Department / Jurisdiction", spec.jurisdiction());
    specRow(md, "Crisis Area", spec.crisisArea());
    specRow(md, "Checklist Type", spec.checklistType());
    specRow(md, "Reference Protocols", spec.referenceProtocols());
    specRow(md, "Operational Setting", spec.operationalSetting());
    specRow(md, "Process Owner", spec.processOwner());
    specRow(md, "Responsible Parties", spec.responsibleParties());
    specRow(md, "Activation Trigger", spec.activationTrigger());
    specRow(md, "Objective", spec.objective());
    specRow(md, "Number of Actions", String.valueOf(spec.numberOfActions()));
    specRow(md, "Document Code", ChecklistSpecification.DO_NOT_COMPLETE);
    specRow(md, "Last Updated", ChecklistSpecification.DO_NOT_COMPLETE);
    md.append('\n');

    md.append("## Checklist Content\n\n");
    if (document.sections().isEmpty()) {
      md.append("_No actions selected._\n\n");
    }
    for (ChecklistSection section : document.sections()) {
      md.append("### ").append(section.heading()).append("\n\n");
      md.append("| No. | Action | Responsible | Timing | Status | Remarks |\n");
      md.append("|---|---|---|---|---|---|\n");
      for (ChecklistRow row : section.rows()) {
        md.append("| ")
            .append(row.number())
            .append(" | ")
            .append(escape(row.action()))
            .append(" | ")
            .append(escape(row.responsibleRole()))
            .append(" | ")
            .append(escape(row.timing()))
            .append(" | ")
            .append(row.status().getLabel())
            .append(" | ")
            .append(escape(row.remarks()))
            .append(" |\n");
      }
      md.append('\n');
    }

    ExecutionConfirmation confirmation = document.confirmation();
    md.append("## Execution Confirmation\n\n");
    md.append("Confirmed by: **").append(escape(confirmation.roleLabel())).append("**\n\n");
    md.append("| Field | Value |\n|---|---|\n");
    for (String field : confirmation.fields()) {
      md.append("| ").append(escape(field)).append(" | |\n");
    }
    md.append('\n');

    for (ChecklistAppendix appendix : document.appendices()) {
      md.append("## Appendix ")
          .append(appendix.letter())
          .append(": ")
          .append(escape(appendix.title()))
          .append("\n\n");
      md.append("Source: ").append(escape(appendix.reference())).append("\n\n");
      if (!appendix.header().isEmpty()) {
        tableRow(md, appendix.header());
        md.append("|").append("---|".repeat(appendix.header().size())).append('\n');
      }
      for (List<String> row : appendix.rows()) {
        tableRow(md, row);
      }
      if (!appendix.relatedActions().isEmpty()) {
        md.append("\nRelated actions: ");
        md.append(
            String.join(
                ", ", appendix.relatedActions().stream().map(String::valueOf).toList()));
        md.append('\n');
      }
      md.append('\n');
    }
    return md.toString();
  }

  private static void specRow(StringBuilder md, String field, String value) {
    md.append("| ").append(field).append(" | ").append(escape(value)).append(" |\n");
  }

  private static void tableRow(StringBuilder md, List<String> cells) {
    md.append('|');
    for (String cell : cells) {
      md.append(' ').append(escape(cell)).append(" |");
    }
    md.append('\n');
  }

  private static String escape(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("|", "\\|").replace("\r", "").replace("\n", "<br>");
  }
}
