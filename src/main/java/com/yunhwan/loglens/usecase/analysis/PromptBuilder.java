package com.yunhwan.loglens.usecase.analysis;

import com.yunhwan.loglens.domain.incident.IncidentReport;

public class PromptBuilder {

    public static final String SYSTEM_PROMPT = """
            You are LogLens, a log analysis assistant. Your job is to analyze application
            logs and help identify why a user experienced a problem.

            Given:
            1. Workflow documentation describing expected system behavior
            2. Known error patterns and their resolutions
            3. Error tracking events from the relevant time period
            4. A problem description from customer support

            You must return:
            1. Top 3 most likely causes, ranked by probability
            2. Confidence level for each (high/medium/low)
            3. A suggested response that CS can send to the customer
            4. Brief summary of relevant log findings

            Be specific and actionable. Reference actual error messages from the logs.
            If logs don't clearly indicate the cause, say so and suggest next steps.

            IMPORTANT: You must respond with valid JSON only, no markdown formatting or code blocks.""";

    private static final String RESPONSE_SKELETON = """
            {
              "causes": [{"rank": 1, "cause": "", "explanation": "", "confidence": ""}],
              "suggested_response": "",
              "logs_summary": ""
            }""";

    public String systemInstruction() {
        return SYSTEM_PROMPT;
    }

    public String userContent(IncidentReport report, String evidenceText, KnowledgeDocuments docs) {
        return "## Workflow Documentation\n"
                + docs.workflow() + "\n\n"
                + "## Known Error Patterns\n"
                + docs.knownErrors() + "\n\n"
                + "## Error Events\n"
                + evidenceText + "\n\n"
                + "## Problem Report\n"
                + "- Description: " + report.description() + "\n"
                + "- Timestamp: " + report.occurredAt() + "\n"
                + "- Customer ID: " + report.subjectId() + "\n\n"
                + "Analyze and respond in JSON format (no markdown, just raw JSON):\n"
                + RESPONSE_SKELETON;
    }
}
