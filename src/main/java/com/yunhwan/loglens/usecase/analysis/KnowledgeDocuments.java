package com.yunhwan.loglens.usecase.analysis;

/**
 * 프롬프트에 그대로 들어가는 두 문서.
 */
public record KnowledgeDocuments(String workflow, String knownErrors) {

    public static final String NO_WORKFLOW = "No workflow documentation available.";
    public static final String NO_KNOWN_ERRORS = "No known error patterns available.";

    public KnowledgeDocuments {
        if (workflow == null || workflow.isBlank()) workflow = NO_WORKFLOW;
        if (knownErrors == null || knownErrors.isBlank()) knownErrors = NO_KNOWN_ERRORS;
    }

    public static KnowledgeDocuments empty() {
        return new KnowledgeDocuments(null, null);
    }
}
