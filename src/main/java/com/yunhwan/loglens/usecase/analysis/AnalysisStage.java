package com.yunhwan.loglens.usecase.analysis;

/**
 * INVOKE → PARSE → VALIDATE → REPAIR → FINALIZE
 */
public enum AnalysisStage {
    INVOKE, PARSE, VALIDATE, REPAIR, FINALIZE
}
