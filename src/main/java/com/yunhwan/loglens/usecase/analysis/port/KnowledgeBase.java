package com.yunhwan.loglens.usecase.analysis.port;

import com.yunhwan.loglens.usecase.analysis.KnowledgeDocuments;

public interface KnowledgeBase {

    /**
     * 문서가 없으면 예외 대신 placeholder 를 채워서 돌려준다.
     */
    KnowledgeDocuments load();
}
