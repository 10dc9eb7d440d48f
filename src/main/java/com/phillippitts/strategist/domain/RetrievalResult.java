package com.phillippitts.strategist.domain;

import java.util.List;
import java.util.Objects;

/**
 * Output of the primary retrieval + generation call.
 *
 * @param answerText generated answer grounded in {@code documents}
 * @param documents  documents the answer was generated from, in retrieval order
 * @param topSources distinct sources of those documents, for display
 */
public record RetrievalResult(String answerText, List<Document> documents, List<SourceRef> topSources)
        implements AgentResult {

    public RetrievalResult {
        Objects.requireNonNull(answerText, "answerText");
        documents = documents == null ? List.of() : List.copyOf(documents);
        topSources = topSources == null ? List.of() : List.copyOf(topSources);
    }

    @Override
    public AgentKind kind() {
        return AgentKind.RETRIEVAL;
    }
}
