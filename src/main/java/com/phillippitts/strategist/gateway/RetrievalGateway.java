package com.phillippitts.strategist.gateway;

import com.phillippitts.strategist.domain.Document;
import com.phillippitts.strategist.domain.SourceRef;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retrieval + generation over internal documents. Both steps together form the primary call
 * of an analysis.
 */
public interface RetrievalGateway {

    /**
     * @param query       search query, possibly enriched with extracted keywords
     * @param primaryHint the user's original wording, used to widen matching
     * @return matching documents in retrieval order, possibly empty
     */
    List<Document> search(String query, String primaryHint);

    /**
     * @return answer text grounded in {@code documents}
     */
    String generate(String originalQuery, List<Document> documents);

    /**
     * Distinct sources of {@code documents} for display, first occurrence wins.
     */
    default List<SourceRef> topSources(List<Document> documents) {
        Map<String, SourceRef> bySource = new LinkedHashMap<>();
        for (Document d : documents) {
            bySource.putIfAbsent(d.source(), SourceRef.internal(d.source(), d.date()));
        }
        return List.copyOf(bySource.values());
    }
}
