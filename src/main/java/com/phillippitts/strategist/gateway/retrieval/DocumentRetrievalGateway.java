package com.phillippitts.strategist.gateway.retrieval;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.Document;
import com.phillippitts.strategist.gateway.RetrievalGateway;
import com.phillippitts.strategist.gateway.chat.ChatCompletionClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Primary agent: keyword search over the {@link DocumentIndex} followed by a grounded chat answer.
 */
public class DocumentRetrievalGateway implements RetrievalGateway {

    private static final Logger LOG = LogManager.getLogger(DocumentRetrievalGateway.class);

    static final String SYSTEM_PROMPT = """
            You are an analyst of the organization's internal documents. Answer the user's question \
            using only the document fragments provided. Summarize what the organization already \
            has, what it has tried and what the numbers say. If the fragments do not cover \
            something, say so briefly. Answer in Markdown.""";

    private final DocumentIndex index;
    private final ChatCompletionClient client;
    private final int topK;

    public DocumentRetrievalGateway(DocumentIndex index, ChatCompletionClient client, int topK) {
        this.index = Objects.requireNonNull(index, "index");
        this.client = Objects.requireNonNull(client, "client");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1");
        }
        this.topK = topK;
    }

    @Override
    public List<Document> search(String query, String primaryHint) {
        Set<String> keywords = new LinkedHashSet<>(QueryTokenizer.tokenize(query));
        keywords.addAll(QueryTokenizer.tokenize(primaryHint));
        List<Document> hits = index.find(List.copyOf(keywords), topK);
        LOG.debug("Retrieval search: keywords={}, hits={}", keywords.size(), hits.size());
        return hits;
    }

    @Override
    public String generate(String originalQuery, List<Document> documents) {
        return client.complete(AgentKind.RETRIEVAL, SYSTEM_PROMPT, userPrompt(originalQuery, documents), null);
    }

    static String userPrompt(String originalQuery, List<Document> documents) {
        StringBuilder sb = new StringBuilder("Question:\n").append(originalQuery).append("\n\nFragments:\n");
        int n = 1;
        for (Document d : documents) {
            sb.append("\n[").append(n++).append("] ").append(d.source());
            if (!d.date().isEmpty()) {
                sb.append(" (").append(d.date()).append(')');
            }
            sb.append('\n').append(d.text()).append('\n');
        }
        return sb.toString();
    }
}
