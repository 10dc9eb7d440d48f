package com.phillippitts.strategist.gateway.chat;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.SourceRef;
import com.phillippitts.strategist.domain.WebsearchResult;
import com.phillippitts.strategist.gateway.WebsearchGateway;
import com.phillippitts.strategist.service.parser.PayloadUnwrapper;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Websearch agent backed by a search-capable chat model that answers in JSON.
 *
 * <p>The content is returned as the raw payload without decoding: models wrap it in fences or
 * encode it twice, and {@link PayloadUnwrapper} deals with that at read time. Sources are
 * extracted best-effort; a payload without them yields an empty list.
 */
public class ChatWebsearchGateway implements WebsearchGateway {

    static final String SYSTEM_PROMPT = """
            You are a research analyst. Find how other universities and comparable organizations \
            handled situations similar to the user's request. Use recent, verifiable public sources.
            Answer with a single JSON object and nothing else:
            {"summary": "<short overview, 3-6 sentences>",
             "bullets": ["<key fact>", "..."],
             "sources": [{"title": "...", "url": "...", "date": "YYYY-MM-DD"}]}""";

    private final ChatCompletionClient client;

    public ChatWebsearchGateway(ChatCompletionClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public WebsearchResult call(String correlationId, String query) {
        String content = client.complete(AgentKind.WEBSEARCH, SYSTEM_PROMPT, query, correlationId);
        return new WebsearchResult(content, sourcesOf(content));
    }

    static List<SourceRef> sourcesOf(String content) {
        JSONObject payload = PayloadUnwrapper.decodeObject(content);
        if (payload == null) {
            return List.of();
        }
        JSONArray array = payload.optJSONArray("sources");
        if (array == null) {
            return List.of();
        }
        List<SourceRef> sources = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject src = array.optJSONObject(i);
            if (src == null) {
                continue;
            }
            String title = src.optString("title", "").strip();
            String url = src.optString("url", "").strip();
            if (title.isEmpty() && url.isEmpty()) {
                continue;
            }
            sources.add(new SourceRef(title.isEmpty() ? url : title, url, src.optString("date", "").strip()));
        }
        return sources;
    }
}
