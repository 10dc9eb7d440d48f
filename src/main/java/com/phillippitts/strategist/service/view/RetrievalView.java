package com.phillippitts.strategist.service.view;

import com.phillippitts.strategist.domain.SourceRef;

import java.util.List;

public record RetrievalView(AgentView agent, String answer, List<SourceRef> sources) {
}
