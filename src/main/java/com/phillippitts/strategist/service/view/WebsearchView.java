package com.phillippitts.strategist.service.view;

import com.phillippitts.strategist.domain.SourceRef;

import java.util.List;

/**
 * @param displayText plain text shown when the payload held no decodable summary or bullets
 */
public record WebsearchView(AgentView agent, String summary, List<String> bullets, String displayText,
                            List<SourceRef> sources) {
}
