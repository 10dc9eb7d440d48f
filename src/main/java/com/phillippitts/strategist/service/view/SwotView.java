package com.phillippitts.strategist.service.view;

import java.util.List;

public record SwotView(List<String> strengths, List<String> weaknesses, List<String> opportunities,
                       List<String> threats) {
}
