package com.phillippitts.strategist.domain;

/**
 * Output of the final strategy agent, already split at the SWOT sentinel markers.
 *
 * @param mainText visible strategy block (the whole text when markers are missing)
 * @param swotText hidden SWOT block, empty when markers are missing
 * @param rawText  full unmodified model output
 */
public record FinalStrategyResult(String mainText, String swotText, String rawText) implements AgentResult {

    public FinalStrategyResult {
        mainText = mainText == null ? "" : mainText;
        swotText = swotText == null ? "" : swotText;
        rawText = rawText == null ? "" : rawText;
    }

    @Override
    public AgentKind kind() {
        return AgentKind.FINAL_STRATEGY;
    }
}
