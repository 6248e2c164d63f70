package com.tribe.matching.processors;

import com.tribe.matching.dto.AdvisoryScore;
import com.tribe.matching.dto.FormationAdvice;
import com.tribe.matching.dto.TribeAdjustment;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured values from advisory text. Anything that does not follow the
 * requested format is ignored.
 */
@Slf4j
@UtilityClass
public final class AdvisoryResponseParser {
    private static final Pattern SCORE = Pattern.compile("SCORE:\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSIGHTS = Pattern.compile("INSIGHTS:\\s*(.+?)(?=ADJUSTMENTS:|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ADJUSTMENTS = Pattern.compile("ADJUSTMENTS:(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ADJUSTMENT_LINE = Pattern.compile(
            "\\d+\\.\\s*Move\\s+([\\w-]+)\\s+from\\s+([\\w-]+)\\s+to\\s+([\\w-]+)\\s*-\\s*(.+)");

    /**
     * Empty when the text carries no score.
     */
    public static Optional<AdvisoryScore> parseScore(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher scoreMatcher = SCORE.matcher(text);
        if (!scoreMatcher.find()) {
            log.debug("Advisory response had no SCORE line");
            return Optional.empty();
        }
        double score = Math.max(0, Math.min(100, Double.parseDouble(scoreMatcher.group(1))));
        Matcher insightsMatcher = INSIGHTS.matcher(text);
        String insights = insightsMatcher.find() ? insightsMatcher.group(1).trim() : "No additional insights available.";
        return Optional.of(new AdvisoryScore(score, insights));
    }

    public static FormationAdvice parseFormationAdvice(String text) {
        if (text == null || text.isBlank()) {
            return FormationAdvice.unavailable();
        }
        Matcher insightsMatcher = INSIGHTS.matcher(text);
        String insights = insightsMatcher.find() ? insightsMatcher.group(1).trim() : "No insights provided.";

        List<TribeAdjustment> adjustments = new ArrayList<>();
        Matcher adjustmentsMatcher = ADJUSTMENTS.matcher(text);
        if (adjustmentsMatcher.find()) {
            for (String line : adjustmentsMatcher.group(1).split("\\R")) {
                Matcher lineMatcher = ADJUSTMENT_LINE.matcher(line.trim());
                if (lineMatcher.matches()) {
                    adjustments.add(new TribeAdjustment(
                            lineMatcher.group(1), lineMatcher.group(2), lineMatcher.group(3), lineMatcher.group(4).trim()));
                }
            }
        }
        return new FormationAdvice(insights, adjustments, true);
    }
}
