package com.tribe.matching.processors;

import com.tribe.matching.dto.CompatibilityRecords.CommunicationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.GroupBalanceAnalysis;
import com.tribe.matching.dto.CompatibilityRecords.InterestCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.LocationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.PersonalityCompatibility;
import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.dto.enums.PersonalityTrait;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deterministic one-line explanations attached to each factor detail.
 */
@UtilityClass
public final class CompatibilityDescriptions {

    public static String personality(double score, PersonalityCompatibility result) {
        StringBuilder sb = new StringBuilder("Personality compatibility: ").append(pct(score)).append(". ");
        if (!result.complementary().isEmpty()) {
            sb.append("Complementary traits: ").append(traits(result.complementary())).append(". ");
        }
        if (!result.conflicting().isEmpty()) {
            sb.append("Potential conflicts in: ").append(traits(result.conflicting())).append(". ");
        }
        return sb.toString().trim();
    }

    public static String averagePersonality(double score) {
        return "Average personality compatibility with tribe members: " + pct(score) + ".";
    }

    public static String interests(double score, InterestCompatibility result) {
        StringBuilder sb = new StringBuilder("Interest compatibility: ").append(pct(score)).append(". ");
        if (!result.shared().isEmpty()) {
            sb.append("Shared interests: ")
                    .append(result.shared().stream().map(InterestKey::name).collect(Collectors.joining(", ")))
                    .append(". ");
        }
        if (result.primaryMatch()) {
            sb.append("Strong match in primary interests.");
        }
        return sb.toString().trim();
    }

    public static String communication(double score, CommunicationCompatibility result) {
        String suffix;
        if (result.match()) {
            suffix = "Matching communication styles.";
        } else if (result.complementary()) {
            suffix = "Complementary communication styles.";
        } else {
            suffix = "Different communication approaches.";
        }
        return "Communication compatibility: " + pct(score) + ". " + suffix;
    }

    public static String averageCommunication(double score) {
        return "Average communication style compatibility with tribe members: " + pct(score) + ".";
    }

    public static String location(double score, LocationCompatibility result) {
        String distance = Double.isFinite(result.distanceMiles())
                ? String.format(Locale.ROOT, "%.1f miles", result.distanceMiles())
                : "unknown";
        return "Location compatibility: " + pct(score) + ". Distance: " + distance + ". "
                + (result.withinRange() ? "Within preferred range." : "Beyond preferred range.");
    }

    public static String groupBalance(double score, GroupBalanceAnalysis result) {
        return "Group balance impact: " + pct(score) + ". "
                + (result.improves()
                ? "Would improve the tribe's psychological balance."
                : "Might not improve the tribe's psychological diversity.");
    }

    private static String pct(double score) {
        return String.format(Locale.ROOT, "%.1f%%", score);
    }

    private static String traits(List<PersonalityTrait> traits) {
        return traits.stream().map(t -> t.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
    }
}
