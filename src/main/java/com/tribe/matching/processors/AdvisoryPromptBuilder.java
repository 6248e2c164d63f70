package com.tribe.matching.processors;

import com.tribe.matching.dto.CompatibilityRecords.InterestCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.PersonalityCompatibility;
import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.dto.TribeAssignment;
import com.tribe.matching.models.Interest;
import com.tribe.matching.models.Profile;
import com.tribe.matching.utils.basic.Constant;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@UtilityClass
public final class AdvisoryPromptBuilder {

    public static String pairPrompt(Profile a, Profile b,
                                    PersonalityCompatibility personality,
                                    InterestCompatibility interests) {
        return """
                Analyze the compatibility between these two people for a small social group.

                Person 1: %s
                - Personality: %s
                - Communication style: %s
                - Interests: %s

                Person 2: %s
                - Personality: %s
                - Communication style: %s
                - Interests: %s

                Calculated so far:
                - Personality compatibility: %s%%
                - Interest compatibility: %s%%
                - Complementary traits: %s
                - Shared interests: %s

                Provide a compatibility score (0-100) and a brief explanation.
                Format your response as:
                SCORE: [number]
                INSIGHTS: [explanation]
                """.formatted(
                displayName(a), traits(a), a.getCommunicationStyle(), interests(a.getInterests()),
                displayName(b), traits(b), b.getCommunicationStyle(), interests(b.getInterests()),
                fmt(personality.overall()), fmt(interests.overall()),
                personality.complementary().stream().map(Enum::name).collect(Collectors.joining(", ")),
                interests.shared().stream().map(InterestKey::name).collect(Collectors.joining(", ")));
    }

    public static String formationPrompt(Collection<Profile> users,
                                         Map<String, TribeAssignment> existingAssignments,
                                         List<NewTribe> newTribes) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze the following tribe formation results and suggest potential improvements.\n\n");
        sb.append("USERS:\n");
        for (Profile user : users) {
            sb.append("- User ID: ").append(user.getId()).append('\n')
                    .append("  Name: ").append(displayName(user)).append('\n')
                    .append("  Personality: ").append(traits(user)).append('\n')
                    .append("  Communication: ").append(user.getCommunicationStyle()).append('\n')
                    .append("  Interests: ").append(interests(user.getInterests())).append('\n');
        }
        sb.append("\nEXISTING TRIBE ASSIGNMENTS:\n");
        existingAssignments.values().forEach(assignment -> sb.append("- User ID: ").append(assignment.userId())
                .append(" assigned to Tribe: ").append(assignment.tribeId())
                .append(" (").append(fmt(assignment.score())).append("%)\n"));
        sb.append("\nNEW TRIBE FORMATIONS:\n");
        for (int i = 0; i < newTribes.size(); i++) {
            sb.append("- Tribe ID: ").append(Constant.NEW_TRIBE_PREFIX).append(i + 1).append("\n  Members: ")
                    .append(newTribes.get(i).members().stream()
                            .map(m -> m.userId() + " (" + fmt(m.score()) + "%)")
                            .collect(Collectors.joining(", ")))
                    .append('\n');
        }
        sb.append("""

                Suggest up to 3 improvements to tribe balance and cohesion.
                Provide your response in this format:
                INSIGHTS: [your analysis]

                ADJUSTMENTS:
                1. Move [user_id] from [current_tribe_id] to [suggested_tribe_id] - [brief reason]
                """);
        return sb.toString();
    }

    private static String displayName(Profile profile) {
        if (profile.getName() != null && !profile.getName().isBlank()) {
            return profile.getName();
        }
        String id = profile.getId();
        return "User " + (id.length() > 6 ? id.substring(0, 6) : id);
    }

    private static String traits(Profile profile) {
        return profile.getPersonalityTraits().stream()
                .map(t -> t.getTrait() + ": " + fmt(t.getScore()))
                .collect(Collectors.joining(", "));
    }

    private static String interests(List<Interest> interests) {
        return interests.stream().map(Interest::getName).collect(Collectors.joining(", "));
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
