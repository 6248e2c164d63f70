package com.tribe.matching.processors;

import com.tribe.matching.dto.CompatibilityRecords.CommunicationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.GroupBalanceAnalysis;
import com.tribe.matching.dto.CompatibilityRecords.InterestCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.LocationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.PersonalityCompatibility;
import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.dto.enums.CommunicationStyle;
import com.tribe.matching.dto.enums.PersonalityTrait;
import com.tribe.matching.models.Coordinates;
import com.tribe.matching.models.Interest;
import com.tribe.matching.models.PersonalityTraitScore;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.TribeInterest;
import com.tribe.matching.utils.GeoUtils;
import com.tribe.matching.utils.basic.Constant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a single compatibility factor at a time. Stateless; every method returns a new
 * record and leaves its inputs untouched.
 */
@Slf4j
@Component
public class CompatibilityFactorCalculator {
    static final double COMPLEMENTARY_TRAIT_SCORE = 70.0;
    static final double CONFLICTING_TRAIT_SCORE = 40.0;
    static final double PRIMARY_INTEREST_BONUS = 20.0;
    static final double NEUTRAL_SCORE = 50.0;

    private static final Map<PersonalityTrait, Double> TRAIT_BASE = new EnumMap<>(PersonalityTrait.class);
    private static final Map<CommunicationStyle, Map<CommunicationStyle, Double>> STYLE_MATRIX =
            new EnumMap<>(CommunicationStyle.class);
    private static final Map<CommunicationStyle, Set<CommunicationStyle>> COMPLEMENTARY_STYLES =
            new EnumMap<>(CommunicationStyle.class);

    static {
        TRAIT_BASE.put(PersonalityTrait.OPENNESS, 0.9);
        TRAIT_BASE.put(PersonalityTrait.CONSCIENTIOUSNESS, 0.8);
        TRAIT_BASE.put(PersonalityTrait.EXTRAVERSION, 0.7);
        TRAIT_BASE.put(PersonalityTrait.AGREEABLENESS, 0.9);
        TRAIT_BASE.put(PersonalityTrait.NEUROTICISM, 0.3);

        for (CommunicationStyle style : CommunicationStyle.values()) {
            STYLE_MATRIX.put(style, new EnumMap<>(CommunicationStyle.class));
            STYLE_MATRIX.get(style).put(style, 0.9);
            COMPLEMENTARY_STYLES.put(style, new HashSet<>());
        }
        styles(CommunicationStyle.DIRECT, CommunicationStyle.THOUGHTFUL, 0.6);
        styles(CommunicationStyle.DIRECT, CommunicationStyle.EXPRESSIVE, 0.7);
        styles(CommunicationStyle.DIRECT, CommunicationStyle.SUPPORTIVE, 0.5);
        styles(CommunicationStyle.DIRECT, CommunicationStyle.ANALYTICAL, 0.8);
        styles(CommunicationStyle.THOUGHTFUL, CommunicationStyle.EXPRESSIVE, 0.5);
        styles(CommunicationStyle.THOUGHTFUL, CommunicationStyle.SUPPORTIVE, 0.8);
        styles(CommunicationStyle.THOUGHTFUL, CommunicationStyle.ANALYTICAL, 0.7);
        styles(CommunicationStyle.EXPRESSIVE, CommunicationStyle.SUPPORTIVE, 0.7);
        styles(CommunicationStyle.EXPRESSIVE, CommunicationStyle.ANALYTICAL, 0.4);
        styles(CommunicationStyle.SUPPORTIVE, CommunicationStyle.ANALYTICAL, 0.6);

        COMPLEMENTARY_STYLES.get(CommunicationStyle.DIRECT).add(CommunicationStyle.ANALYTICAL);
        COMPLEMENTARY_STYLES.get(CommunicationStyle.ANALYTICAL).add(CommunicationStyle.DIRECT);
        COMPLEMENTARY_STYLES.get(CommunicationStyle.THOUGHTFUL).add(CommunicationStyle.SUPPORTIVE);
        COMPLEMENTARY_STYLES.get(CommunicationStyle.SUPPORTIVE).add(CommunicationStyle.THOUGHTFUL);
        COMPLEMENTARY_STYLES.get(CommunicationStyle.SUPPORTIVE).add(CommunicationStyle.EXPRESSIVE);
        COMPLEMENTARY_STYLES.get(CommunicationStyle.EXPRESSIVE).add(CommunicationStyle.SUPPORTIVE);
    }

    private static void styles(CommunicationStyle a, CommunicationStyle b, double score) {
        STYLE_MATRIX.get(a).put(b, score);
        STYLE_MATRIX.get(b).put(a, score);
    }

    /**
     * Per-trait scores are 0-100. Extraversion rewards opposite levels; every other trait
     * rewards similar levels scaled by the trait's base compatibility. The overall score
     * weighs each shared trait equally, each measured against the best score that trait
     * can reach. No shared traits yields 0.
     */
    public PersonalityCompatibility personality(List<PersonalityTraitScore> traitsA, List<PersonalityTraitScore> traitsB) {
        Map<PersonalityTrait, Double> a = traitMap(traitsA);
        Map<PersonalityTrait, Double> b = traitMap(traitsB);

        Map<PersonalityTrait, Double> traitScores = new EnumMap<>(PersonalityTrait.class);
        List<PersonalityTrait> complementary = new ArrayList<>();
        List<PersonalityTrait> conflicting = new ArrayList<>();
        double relativeSum = 0;

        for (PersonalityTrait trait : PersonalityTrait.values()) {
            if (!a.containsKey(trait) || !b.containsKey(trait)) {
                continue;
            }
            double valueA = a.get(trait) / 100.0;
            double valueB = b.get(trait) / 100.0;
            double raw;
            double best;
            if (trait == PersonalityTrait.EXTRAVERSION) {
                raw = 1 - Math.abs(valueA - (1 - valueB)) / 2;
                best = 1.0;
            } else {
                raw = TRAIT_BASE.get(trait) * (1 - Math.abs(valueA - valueB));
                best = TRAIT_BASE.get(trait);
            }
            double scaled = clamp(raw * 100);
            traitScores.put(trait, scaled);
            relativeSum += clamp(raw / best * 100);

            if (scaled >= COMPLEMENTARY_TRAIT_SCORE) {
                complementary.add(trait);
            } else if (scaled <= CONFLICTING_TRAIT_SCORE) {
                conflicting.add(trait);
            }
        }

        double overall = traitScores.isEmpty() ? 0.0 : clamp(relativeSum / traitScores.size());
        return new PersonalityCompatibility(traitScores, overall, complementary, conflicting);
    }

    public InterestCompatibility interests(List<Interest> interestsA, List<Interest> interestsB) {
        return interestScore(userInterestFlags(interestsA), userInterestFlags(interestsB));
    }

    /**
     * Compares a user's interests with a tribe's declared interests merged with the
     * interests of its current members. Declared interests keep their own primary flag.
     */
    public InterestCompatibility interestsWithTribe(List<Interest> userInterests,
                                                    Collection<TribeInterest> tribeInterests,
                                                    Collection<Profile> members) {
        Map<InterestKey, Boolean> tribeSide = new LinkedHashMap<>();
        if (tribeInterests != null) {
            tribeInterests.forEach(ti -> tribeSide.merge(ti.key(), ti.isPrimary(), Boolean::logicalOr));
        }
        if (members != null) {
            members.forEach(m -> userInterestFlags(m.getInterests())
                    .forEach((key, primary) -> tribeSide.merge(key, primary, Boolean::logicalOr)));
        }
        return interestScore(userInterestFlags(userInterests), tribeSide);
    }

    private InterestCompatibility interestScore(Map<InterestKey, Boolean> a, Map<InterestKey, Boolean> b) {
        Set<InterestKey> union = new HashSet<>(a.keySet());
        union.addAll(b.keySet());
        if (union.isEmpty()) {
            return new InterestCompatibility(List.of(), 0.0, false);
        }

        List<InterestKey> shared = new ArrayList<>();
        boolean primaryMatch = false;
        for (Map.Entry<InterestKey, Boolean> entry : a.entrySet()) {
            Boolean other = b.get(entry.getKey());
            if (other != null) {
                shared.add(entry.getKey());
                primaryMatch |= entry.getValue() && other;
            }
        }

        double overall = (double) shared.size() / union.size() * 100;
        if (primaryMatch) {
            overall += PRIMARY_INTEREST_BONUS;
        }
        return new InterestCompatibility(shared, clamp(overall), primaryMatch);
    }

    /**
     * Looks the pair up in the symmetric style matrix. A missing style scores neutral.
     */
    public CommunicationCompatibility communication(CommunicationStyle styleA, CommunicationStyle styleB) {
        if (styleA == null || styleB == null) {
            return new CommunicationCompatibility(false, NEUTRAL_SCORE, false);
        }
        double overall = STYLE_MATRIX.get(styleA).get(styleB) * 100;
        boolean complementary = COMPLEMENTARY_STYLES.get(styleA).contains(styleB);
        return new CommunicationCompatibility(styleA == styleB, clamp(overall), complementary);
    }

    /**
     * Linear decay from 100 at zero distance to 0 at {@code maxDistanceMiles}. Missing
     * coordinates are treated as out of range.
     */
    public LocationCompatibility location(Coordinates a, Coordinates b, double maxDistanceMiles) {
        if (a == null || b == null) {
            return new LocationCompatibility(Double.POSITIVE_INFINITY, false, 0.0);
        }
        double distance = GeoUtils.distanceMiles(a, b);
        double overall;
        if (maxDistanceMiles <= 0) {
            overall = distance == 0 ? 100.0 : 0.0;
        } else {
            overall = clamp(100 * (1 - distance / maxDistanceMiles));
        }
        return new LocationCompatibility(distance, distance <= maxDistanceMiles, overall);
    }

    /**
     * Measures how evenly a group's trait means are spread with and without the candidate.
     * Members lacking a trait contribute 0 to that trait's mean.
     */
    public GroupBalanceAnalysis groupBalance(List<PersonalityTraitScore> candidate,
                                             List<List<PersonalityTraitScore>> memberTraits) {
        int memberCount = memberTraits.size();
        Map<PersonalityTrait, Double> current = new EnumMap<>(PersonalityTrait.class);
        for (PersonalityTrait trait : PersonalityTrait.values()) {
            current.put(trait, 0.0);
        }
        for (List<PersonalityTraitScore> traits : memberTraits) {
            traitMap(traits).forEach((trait, score) -> current.merge(trait, score, Double::sum));
        }
        if (memberCount > 0) {
            current.replaceAll((trait, sum) -> sum / memberCount);
        }

        Map<PersonalityTrait, Double> candidateMap = traitMap(candidate);
        Map<PersonalityTrait, Double> projected = new EnumMap<>(PersonalityTrait.class);
        for (PersonalityTrait trait : PersonalityTrait.values()) {
            double sum = current.get(trait) * memberCount + candidateMap.getOrDefault(trait, 0.0);
            projected.put(trait, sum / (memberCount + 1));
        }

        double currentBalance = standardDeviation(current.values());
        double projectedBalance = standardDeviation(projected.values());
        double impact = (currentBalance - projectedBalance) * Constant.BALANCE_SCALE_FACTOR;
        return new GroupBalanceAnalysis(current, projected, currentBalance, projectedBalance, impact, impact > 0);
    }

    /**
     * Population variance across the group's per-trait means, over traits present on at
     * least one member. Lower means a more even trait distribution.
     */
    public double traitDistributionVariance(Collection<Profile> group) {
        if (group.isEmpty()) {
            return 0.0;
        }
        Map<PersonalityTrait, Double> sums = new EnumMap<>(PersonalityTrait.class);
        for (Profile member : group) {
            traitMap(member.getPersonalityTraits()).forEach((trait, score) -> sums.merge(trait, score, Double::sum));
        }
        if (sums.isEmpty()) {
            return 0.0;
        }
        List<Double> means = new ArrayList<>();
        sums.values().forEach(sum -> means.add(sum / group.size()));
        double sd = standardDeviation(means);
        return sd * sd;
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    private static double standardDeviation(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
        return Math.sqrt(variance);
    }

    private static Map<PersonalityTrait, Double> traitMap(List<PersonalityTraitScore> traits) {
        if (traits == null || traits.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<PersonalityTrait, Double> map = new EnumMap<>(PersonalityTrait.class);
        for (PersonalityTraitScore score : traits) {
            if (score.getTrait() != null) {
                map.put(score.getTrait(), score.getScore());
            }
        }
        return map;
    }

    private static Map<InterestKey, Boolean> userInterestFlags(List<Interest> interests) {
        Map<InterestKey, Boolean> flags = new LinkedHashMap<>();
        if (interests != null) {
            interests.forEach(i -> flags.merge(i.key(), i.isPrimary(), Boolean::logicalOr));
        }
        return flags;
    }
}
