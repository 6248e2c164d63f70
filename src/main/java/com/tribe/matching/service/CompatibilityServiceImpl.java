package com.tribe.matching.service;

import com.tribe.matching.dto.AdvisoryScore;
import com.tribe.matching.dto.CompatibilityDetail;
import com.tribe.matching.dto.CompatibilityRecords.CommunicationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.GroupBalanceAnalysis;
import com.tribe.matching.dto.CompatibilityRecords.InterestCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.LocationCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.PersonalityCompatibility;
import com.tribe.matching.dto.FactorWeights;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.MemberScore;
import com.tribe.matching.dto.TribeCompatibility;
import com.tribe.matching.dto.UserCompatibility;
import com.tribe.matching.dto.enums.CompatibilityFactor;
import com.tribe.matching.exceptions.InternalServerErrorException;
import com.tribe.matching.models.PersonalityTraitScore;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import com.tribe.matching.processors.CompatibilityDescriptions;
import com.tribe.matching.processors.CompatibilityFactorCalculator;
import com.tribe.matching.utils.basic.Constant;
import com.tribe.matching.utils.basic.RunIdentifiers;
import com.tribe.matching.utils.basic.MetricsUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

@Slf4j
@Service
public class CompatibilityServiceImpl implements CompatibilityService {
    private static final Set<CompatibilityFactor> PAIR_FACTORS = EnumSet.of(
            CompatibilityFactor.PERSONALITY,
            CompatibilityFactor.INTERESTS,
            CompatibilityFactor.COMMUNICATION_STYLE,
            CompatibilityFactor.LOCATION);

    private final CompatibilityFactorCalculator calculator;
    private final AdvisoryService advisoryService;
    private final ExecutorService compatibilityExecutor;
    private final MeterRegistry meterRegistry;

    public CompatibilityServiceImpl(
            CompatibilityFactorCalculator calculator,
            AdvisoryService advisoryService,
            @Qualifier("compatibilityExecutor") ExecutorService compatibilityExecutor,
            MeterRegistry meterRegistry) {
        this.calculator = calculator;
        this.advisoryService = advisoryService;
        this.compatibilityExecutor = compatibilityExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public UserCompatibility userCompatibility(Profile user, Profile target, FactorWeights weights, boolean includeDetails) {
        PairScore pair = scorePair(user, target, weights);
        double finalScore = pair.overall();
        Double advisoryScore = null;
        String insights = null;

        Optional<AdvisoryScore> advisory = advisoryService.scorePair(user, target, pair.personality(), pair.interests());
        if (advisory.isPresent()) {
            advisoryScore = advisory.get().score();
            insights = advisory.get().insights();
            finalScore = clamp(Constant.ADVISORY_ALGORITHMIC_WEIGHT * pair.overall() + Constant.ADVISORY_WEIGHT * advisoryScore);
        }

        MetricsUtils.recordScore(meterRegistry, "user", finalScore);
        return UserCompatibility.builder()
                .userId(user.getId())
                .targetUserId(target.getId())
                .score(finalScore)
                .algorithmicScore(pair.overall())
                .advisoryScore(advisoryScore)
                .insights(insights)
                .details(includeDetails ? pair.details() : new ArrayList<>())
                .calculatedAt(RunIdentifiers.nowUtc())
                .build();
    }

    @Override
    public UserCompatibility algorithmicUserCompatibility(Profile user, Profile target, FactorWeights weights, boolean includeDetails) {
        PairScore pair = scorePair(user, target, weights);
        return UserCompatibility.builder()
                .userId(user.getId())
                .targetUserId(target.getId())
                .score(pair.overall())
                .algorithmicScore(pair.overall())
                .details(includeDetails ? pair.details() : new ArrayList<>())
                .calculatedAt(RunIdentifiers.nowUtc())
                .build();
    }

    @Override
    public TribeCompatibility tribeCompatibility(Profile user, Tribe tribe, List<Profile> memberProfiles,
                                                 FactorWeights weights, boolean includeDetails) {
        List<Profile> members = memberProfiles == null ? List.of() : memberProfiles;
        FactorWeights normalized = resolve(weights).normalized();

        List<MemberScore> memberScores = new ArrayList<>();
        double personalitySum = 0;
        double communicationSum = 0;
        for (Profile member : members) {
            double personality = calculator.personality(user.getPersonalityTraits(), member.getPersonalityTraits()).overall();
            double communication = calculator.communication(user.getCommunicationStyle(), member.getCommunicationStyle()).overall();
            memberScores.add(new MemberScore(member.getId(),
                    Constant.MEMBER_PERSONALITY_WEIGHT * personality + Constant.MEMBER_COMMUNICATION_WEIGHT * communication));
            personalitySum += personality;
            communicationSum += communication;
        }
        double avgPersonality = members.isEmpty() ? 0.0 : personalitySum / members.size();
        double avgCommunication = members.isEmpty() ? 0.0 : communicationSum / members.size();

        InterestCompatibility interests = calculator.interestsWithTribe(user.getInterests(), tribe.getInterests(), members);
        double maxDistance = user.getMaxTravelDistance() != null && user.getMaxTravelDistance() > 0
                ? user.getMaxTravelDistance()
                : FormationOptions.DEFAULT_MAX_DISTANCE_MILES;
        LocationCompatibility location = calculator.location(user.getCoordinates(), tribe.getCoordinates(), maxDistance);
        List<List<PersonalityTraitScore>> memberTraits = members.stream().map(Profile::getPersonalityTraits).toList();
        GroupBalanceAnalysis balance = calculator.groupBalance(user.getPersonalityTraits(), memberTraits);
        double balanceScore = balance.factorScore();

        double overall = clamp(
                avgPersonality * normalized.get(CompatibilityFactor.PERSONALITY)
                        + interests.overall() * normalized.get(CompatibilityFactor.INTERESTS)
                        + avgCommunication * normalized.get(CompatibilityFactor.COMMUNICATION_STYLE)
                        + location.overall() * normalized.get(CompatibilityFactor.LOCATION)
                        + balanceScore * normalized.get(CompatibilityFactor.GROUP_BALANCE));

        List<CompatibilityDetail> details = new ArrayList<>();
        if (includeDetails) {
            details.add(new CompatibilityDetail(CompatibilityFactor.PERSONALITY, avgPersonality,
                    normalized.get(CompatibilityFactor.PERSONALITY), CompatibilityDescriptions.averagePersonality(avgPersonality)));
            details.add(new CompatibilityDetail(CompatibilityFactor.INTERESTS, interests.overall(),
                    normalized.get(CompatibilityFactor.INTERESTS), CompatibilityDescriptions.interests(interests.overall(), interests)));
            details.add(new CompatibilityDetail(CompatibilityFactor.COMMUNICATION_STYLE, avgCommunication,
                    normalized.get(CompatibilityFactor.COMMUNICATION_STYLE), CompatibilityDescriptions.averageCommunication(avgCommunication)));
            details.add(new CompatibilityDetail(CompatibilityFactor.LOCATION, location.overall(),
                    normalized.get(CompatibilityFactor.LOCATION), CompatibilityDescriptions.location(location.overall(), location)));
            details.add(new CompatibilityDetail(CompatibilityFactor.GROUP_BALANCE, balanceScore,
                    normalized.get(CompatibilityFactor.GROUP_BALANCE), CompatibilityDescriptions.groupBalance(balanceScore, balance)));
        }

        MetricsUtils.recordScore(meterRegistry, "tribe", overall);
        return TribeCompatibility.builder()
                .userId(user.getId())
                .tribeId(tribe.getId())
                .score(overall)
                .details(details)
                .memberScores(memberScores)
                .balance(balance)
                .calculatedAt(RunIdentifiers.nowUtc())
                .build();
    }

    @Override
    public List<UserCompatibility> batchUserCompatibility(Profile user, List<Profile> candidates,
                                                          FactorWeights weights, boolean includeDetails) {
        List<Supplier<UserCompatibility>> tasks = new ArrayList<>();
        for (Profile candidate : candidates) {
            if (candidate.getId().equals(user.getId())) {
                continue;
            }
            tasks.add(() -> userCompatibility(user, candidate, weights, includeDetails));
        }
        return fanOut(tasks, "user", user.getId());
    }

    @Override
    public List<TribeCompatibility> batchTribeCompatibility(Profile user, List<Tribe> tribes,
                                                            Map<String, List<Profile>> memberProfiles,
                                                            FactorWeights weights, boolean includeDetails) {
        List<Supplier<TribeCompatibility>> tasks = new ArrayList<>();
        for (Tribe tribe : tribes) {
            List<Profile> members = memberProfiles == null ? List.of() : memberProfiles.getOrDefault(tribe.getId(), List.of());
            tasks.add(() -> tribeCompatibility(user, tribe, members, weights, includeDetails));
        }
        return fanOut(tasks, "tribe", user.getId());
    }

    @Override
    public List<UserCompatibility> findMostCompatibleUsers(Profile user, List<Profile> pool, FactorWeights weights,
                                                           int limit, double threshold, boolean includeDetails) {
        List<UserCompatibility> ranked = new ArrayList<>(batchUserCompatibility(user, pool, weights, includeDetails));
        ranked.removeIf(result -> result.getScore() < threshold);
        ranked.sort(Comparator.comparingDouble(UserCompatibility::getScore).reversed());
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, Math.max(0, limit))) : ranked;
    }

    @Override
    public List<TribeCompatibility> findMostCompatibleTribes(Profile user, List<Tribe> tribes,
                                                             Map<String, List<Profile>> memberProfiles,
                                                             FactorWeights weights, int limit, double threshold,
                                                             boolean includeDetails) {
        List<TribeCompatibility> ranked = new ArrayList<>(
                batchTribeCompatibility(user, tribes, memberProfiles, weights, includeDetails));
        ranked.removeIf(result -> result.getScore() < threshold);
        ranked.sort(Comparator.comparingDouble(TribeCompatibility::getScore).reversed());
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, Math.max(0, limit))) : ranked;
    }

    private PairScore scorePair(Profile user, Profile target, FactorWeights weights) {
        FactorWeights normalized = resolve(weights).restrictTo(PAIR_FACTORS);

        PersonalityCompatibility personality = calculator.personality(user.getPersonalityTraits(), target.getPersonalityTraits());
        InterestCompatibility interests = calculator.interests(user.getInterests(), target.getInterests());
        CommunicationCompatibility communication = calculator.communication(user.getCommunicationStyle(), target.getCommunicationStyle());
        LocationCompatibility location = calculator.location(user.getCoordinates(), target.getCoordinates(),
                FormationOptions.DEFAULT_MAX_DISTANCE_MILES);

        double overall = clamp(
                personality.overall() * normalized.get(CompatibilityFactor.PERSONALITY)
                        + interests.overall() * normalized.get(CompatibilityFactor.INTERESTS)
                        + communication.overall() * normalized.get(CompatibilityFactor.COMMUNICATION_STYLE)
                        + location.overall() * normalized.get(CompatibilityFactor.LOCATION));

        List<CompatibilityDetail> details = List.of(
                new CompatibilityDetail(CompatibilityFactor.PERSONALITY, personality.overall(),
                        normalized.get(CompatibilityFactor.PERSONALITY),
                        CompatibilityDescriptions.personality(personality.overall(), personality)),
                new CompatibilityDetail(CompatibilityFactor.INTERESTS, interests.overall(),
                        normalized.get(CompatibilityFactor.INTERESTS),
                        CompatibilityDescriptions.interests(interests.overall(), interests)),
                new CompatibilityDetail(CompatibilityFactor.COMMUNICATION_STYLE, communication.overall(),
                        normalized.get(CompatibilityFactor.COMMUNICATION_STYLE),
                        CompatibilityDescriptions.communication(communication.overall(), communication)),
                new CompatibilityDetail(CompatibilityFactor.LOCATION, location.overall(),
                        normalized.get(CompatibilityFactor.LOCATION),
                        CompatibilityDescriptions.location(location.overall(), location)));

        return new PairScore(overall, personality, interests, details);
    }

    private <T> List<T> fanOut(List<Supplier<T>> tasks, String target, String userId) {
        List<CompletableFuture<T>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(task, compatibilityExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            log.error("Compatibility fan-out failed for userId={}, target={}: {}", userId, target, e.getCause().getMessage());
            meterRegistry.counter("compatibility_errors", "target", target).increment();
            throw new InternalServerErrorException("Compatibility scoring failed for user " + userId, e.getCause());
        }
    }

    private static FactorWeights resolve(FactorWeights weights) {
        return weights == null ? FactorWeights.defaults() : weights;
    }

    private static double clamp(double score) {
        return Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(100.0, score));
    }

    private record PairScore(double overall, PersonalityCompatibility personality,
                             InterestCompatibility interests, List<CompatibilityDetail> details) {
    }
}
