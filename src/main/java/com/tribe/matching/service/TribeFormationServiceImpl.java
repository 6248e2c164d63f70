package com.tribe.matching.service;

import com.tribe.matching.dto.FormationAdvice;
import com.tribe.matching.dto.FormationMetrics;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.FormationResult;
import com.tribe.matching.dto.MemberScore;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.dto.TribeAssignment;
import com.tribe.matching.dto.TribeCompatibility;
import com.tribe.matching.exceptions.InternalServerErrorException;
import com.tribe.matching.exceptions.MatchingInvariantViolationException;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import com.tribe.matching.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
public class TribeFormationServiceImpl implements TribeFormationService {
    private static final double EPSILON = 1e-9;

    private final CompatibilityService compatibilityService;
    private final ClusteringService clusteringService;
    private final AdvisoryService advisoryService;
    private final ExecutorService compatibilityExecutor;
    private final MeterRegistry meterRegistry;

    public TribeFormationServiceImpl(
            CompatibilityService compatibilityService,
            ClusteringService clusteringService,
            AdvisoryService advisoryService,
            @Qualifier("compatibilityExecutor") ExecutorService compatibilityExecutor,
            MeterRegistry meterRegistry) {
        this.compatibilityService = compatibilityService;
        this.clusteringService = clusteringService;
        this.advisoryService = advisoryService;
        this.compatibilityExecutor = compatibilityExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public FormationResult formTribes(List<Profile> users, List<Tribe> existingTribes,
                                      Map<String, List<Profile>> memberProfiles, FormationOptions options) {
        FormationOptions opts = (options == null ? FormationOptions.defaults() : options).sanitized();
        Map<String, List<Profile>> members = memberProfiles == null ? Map.of() : memberProfiles;
        List<Tribe> tribes = existingTribes == null ? List.of() : existingTribes;
        List<Profile> pool = distinctUsers(users);
        Timer.Sample sample = Timer.start(meterRegistry);

        List<Tribe> available = tribes.stream().filter(Tribe::hasCapacity).toList();
        Map<String, TribeAssignment> assignments = new LinkedHashMap<>();
        if (opts.isPreferExistingTribes() && !available.isEmpty()) {
            assignments = assignToExistingTribes(pool, available, members, opts);
        }
        log.info("Existing tribe pass: users={}, availableTribes={}, assigned={}",
                pool.size(), available.size(), assignments.size());

        Set<String> assigned = assignments.keySet();
        List<Profile> leftovers = pool.stream().filter(user -> !assigned.contains(user.getId())).toList();
        List<NewTribe> newTribes = clusteringService.formGroups(leftovers, opts);

        Map<String, Profile> byId = new HashMap<>();
        pool.forEach(user -> byId.put(user.getId(), user));
        Map<String, Tribe> tribesById = new HashMap<>();
        tribes.forEach(tribe -> tribesById.put(tribe.getId(), tribe));
        int swaps = optimizeAssignments(assignments, byId, tribesById, members, opts);

        FormationAdvice advice = advisoryService.adviseFormation(pool, assignments, newTribes);
        if (advice.available()) {
            log.info("Formation advice: insights={}, adjustments={}", advice.insights(), advice.adjustments().size());
        }

        verifyInvariants(pool, tribes, assignments, newTribes, opts);

        FormationMetrics metrics = metrics(pool.size(), assignments, newTribes, swaps);
        sample.stop(meterRegistry.timer("tribe_formation_duration"));
        meterRegistry.counter("tribes_created_total").increment(newTribes.stream().filter(t -> !t.undersized()).count());
        meterRegistry.counter("users_assigned_total", "target", "existing").increment(metrics.assignedToExisting());
        meterRegistry.counter("users_assigned_total", "target", "new").increment(metrics.placedInNewTribes());

        log.info("Tribe formation finished: users={}, existingAssignments={}, newTribes={}, undersized={}, swaps={}",
                pool.size(), assignments.size(), newTribes.size(), metrics.undersizedTribes(), swaps);
        return FormationResult.builder()
                .existingAssignments(assignments)
                .newTribes(newTribes)
                .advice(advice)
                .metrics(metrics)
                .build();
    }

    /**
     * Scores every user against every open tribe in parallel, then walks users from best
     * to worst fit and gives each its best tribe while that tribe has a seat and the score
     * clears the threshold.
     */
    private Map<String, TribeAssignment> assignToExistingTribes(List<Profile> users, List<Tribe> tribes,
                                                                Map<String, List<Profile>> members,
                                                                FormationOptions opts) {
        List<CompletableFuture<TribeCompatibility>> futures = users.stream()
                .map(user -> CompletableFuture.supplyAsync(() -> bestTribe(user, tribes, members, opts), compatibilityExecutor))
                .toList();
        List<TribeCompatibility> best;
        try {
            best = futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            log.error("Existing tribe scoring failed: {}", e.getCause().getMessage());
            meterRegistry.counter("matching_errors", "stage", "existing_tribes").increment();
            throw new InternalServerErrorException("Existing tribe scoring failed", e.getCause());
        }

        List<TribeCompatibility> ranked = new ArrayList<>(best);
        ranked.sort(Comparator.comparingDouble(TribeCompatibility::getScore).reversed());

        Map<String, Integer> seats = new HashMap<>();
        tribes.forEach(tribe -> seats.put(tribe.getId(), tribe.availableSeats()));
        double minScore = opts.getCompatibilityThreshold() * 100;

        Map<String, TribeAssignment> assignments = new LinkedHashMap<>();
        for (TribeCompatibility candidate : ranked) {
            if (candidate.getTribeId() == null || candidate.getScore() < minScore) {
                continue;
            }
            int free = seats.getOrDefault(candidate.getTribeId(), 0);
            if (free <= 0) {
                log.debug("Tribe tribeId={} full, userId={} left for clustering", candidate.getTribeId(), candidate.getUserId());
                continue;
            }
            seats.put(candidate.getTribeId(), free - 1);
            assignments.put(candidate.getUserId(),
                    new TribeAssignment(candidate.getUserId(), candidate.getTribeId(), candidate.getScore()));
        }
        return assignments;
    }

    private TribeCompatibility bestTribe(Profile user, List<Tribe> tribes, Map<String, List<Profile>> members,
                                         FormationOptions opts) {
        TribeCompatibility best = null;
        for (Tribe tribe : tribes) {
            TribeCompatibility result = compatibilityService.tribeCompatibility(
                    user, tribe, members.getOrDefault(tribe.getId(), List.of()), opts.getWeights(), false);
            if (best == null || result.getScore() > best.getScore()) {
                best = result;
            }
        }
        return best != null ? best : TribeCompatibility.builder().userId(user.getId()).score(0).build();
    }

    /**
     * Pairwise swap search over existing-tribe placements. A pair is evaluated at most
     * once; a swap is committed when the two users' combined score in each other's tribe
     * beats their current combined score. Every assigned user already holds their best
     * tribe, so a swap can only commit when a member snapshot lists one of the swapped users.
     */
    private int optimizeAssignments(Map<String, TribeAssignment> assignments, Map<String, Profile> users,
                                    Map<String, Tribe> tribes, Map<String, List<Profile>> members,
                                    FormationOptions opts) {
        if (assignments.size() < 2) {
            return 0;
        }
        Set<Pair<String, String>> evaluated = new HashSet<>();
        int swaps = 0;
        boolean improved = true;
        int rounds = 0;
        while (improved && rounds < Constant.MAX_OPTIMIZATION_ROUNDS) {
            improved = false;
            rounds++;
            List<TribeAssignment> entries = new ArrayList<>(assignments.values());
            search:
            for (int i = 0; i < entries.size(); i++) {
                for (int j = i + 1; j < entries.size(); j++) {
                    TribeAssignment first = entries.get(i);
                    TribeAssignment second = entries.get(j);
                    if (first.tribeId().equals(second.tribeId())) {
                        continue;
                    }
                    if (!evaluated.add(Pair.of(first.userId(), second.userId()))) {
                        continue;
                    }
                    double firstSwapped = scoreIn(users.get(first.userId()), tribes.get(second.tribeId()),
                            members, second.userId(), opts);
                    double secondSwapped = scoreIn(users.get(second.userId()), tribes.get(first.tribeId()),
                            members, first.userId(), opts);
                    if (firstSwapped + secondSwapped > first.score() + second.score() + EPSILON) {
                        assignments.put(first.userId(), new TribeAssignment(first.userId(), second.tribeId(), firstSwapped));
                        assignments.put(second.userId(), new TribeAssignment(second.userId(), first.tribeId(), secondSwapped));
                        log.debug("Swapped userId={} to tribeId={} and userId={} to tribeId={}",
                                first.userId(), second.tribeId(), second.userId(), first.tribeId());
                        swaps++;
                        improved = true;
                        break search;
                    }
                }
            }
        }
        return swaps;
    }

    private double scoreIn(Profile user, Tribe tribe, Map<String, List<Profile>> members,
                           String excludedUserId, FormationOptions opts) {
        List<Profile> tribeMembers = members.getOrDefault(tribe.getId(), List.of()).stream()
                .filter(member -> !member.getId().equals(excludedUserId))
                .toList();
        return compatibilityService.tribeCompatibility(user, tribe, tribeMembers, opts.getWeights(), false).getScore();
    }

    private void verifyInvariants(List<Profile> pool, List<Tribe> tribes, Map<String, TribeAssignment> assignments,
                                  List<NewTribe> newTribes, FormationOptions opts) {
        List<String> violations = new ArrayList<>();

        Map<String, Integer> added = new HashMap<>();
        assignments.values().forEach(a -> added.merge(a.tribeId(), 1, Integer::sum));
        for (Tribe tribe : tribes) {
            int total = tribe.occupiedSeats() + added.getOrDefault(tribe.getId(), 0);
            if (added.containsKey(tribe.getId()) && total > tribe.getMaxMembers()) {
                violations.add("tribe " + tribe.getId() + " over capacity: " + total + "/" + tribe.getMaxMembers());
            }
        }

        for (NewTribe tribe : newTribes) {
            if (tribe.size() > opts.getMaxGroupSize()) {
                violations.add("new tribe of size " + tribe.size() + " above max " + opts.getMaxGroupSize());
            }
            if (tribe.size() < opts.getMinGroupSize() && !tribe.undersized()) {
                violations.add("new tribe of size " + tribe.size() + " below min without undersized flag");
            }
        }

        Set<String> seen = new HashSet<>();
        List<String> placed = new ArrayList<>(assignments.keySet());
        newTribes.forEach(tribe -> tribe.members().stream().map(MemberScore::userId).forEach(placed::add));
        for (String userId : placed) {
            if (!seen.add(userId)) {
                violations.add("user " + userId + " placed more than once");
            }
        }
        for (Profile user : pool) {
            if (!seen.contains(user.getId())) {
                violations.add("user " + user.getId() + " dropped");
            }
        }
        if (seen.size() != pool.size()) {
            violations.add("placed " + seen.size() + " users for " + pool.size() + " inputs");
        }

        if (!violations.isEmpty()) {
            meterRegistry.counter("matching_invariant_violations").increment();
            log.error("Matching invariants violated: {}", violations);
            throw new MatchingInvariantViolationException(violations);
        }
    }

    private static List<Profile> distinctUsers(List<Profile> users) {
        Map<String, Profile> distinct = new LinkedHashMap<>();
        if (users != null) {
            users.forEach(user -> distinct.putIfAbsent(user.getId(), user));
        }
        return new ArrayList<>(distinct.values());
    }

    private static FormationMetrics metrics(int total, Map<String, TribeAssignment> assignments,
                                            List<NewTribe> newTribes, int swaps) {
        int inNew = newTribes.stream().mapToInt(NewTribe::size).sum();
        int undersized = (int) newTribes.stream().filter(NewTribe::undersized).count();
        double scoreSum = assignments.values().stream().mapToDouble(TribeAssignment::score).sum()
                + newTribes.stream().flatMap(t -> t.members().stream()).mapToDouble(MemberScore::score).sum();
        double average = total == 0 ? 0.0 : scoreSum / total;
        return new FormationMetrics(total, assignments.size(), inNew, newTribes.size(), undersized, swaps, average);
    }
}
