package com.tribe.matching.service;

import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.MemberScore;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.matcher.GroupSwapOptimizer;
import com.tribe.matching.matcher.PairwiseCompatibilityMatrix;
import com.tribe.matching.matcher.PersonalityGroupRefiner;
import com.tribe.matching.matcher.ProximityGrouper;
import com.tribe.matching.matcher.strategies.GroupSwapStrategyContext;
import com.tribe.matching.models.Profile;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
public class ClusteringServiceImpl implements ClusteringService {
    private final ProximityGrouper proximityGrouper;
    private final PersonalityGroupRefiner refiner;
    private final GroupSwapOptimizer swapOptimizer;
    private final GroupSwapStrategyContext strategyContext;
    private final CompatibilityService compatibilityService;
    private final ExecutorService compatibilityExecutor;
    private final MeterRegistry meterRegistry;
    private final List<String> swapPasses;

    public ClusteringServiceImpl(
            ProximityGrouper proximityGrouper,
            PersonalityGroupRefiner refiner,
            GroupSwapOptimizer swapOptimizer,
            GroupSwapStrategyContext strategyContext,
            CompatibilityService compatibilityService,
            @Qualifier("compatibilityExecutor") ExecutorService compatibilityExecutor,
            MeterRegistry meterRegistry,
            @Value("${matching.clustering.swap-passes:InterestCohesion,PersonalityBalance}") List<String> swapPasses) {
        this.proximityGrouper = proximityGrouper;
        this.refiner = refiner;
        this.swapOptimizer = swapOptimizer;
        this.strategyContext = strategyContext;
        this.compatibilityService = compatibilityService;
        this.compatibilityExecutor = compatibilityExecutor;
        this.meterRegistry = meterRegistry;
        this.swapPasses = swapPasses;
    }

    @Override
    public List<NewTribe> formGroups(List<Profile> users, FormationOptions options) {
        if (users.isEmpty()) {
            return List.of();
        }
        FormationOptions opts = options.sanitized();
        Timer.Sample sample = Timer.start(meterRegistry);

        PairwiseCompatibilityMatrix matrix = new PairwiseCompatibilityMatrix((a, b) ->
                compatibilityService.algorithmicUserCompatibility(a, b, opts.getWeights(), false).getScore());

        List<List<Profile>> proximityGroups = proximityGrouper.group(users, opts.getMaxDistance());
        log.info("Clustering {} users: proximityGroups={}, maxDistance={}", users.size(), proximityGroups.size(), opts.getMaxDistance());
        for (List<Profile> group : proximityGroups) {
            if (group.size() > opts.getMaxGroupSize()) {
                matrix.prefill(group, compatibilityExecutor);
            }
        }

        List<List<Profile>> groups = refiner.refine(proximityGroups, matrix, opts);
        for (String pass : swapPasses) {
            GroupSwapOptimizer.SwapOutcome outcome = swapOptimizer.optimize(
                    groups, strategyContext.resolve(pass.trim()), opts.getMinGroupSize(), opts.getMaxDistance());
            groups = outcome.groups();
            meterRegistry.counter("clustering_swaps_total", "pass", pass.trim()).increment(outcome.swaps());
        }

        List<NewTribe> tribes = new ArrayList<>();
        for (List<Profile> group : groups) {
            if (group.size() > 1) {
                matrix.prefill(group, compatibilityExecutor);
            }
            List<MemberScore> members = group.stream()
                    .map(member -> new MemberScore(member.getId(), matrix.meanScoreWithin(member, group)))
                    .toList();
            double average = members.stream().mapToDouble(MemberScore::score).average().orElse(0.0);
            tribes.add(new NewTribe(members, average, group.size() < opts.getMinGroupSize()));
        }

        long undersized = tribes.stream().filter(NewTribe::undersized).count();
        if (undersized > 0) {
            log.warn("Clustering left {} undersized groups out of {}", undersized, tribes.size());
        }
        sample.stop(meterRegistry.timer("clustering_duration"));
        log.info("Clustering finished: users={}, groups={}, undersized={}, pairScores={}",
                users.size(), tribes.size(), undersized, matrix.size());
        return tribes;
    }
}
