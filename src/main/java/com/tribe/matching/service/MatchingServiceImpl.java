package com.tribe.matching.service;

import com.tribe.matching.async.AssignmentPublisher;
import com.tribe.matching.dto.FactorWeights;
import com.tribe.matching.dto.FormationAdvice;
import com.tribe.matching.dto.FormationMetrics;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.FormationResult;
import com.tribe.matching.dto.MatchingOutcome;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.dto.RankedMatch;
import com.tribe.matching.dto.RankedResult;
import com.tribe.matching.dto.TribeCompatibility;
import com.tribe.matching.dto.UserCompatibility;
import com.tribe.matching.dto.enums.ItemStatus;
import com.tribe.matching.dto.enums.TargetType;
import com.tribe.matching.dto.events.AdvisorySuggestionEvent;
import com.tribe.matching.dto.events.ExistingTribeAssignmentEvent;
import com.tribe.matching.dto.events.MatchingEvent;
import com.tribe.matching.dto.events.NewTribeFormedEvent;
import com.tribe.matching.dto.events.OpaqueMatchingEvent;
import com.tribe.matching.exceptions.BadRequestException;
import com.tribe.matching.exceptions.InternalServerErrorException;
import com.tribe.matching.exceptions.ResourceNotFoundException;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import com.tribe.matching.repo.ProfileStore;
import com.tribe.matching.utils.basic.Constant;
import com.tribe.matching.utils.basic.RunIdentifiers;
import com.tribe.matching.utils.basic.MetricsUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
@Service
public class MatchingServiceImpl implements MatchingService {
    private final ProfileStore profileStore;
    private final CompatibilityService compatibilityService;
    private final TribeFormationService tribeFormationService;
    private final AssignmentPublisher assignmentPublisher;
    private final FormationOptions defaultOptions;
    private final MeterRegistry meterRegistry;
    private final ExecutorService storeExecutor;
    private final long storeTimeoutMillis;

    public MatchingServiceImpl(
            ProfileStore profileStore,
            CompatibilityService compatibilityService,
            TribeFormationService tribeFormationService,
            AssignmentPublisher assignmentPublisher,
            FormationOptions defaultFormationOptions,
            MeterRegistry meterRegistry,
            @Qualifier("profileStoreExecutor") ExecutorService storeExecutor,
            @Value("${matching.store.timeout-millis:2000}") long storeTimeoutMillis) {
        this.profileStore = profileStore;
        this.compatibilityService = compatibilityService;
        this.tribeFormationService = tribeFormationService;
        this.assignmentPublisher = assignmentPublisher;
        this.defaultOptions = defaultFormationOptions;
        this.meterRegistry = meterRegistry;
        this.storeExecutor = storeExecutor;
        this.storeTimeoutMillis = storeTimeoutMillis;
    }

    @Override
    public RankedResult scoreUsers(String userId, List<String> candidateIds, FactorWeights weights, boolean includeDetails) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Profile user = requireProfile(userId);
        Map<String, ItemStatus> statuses = new LinkedHashMap<>();
        List<Profile> candidates = resolve(candidateIds, statuses, "load_profile", profileStore::loadProfile, userId);

        List<UserCompatibility> scored = new ArrayList<>(
                compatibilityService.batchUserCompatibility(user, candidates, weights, includeDetails));
        scored.sort(Comparator.comparingDouble(UserCompatibility::getScore).reversed());
        List<RankedMatch> matches = scored.stream()
                .map(r -> new RankedMatch(r.getTargetUserId(), TargetType.USER, r.getScore(), r.getDetails()))
                .toList();

        recordStatuses("score_users", statuses);
        sample.stop(meterRegistry.timer("matching_request_duration", Constant.MODE, "score_users"));
        log.info("Scored userId={} against {} candidates, notFound={}, rejected={}, failed={}", userId, matches.size(),
                count(statuses, ItemStatus.NOT_FOUND), count(statuses, ItemStatus.REJECTED), count(statuses, ItemStatus.FAILED));
        return RankedResult.builder().userId(userId).matches(matches).itemStatuses(statuses).build();
    }

    @Override
    public RankedResult scoreTribes(String userId, List<String> candidateTribeIds, FactorWeights weights, boolean includeDetails) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Profile user = requireProfile(userId);
        Map<String, ItemStatus> statuses = new LinkedHashMap<>();
        List<Tribe> tribes = resolve(candidateTribeIds, statuses, "load_tribe", profileStore::loadTribe, null);

        Map<String, List<Profile>> members = new LinkedHashMap<>();
        tribes.forEach(tribe -> members.put(tribe.getId(), loadMembers(tribe.getId())));
        List<TribeCompatibility> scored = new ArrayList<>(
                compatibilityService.batchTribeCompatibility(user, tribes, members, weights, includeDetails));
        scored.sort(Comparator.comparingDouble(TribeCompatibility::getScore).reversed());
        List<RankedMatch> matches = scored.stream()
                .map(r -> new RankedMatch(r.getTribeId(), TargetType.TRIBE, r.getScore(), r.getDetails()))
                .toList();

        recordStatuses("score_tribes", statuses);
        sample.stop(meterRegistry.timer("matching_request_duration", Constant.MODE, "score_tribes"));
        log.info("Scored userId={} against {} tribes, notFound={}, rejected={}, failed={}", userId, matches.size(),
                count(statuses, ItemStatus.NOT_FOUND), count(statuses, ItemStatus.REJECTED), count(statuses, ItemStatus.FAILED));
        return RankedResult.builder().userId(userId).matches(matches).itemStatuses(statuses).build();
    }

    @Override
    public MatchingOutcome formTribes(List<String> userIds, List<Tribe> existingTribes,
                                      Map<String, List<Profile>> memberProfiles, FormationOptions options) {
        List<Tribe> tribes = existingTribes != null ? existingTribes : loadTribesWithCapacity(null);
        return formFromIds(userIds, tribes, memberProfiles, options);
    }

    @Override
    public MatchingOutcome formTribesInRegion(List<String> userIds, String region, FormationOptions options) {
        return formFromIds(userIds, loadTribesWithCapacity(region), null, options);
    }

    @Override
    public MatchingOutcome formTribesFromSnapshot(List<Profile> users, List<Tribe> existingTribes,
                                                  Map<String, List<Profile>> memberProfiles, FormationOptions options) {
        FormationOptions opts = effective(options);
        Map<String, ItemStatus> statuses = new LinkedHashMap<>();
        List<Profile> accepted = new ArrayList<>();
        for (Profile user : users) {
            if (statuses.containsKey(user.getId())) {
                continue;
            }
            if (accepted.size() >= opts.getMaxBatchSize()) {
                statuses.put(user.getId(), ItemStatus.REJECTED);
                continue;
            }
            statuses.put(user.getId(), ItemStatus.OK);
            accepted.add(user);
        }
        return run(accepted, existingTribes, memberProfiles, opts, statuses);
    }

    private MatchingOutcome formFromIds(List<String> userIds, List<Tribe> tribes,
                                        Map<String, List<Profile>> memberProfiles, FormationOptions options) {
        FormationOptions opts = effective(options);
        Map<String, ItemStatus> statuses = new LinkedHashMap<>();
        List<Profile> users = resolve(userIds, statuses, "load_profile", profileStore::loadProfile, null, opts.getMaxBatchSize());

        Map<String, List<Profile>> members = new LinkedHashMap<>();
        if (memberProfiles != null) {
            members.putAll(memberProfiles);
        }
        for (Tribe tribe : tribes) {
            members.computeIfAbsent(tribe.getId(), this::loadMembers);
        }
        return run(users, tribes, members, opts, statuses);
    }

    private MatchingOutcome run(List<Profile> users, List<Tribe> tribes, Map<String, List<Profile>> members,
                                FormationOptions opts, Map<String, ItemStatus> statuses) {
        String runId = RunIdentifiers.newRunId();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Formation run started runId={}, users={}, tribes={}", runId, users.size(), tribes == null ? 0 : tribes.size());

        FormationResult result = tribeFormationService.formTribes(users, tribes, members, opts);
        publishResult(runId, result);

        recordStatuses("form_tribes", statuses);
        sample.stop(meterRegistry.timer("matching_request_duration", Constant.MODE, "form_tribes"));
        return MatchingOutcome.builder().runId(runId).result(result).itemStatuses(statuses).build();
    }

    private void publishResult(String runId, FormationResult result) {
        LocalDateTime now = RunIdentifiers.nowUtc();
        result.getExistingAssignments().values().forEach(assignment -> {
            MetricsUtils.recordScore(meterRegistry, "assignment", assignment.score());
            publish(new ExistingTribeAssignmentEvent(runId, assignment.userId(), assignment.tribeId(), assignment.score(), now));
        });

        List<NewTribe> newTribes = result.getNewTribes();
        for (int i = 0; i < newTribes.size(); i++) {
            NewTribe tribe = newTribes.get(i);
            publish(new NewTribeFormedEvent(runId, RunIdentifiers.provisionalTribeId(i + 1), tribe.members(),
                    tribe.averageCompatibility(), tribe.undersized(), now));
        }

        FormationAdvice advice = result.getAdvice();
        if (advice != null && advice.available()) {
            publish(new AdvisorySuggestionEvent(runId, advice.insights(), advice.adjustments(), now));
        }

        FormationMetrics metrics = result.getMetrics();
        if (metrics != null) {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("totalUsers", String.valueOf(metrics.totalUsers()));
            payload.put("assignedToExisting", String.valueOf(metrics.assignedToExisting()));
            payload.put("placedInNewTribes", String.valueOf(metrics.placedInNewTribes()));
            payload.put("newTribes", String.valueOf(metrics.newTribes()));
            payload.put("undersizedTribes", String.valueOf(metrics.undersizedTribes()));
            payload.put("swapsApplied", String.valueOf(metrics.swapsApplied()));
            payload.put("averageScore", String.format(Locale.ROOT, "%.2f", metrics.averageScore()));
            publish(new OpaqueMatchingEvent(runId, "formation_summary", payload, now));
        }
    }

    private void publish(MatchingEvent event) {
        try {
            assignmentPublisher.publish(event);
        } catch (RuntimeException e) {
            log.error("Publishing event kind={} failed for runId={}: {}", event.kind(), event.runId(), e.getMessage());
            meterRegistry.counter("matching_event_publish_failures", "kind", event.kind()).increment();
        }
    }

    private Profile requireProfile(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("userId is required");
        }
        Optional<Profile> profile = callStore("load_profile", userId, () -> profileStore.loadProfile(userId), null);
        if (profile == null) {
            throw new InternalServerErrorException("Profile store unavailable for userId " + userId);
        }
        return profile.orElseThrow(() -> new ResourceNotFoundException("Profile", userId));
    }

    private <T> List<T> resolve(List<String> ids, Map<String, ItemStatus> statuses, String operation,
                                Function<String, Optional<T>> loader, String excludedId) {
        return resolve(ids, statuses, operation, loader, excludedId, defaultOptions.getMaxBatchSize());
    }

    /**
     * Loads ids in order. Ids past {@code maxBatchSize}, repeats and {@code excludedId} are
     * REJECTED, unknown ids NOT_FOUND, and ids whose lookup threw or timed out FAILED.
     */
    private <T> List<T> resolve(List<String> ids, Map<String, ItemStatus> statuses, String operation,
                                Function<String, Optional<T>> loader, String excludedId, int maxBatchSize) {
        List<T> loaded = new ArrayList<>();
        if (ids == null) {
            return loaded;
        }
        int accepted = 0;
        for (String id : ids) {
            if (id == null || statuses.containsKey(id)) {
                continue;
            }
            if (id.equals(excludedId) || accepted >= maxBatchSize) {
                statuses.put(id, ItemStatus.REJECTED);
                continue;
            }
            accepted++;
            Optional<T> item = callStore(operation, id, () -> loader.apply(id), null);
            if (item == null) {
                statuses.put(id, ItemStatus.FAILED);
            } else if (item.isPresent()) {
                statuses.put(id, ItemStatus.OK);
                loaded.add(item.get());
            } else {
                statuses.put(id, ItemStatus.NOT_FOUND);
            }
        }
        return loaded;
    }

    private List<Profile> loadMembers(String tribeId) {
        return callStore("load_members", tribeId, () -> profileStore.loadMemberProfiles(tribeId), List.of());
    }

    private List<Tribe> loadTribesWithCapacity(String region) {
        return callStore("load_tribes", region == null ? "*" : region,
                () -> profileStore.loadTribesWithCapacity(region), List.of());
    }

    /**
     * Runs one store lookup on the store executor, bounded by the store timeout. A lookup
     * that fails or times out yields {@code fallback}.
     */
    private <T> T callStore(String operation, String key, Supplier<T> call, T fallback) {
        try {
            T value = CompletableFuture.supplyAsync(call, storeExecutor)
                    .orTimeout(storeTimeoutMillis, TimeUnit.MILLISECONDS)
                    .join();
            return value != null ? value : fallback;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Profile store {} failed for key={}: {}", operation, key, cause.toString());
            meterRegistry.counter("profile_store_failures", "operation", operation,
                    "reason", cause.getClass().getSimpleName()).increment();
            return fallback;
        } catch (RejectedExecutionException e) {
            log.warn("Profile store {} rejected for key={}, executor saturated", operation, key);
            meterRegistry.counter("profile_store_failures", "operation", operation, "reason", "Rejected").increment();
            return fallback;
        }
    }

    private FormationOptions effective(FormationOptions options) {
        return (options != null ? options : defaultOptions).sanitized();
    }

    private void recordStatuses(String mode, Map<String, ItemStatus> statuses) {
        for (ItemStatus status : ItemStatus.values()) {
            MetricsUtils.countItems(meterRegistry, "matching_requests_total", mode, status.name().toLowerCase(Locale.ROOT),
                    count(statuses, status));
        }
    }

    private static int count(Map<String, ItemStatus> statuses, ItemStatus status) {
        return (int) statuses.values().stream().filter(s -> s == status).count();
    }
}
