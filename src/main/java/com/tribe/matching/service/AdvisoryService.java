package com.tribe.matching.service;

import com.tribe.matching.client.AdvisoryClient;
import com.tribe.matching.config.AdvisoryProperties;
import com.tribe.matching.dto.AdvisoryResult;
import com.tribe.matching.dto.AdvisoryScore;
import com.tribe.matching.dto.CompatibilityRecords.InterestCompatibility;
import com.tribe.matching.dto.CompatibilityRecords.PersonalityCompatibility;
import com.tribe.matching.dto.FormationAdvice;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.dto.TribeAssignment;
import com.tribe.matching.models.Profile;
import com.tribe.matching.processors.AdvisoryPromptBuilder;
import com.tribe.matching.processors.AdvisoryResponseParser;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point to the advisory client. Calls run on their own executor, are cut
 * off after the configured timeout and pass through a circuit breaker. Every failure
 * is logged, counted and turned into an empty result; nothing propagates to the caller.
 */
@Slf4j
@Service
public class AdvisoryService {
    private final AdvisoryClient advisoryClient;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService advisoryExecutor;
    private final MeterRegistry meterRegistry;
    private final long timeoutMillis;

    public AdvisoryService(
            AdvisoryClient advisoryClient,
            CircuitBreaker advisoryCircuitBreaker,
            @Qualifier("advisoryExecutor") ExecutorService advisoryExecutor,
            MeterRegistry meterRegistry,
            AdvisoryProperties properties) {
        this.advisoryClient = advisoryClient;
        this.circuitBreaker = advisoryCircuitBreaker;
        this.advisoryExecutor = advisoryExecutor;
        this.meterRegistry = meterRegistry;
        this.timeoutMillis = properties.getTimeoutMillis();
    }

    public boolean isAvailable() {
        return advisoryClient.isEnabled();
    }

    public Optional<AdvisoryScore> scorePair(Profile a, Profile b,
                                             PersonalityCompatibility personality,
                                             InterestCompatibility interests) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        String prompt = AdvisoryPromptBuilder.pairPrompt(a, b, personality, interests);
        Optional<AdvisoryScore> score = ask(prompt, "pair_score").flatMap(AdvisoryResponseParser::parseScore);
        if (score.isEmpty()) {
            log.debug("No advisory score for userId={}, targetUserId={}", a.getId(), b.getId());
        }
        return score;
    }

    public FormationAdvice adviseFormation(Collection<Profile> users,
                                           Map<String, TribeAssignment> existingAssignments,
                                           List<NewTribe> newTribes) {
        if (!isAvailable()) {
            return FormationAdvice.unavailable();
        }
        String prompt = AdvisoryPromptBuilder.formationPrompt(users, existingAssignments, newTribes);
        return ask(prompt, "formation_advice")
                .map(AdvisoryResponseParser::parseFormationAdvice)
                .orElseGet(FormationAdvice::unavailable);
    }

    private Optional<String> ask(String prompt, String operation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            AdvisoryResult result = CompletableFuture
                    .supplyAsync(() -> circuitBreaker.executeSupplier(() -> advisoryClient.scoreText(prompt)), advisoryExecutor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .join();
            return Optional.ofNullable(result).map(AdvisoryResult::text);
        } catch (CompletionException e) {
            outcome = "failure";
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Advisory {} failed or timed out: {}, using algorithmic result", operation, cause.toString());
            meterRegistry.counter("advisory_failures", "operation", operation,
                    "reason", cause.getClass().getSimpleName()).increment();
            return Optional.empty();
        } catch (RejectedExecutionException e) {
            outcome = "rejected";
            log.warn("Advisory {} rejected, executor saturated", operation);
            meterRegistry.counter("advisory_failures", "operation", operation, "reason", "Rejected").increment();
            return Optional.empty();
        } finally {
            sample.stop(meterRegistry.timer("advisory_call_duration", "operation", operation, "outcome", outcome));
        }
    }
}
