package com.tribe.matching.matcher.strategies;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class GroupSwapStrategyContext {
    private final List<GroupSwapStrategy> strategies;

    public GroupSwapStrategy resolve(String mode) {
        return strategies.stream()
                .filter(strategy -> strategy.supports(mode))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported swap pass: " + mode));
    }
}
