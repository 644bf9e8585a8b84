package com.shipAgent.geck.dedup.model;

import com.shipAgent.geck.dedup.exception.InvalidStrategyException;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Policy for choosing which member of a duplicate group survives.
 */
public enum DedupStrategy {
    
    /**
     * Most recently updated (or created) record wins.
     */
    KEEP_NEWEST("keep-newest"),
    
    /**
     * Earliest created record wins.
     */
    KEEP_OLDEST("keep-oldest"),
    
    /**
     * Most recent import-sourced record wins; without one, behaves like {@link #KEEP_NEWEST}.
     */
    KEEP_IMPORT("keep-import");
    
    public static final DedupStrategy DEFAULT = KEEP_NEWEST;
    
    private final String value;
    
    DedupStrategy(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Resolves a wire value. Null or blank selects {@link #DEFAULT}.
     * 
     * @throws InvalidStrategyException for any other unrecognized value
     */
    public static DedupStrategy fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return DEFAULT;
        }
        String trimmed = value.trim();
        for (DedupStrategy strategy : values()) {
            if (strategy.value.equals(trimmed)) {
                return strategy;
            }
        }
        throw new InvalidStrategyException("Unknown strategy '" + value + "', expected one of: "
                + Arrays.stream(values()).map(DedupStrategy::getValue).collect(Collectors.joining(", ")));
    }
}
