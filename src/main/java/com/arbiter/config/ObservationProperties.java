package com.arbiter.config;

import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Admissibility rules for observed primitives.
 *
 * <p>Properties prefix: {@code arbiter.observation.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "arbiter.observation")
public class ObservationProperties {

    /** Primitive names every symbol observation must carry. Empty = only a mark price is required. */
    private List<String> requiredPrimitives = new ArrayList<>();

    /** Maximum age of an observation relative to the cycle timestamp. */
    @Min(1)
    private long maxPrimitiveAgeMs = 5_000;

    /** Observations kept per symbol in the primitive window store. */
    @Min(1)
    private int windowCapacity = 64;

    /** Extra terms added to the built-in interpretation vocabulary. */
    private List<String> forbiddenTerms = new ArrayList<>();
}
