package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One component measured against its acceptance threshold.
 *
 * @param value                  Raw value (signage and accessibility as fractions)
 * @param benchmark              Maximum for penalties, minimum for bonuses
 * @param meetsStandard          Whether the value is on the acceptable side of the threshold
 * @param percentageOfBenchmark  {@code value / benchmark * 100}
 */
public record BenchmarkCheck(
        @JsonProperty("value") double value,
        @JsonProperty("benchmark") double benchmark,
        @JsonProperty("meets_standard") boolean meetsStandard,
        @JsonProperty("percentage_of_benchmark") double percentageOfBenchmark) {
}
