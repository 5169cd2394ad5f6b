package com.governance.core.model.statemachine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lookup tables translating external tracker signals to canonical states and back.
 *
 * Entries whose value was explicitly null in the source document are simply absent:
 * an absent entry means "no mapping", never a default state.
 */
public record ExternalStatusMapping(
    Map<ExternalSource, Map<String, String>> inbound,
    Map<ExternalSource, Set<String>> doneSignals,
    Map<String, StateLabels> outboundLabels,
    Map<String, CheckRequirements> checks
) {
    public ExternalStatusMapping {
        Map<ExternalSource, Map<String, String>> inboundCopy = new EnumMap<>(ExternalSource.class);
        inbound.forEach((source, table) -> inboundCopy.put(source, Map.copyOf(table)));
        inbound = Map.copyOf(inboundCopy);

        Map<ExternalSource, Set<String>> doneCopy = new EnumMap<>(ExternalSource.class);
        doneSignals.forEach((source, signals) -> doneCopy.put(source, Set.copyOf(signals)));
        doneSignals = Map.copyOf(doneCopy);

        outboundLabels = Map.copyOf(outboundLabels);
        checks = Map.copyOf(checks);
    }

    public Optional<String> lookup(ExternalSource source, String externalStatus) {
        return Optional.ofNullable(inbound.getOrDefault(source, Map.of()).get(externalStatus));
    }

    public boolean isDoneSignal(ExternalSource source, String externalStatus) {
        return doneSignals.getOrDefault(source, Set.of()).contains(externalStatus);
    }

    /**
     * External labels applied when an item enters a state.
     */
    public record StateLabels(String primary, List<String> additional) {
        public StateLabels {
            additional = additional == null ? List.of() : List.copyOf(additional);
        }

        public List<String> all() {
            if (primary == null) {
                return additional;
            }
            return Stream.concat(Stream.of(primary), additional.stream()).toList();
        }
    }

    /**
     * CI checks a state expects before it can be left.
     */
    public record CheckRequirements(List<String> required, List<String> optional) {
        public CheckRequirements {
            required = required == null ? List.of() : List.copyOf(required);
            optional = optional == null ? List.of() : List.copyOf(optional);
        }
    }
}
