package triage.core.model.ratelimit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One immutable generation of the rate limit policy.
 *
 * <p>The table is total: every {@code (SubjectClass, OperationType)} pair resolves to a
 * {@link Limit}. Tables are never mutated; a reload builds a new table and swaps it in.
 */
public final class PolicyTable {

    private final Map<SubjectClass, Map<OperationType, Limit>> limits;
    private final Limit defaultLimit;
    private final String version;
    private final String source;

    private PolicyTable(
            Map<SubjectClass, Map<OperationType, Limit>> limits, Limit defaultLimit, String version, String source) {
        this.limits = limits;
        this.defaultLimit = defaultLimit;
        this.version = version;
        this.source = source;
    }

    /**
     * Merge explicit entries over defaults into a total table.
     *
     * <p>For each pair the explicit entry wins, then the built-in entry for that exact pair,
     * then {@code globalDefault}.
     *
     * @param explicit entries from a policy document (may be partial)
     * @param builtIn built-in entries (may be partial)
     * @param globalDefault limit for pairs with no entry in either map
     * @param version policy version
     * @param source policy source
     * @return the merged table
     */
    public static PolicyTable merge(
            Map<SubjectClass, Map<OperationType, Limit>> explicit,
            Map<SubjectClass, Map<OperationType, Limit>> builtIn,
            Limit globalDefault,
            String version,
            String source) {
        Objects.requireNonNull(globalDefault, "globalDefault must not be null");

        final var merged = new EnumMap<SubjectClass, Map<OperationType, Limit>>(SubjectClass.class);
        for (final var subject : SubjectClass.values()) {
            final var explicitRow = explicit.getOrDefault(subject, Map.of());
            final var builtInRow = builtIn.getOrDefault(subject, Map.of());
            final var row = new EnumMap<OperationType, Limit>(OperationType.class);
            for (final var operation : OperationType.values()) {
                var limit = explicitRow.get(operation);
                if (limit == null) {
                    limit = builtInRow.get(operation);
                }
                row.put(operation, limit != null ? limit : globalDefault);
            }
            merged.put(subject, Collections.unmodifiableMap(row));
        }
        return new PolicyTable(Collections.unmodifiableMap(merged), globalDefault, version, source);
    }

    /**
     * Resolve the limit for a known pair.
     *
     * @param subject the subject class
     * @param operation the operation type
     * @return the limit, never null
     */
    public Limit resolve(SubjectClass subject, OperationType operation) {
        return limits.get(subject).get(operation);
    }

    /**
     * Resolve the limit for a possibly unrecognized pair.
     *
     * @param subject the subject class, empty if unrecognized
     * @param operation the operation type, empty if unrecognized
     * @return the pair's limit, or the global default when either side is unrecognized
     */
    public Limit resolve(Optional<SubjectClass> subject, Optional<OperationType> operation) {
        if (subject.isEmpty() || operation.isEmpty()) {
            return defaultLimit;
        }
        return resolve(subject.get(), operation.get());
    }

    /**
     * Return a new table with {@code transform} applied to every limit, including the default.
     *
     * @param transform the limit transformation
     * @return the transformed table
     */
    public PolicyTable mapLimits(UnaryOperator<Limit> transform) {
        final var mapped = new EnumMap<SubjectClass, Map<OperationType, Limit>>(SubjectClass.class);
        limits.forEach((subject, row) -> {
            final var mappedRow = new EnumMap<OperationType, Limit>(OperationType.class);
            row.forEach((operation, limit) -> mappedRow.put(operation, transform.apply(limit)));
            mapped.put(subject, Collections.unmodifiableMap(mappedRow));
        });
        return new PolicyTable(
                Collections.unmodifiableMap(mapped), transform.apply(defaultLimit), version, source);
    }

    public Limit defaultLimit() {
        return defaultLimit;
    }

    public String version() {
        return version;
    }

    public String source() {
        return source;
    }
}
