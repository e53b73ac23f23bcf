package com.statute.ledger.registry;

import com.statute.ledger.core.model.Statute;
import com.statute.ledger.core.model.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Indexed collection of statutes, passed explicitly to whoever evaluates them.
 *
 * <p>Lifecycle: populated at startup, then {@link #freeze() frozen} and read-only. Iteration
 * follows insertion order. Reads and writes are synchronized, so a registry may be shared across
 * threads once built.</p>
 */
public class StatuteRegistry {
    private static final Logger log = LoggerFactory.getLogger(StatuteRegistry.class);

    private final Map<String, Statute> statutes = new LinkedHashMap<>();
    private final DuplicatePolicy duplicatePolicy;
    private volatile boolean frozen;

    public StatuteRegistry() {
        this(DuplicatePolicy.REJECT);
    }

    public StatuteRegistry(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy is required");
    }

    /**
     * Registers a statute.
     *
     * @throws InvalidStatuteException   if {@link Statute#validate()} reports issues
     * @throws DuplicateStatuteException if the id is taken and the policy refuses the replacement
     * @throws IllegalStateException     if the registry is frozen
     */
    public synchronized StatuteRegistry add(Statute statute) {
        Objects.requireNonNull(statute, "statute is required");
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot add statute " + statute.getId());
        }
        List<ValidationIssue> issues = statute.validate();
        if (!issues.isEmpty()) {
            throw new InvalidStatuteException(statute.getId(), issues);
        }

        Statute existing = statutes.get(statute.getId());
        if (existing == null) {
            statutes.put(statute.getId(), statute);
            log.debug("Registered statute {} v{}", statute.getId(), statute.getVersion());
            return this;
        }

        switch (duplicatePolicy) {
            case REJECT -> throw new DuplicateStatuteException(statute.getId(),
                    "Statute '" + statute.getId() + "' is already registered (v" + existing.getVersion() + ")");
            case REPLACE_NEWER_VERSION -> {
                if (statute.getVersion() <= existing.getVersion()) {
                    throw new DuplicateStatuteException(statute.getId(),
                            "Statute '" + statute.getId() + "' v" + statute.getVersion()
                                    + " does not supersede registered v" + existing.getVersion());
                }
                statutes.put(statute.getId(), statute);
                log.info("Replaced statute {} v{} with v{}",
                        statute.getId(), existing.getVersion(), statute.getVersion());
            }
        }
        return this;
    }

    public StatuteRegistry addAll(Iterable<Statute> toAdd) {
        toAdd.forEach(this::add);
        return this;
    }

    /**
     * Ends the startup phase. Further {@link #add} calls fail.
     */
    public synchronized StatuteRegistry freeze() {
        frozen = true;
        log.info("Statute registry frozen with {} statutes", size());
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public synchronized Optional<Statute> get(String id) {
        return Optional.ofNullable(statutes.get(id));
    }

    public synchronized boolean contains(String id) {
        return statutes.containsKey(id);
    }

    /**
     * All statutes in insertion order (immutable snapshot).
     */
    public synchronized List<Statute> all() {
        return List.copyOf(statutes.values());
    }

    /**
     * Statutes of one jurisdiction, in insertion order.
     */
    public synchronized List<Statute> byJurisdiction(String jurisdiction) {
        return statutes.values().stream()
                .filter(s -> s.getJurisdiction().map(jurisdiction::equals).orElse(false))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Statutes in force on the given date, in insertion order.
     */
    public synchronized List<Statute> activeAt(LocalDate date) {
        List<Statute> active = new ArrayList<>();
        for (Statute statute : statutes.values()) {
            if (statute.isActive(date)) {
                active.add(statute);
            }
        }
        return List.copyOf(active);
    }

    public synchronized int size() {
        return statutes.size();
    }
}
