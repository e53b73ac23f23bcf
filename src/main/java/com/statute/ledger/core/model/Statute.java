package com.statute.ledger.core.model;

import com.statute.ledger.condition.ConditionNode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An identified, versioned legal rule.
 *
 * <p>Preconditions are implicitly conjoined and kept in declaration order. When they all hold,
 * the {@link Effect} applies, unless {@code discretionLogic} is set, in which case a human must
 * decide. Instances are immutable; a new version replaces the old one rather than mutating it.</p>
 */
public final class Statute {

    private static final Pattern VALID_ID = Pattern.compile("\\p{L}[\\p{L}\\p{N}_-]*");

    private final String id;
    private final String title;
    private final String jurisdiction;
    private final int version;
    private final List<ConditionNode> preconditions;
    private final Effect effect;
    private final String discretionLogic;
    private final TemporalValidity temporalValidity;

    private Statute(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.jurisdiction = builder.jurisdiction;
        this.version = builder.version;
        this.preconditions = List.copyOf(builder.preconditions);
        this.effect = builder.effect;
        this.discretionLogic = builder.discretionLogic;
        this.temporalValidity = builder.temporalValidity;
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public Optional<String> getJurisdiction() { return Optional.ofNullable(jurisdiction); }
    public int getVersion() { return version; }
    public List<ConditionNode> getPreconditions() { return preconditions; }
    public Effect getEffect() { return effect; }
    public Optional<String> getDiscretionLogic() { return Optional.ofNullable(discretionLogic); }
    public TemporalValidity getTemporalValidity() { return temporalValidity; }

    public boolean isActive(LocalDate asOf) {
        return temporalValidity.isActive(asOf);
    }

    /**
     * Checks the statute for authoring mistakes that the builder does not reject outright.
     *
     * @return the issues found, empty when the statute is well formed
     */
    public List<ValidationIssue> validate() {
        List<ValidationIssue> issues = new ArrayList<>();
        if (!VALID_ID.matcher(id).matches()) {
            issues.add(new ValidationIssue(ValidationIssue.Code.INVALID_ID,
                    "Invalid statute ID: '" + id + "' (must start with a letter, contain only letters, digits, '-' or '_')"));
        }
        if (!temporalValidity.isConsistent()) {
            issues.add(new ValidationIssue(ValidationIssue.Code.EXPIRY_BEFORE_EFFECTIVE,
                    "Expiry date (" + temporalValidity.expiryDate() + ") cannot be before effective date ("
                            + temporalValidity.effectiveDate() + ")"));
        }
        if (effect.description().isBlank()) {
            issues.add(new ValidationIssue(ValidationIssue.Code.EMPTY_EFFECT_DESCRIPTION,
                    "Effect description cannot be empty"));
        }
        return issues;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Statute that = (Statute) o;
        return version == that.version &&
                id.equals(that.id) &&
                title.equals(that.title) &&
                Objects.equals(jurisdiction, that.jurisdiction) &&
                preconditions.equals(that.preconditions) &&
                effect.equals(that.effect) &&
                Objects.equals(discretionLogic, that.discretionLogic) &&
                temporalValidity.equals(that.temporalValidity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Statute{" +
                "id='" + id + '\'' +
                ", version=" + version +
                ", jurisdiction='" + jurisdiction + '\'' +
                ", preconditions=" + preconditions.size() +
                ", discretion=" + (discretionLogic != null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String jurisdiction;
        private int version = 1;
        private final List<ConditionNode> preconditions = new ArrayList<>();
        private Effect effect;
        private String discretionLogic;
        private TemporalValidity temporalValidity = TemporalValidity.unbounded();

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder jurisdiction(String jurisdiction) { this.jurisdiction = jurisdiction; return this; }
        public Builder version(int version) { this.version = version; return this; }
        public Builder effect(Effect effect) { this.effect = effect; return this; }
        public Builder discretion(String discretionLogic) { this.discretionLogic = discretionLogic; return this; }
        public Builder temporalValidity(TemporalValidity temporalValidity) { this.temporalValidity = temporalValidity; return this; }

        public Builder precondition(ConditionNode condition) {
            preconditions.add(Objects.requireNonNull(condition, "condition is required"));
            return this;
        }

        public Builder preconditions(List<ConditionNode> conditions) {
            conditions.forEach(this::precondition);
            return this;
        }

        public Statute build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title must not be blank");
            }
            if (effect == null) {
                throw new IllegalArgumentException("effect is required");
            }
            if (version < 1) {
                throw new IllegalArgumentException("version must be >= 1");
            }
            if (temporalValidity == null) {
                temporalValidity = TemporalValidity.unbounded();
            }
            return new Statute(this);
        }
    }
}
