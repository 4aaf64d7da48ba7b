package com.vmsentinel.core.rules;

import com.vmsentinel.core.error.RuleNotFoundException;
import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.RuleUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Named collection of {@link AlertRule}s plus the metadata the classifier needs
 * to turn fired alerts into a status.
 *
 * <h3>Ordering</h3>
 * <p>
 * {@link #rules()} returns rules in insertion order; alerts are emitted in the
 * same order.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A single instance may be shared by many evaluating threads while another
 * thread updates it. The rule map is guarded by a read/write lock and rules are
 * immutable, so {@link #rules()} always returns a consistent snapshot and a
 * reader never observes a half-applied {@link #updateRule(String, RuleUpdate)}.
 * The overload/underload metadata is fixed at construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSet {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSet.class);

    /** Number of underload alerts that must fire together by default. */
    public static final int DEFAULT_UNDERLOAD_QUORUM = 3;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AlertRule> rules;
    private final Set<String> overloadMetrics;
    private final Set<String> underloadMetrics;
    private final int underloadQuorum;

    private RuleSet(Builder builder) {
        this.rules = new LinkedHashMap<>(builder.rules);
        this.overloadMetrics = Set.copyOf(builder.overloadMetrics);
        this.underloadMetrics = Set.copyOf(builder.underloadMetrics);
        this.underloadQuorum = builder.underloadQuorum;
    }

    /**
     * @return a new rule set seeded with the default catalogue
     * @see DefaultRules
     */
    public static RuleSet defaults() {
        return DefaultRules.ruleSet();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @return snapshot of all rules in insertion order
     */
    public List<AlertRule> rules() {
        lock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AlertRule> rule(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rules.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return metrics whose critical alerts mark the entity as overloaded
     */
    public Set<String> overloadMetrics() {
        return overloadMetrics;
    }

    /**
     * @return metrics whose warning alerts count towards the underload quorum
     */
    public Set<String> underloadMetrics() {
        return underloadMetrics;
    }

    /**
     * @return number of underload warnings that must fire together for an
     *         underloaded status
     */
    public int underloadQuorum() {
        return underloadQuorum;
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Apply a partial update to one rule. Fields absent from {@code update}
     * keep their current values.
     *
     * @param name   rule name
     * @param update fields to change; must not be {@code null}
     * @return the rule after the update
     * @throws RuleNotFoundException if no rule has that name
     * @throws IllegalStateException if the update would make the rule invalid;
     *                               the rule set is left unchanged
     */
    public AlertRule updateRule(String name, RuleUpdate update) {
        Objects.requireNonNull(update, "RuleUpdate must not be null");
        lock.writeLock().lock();
        try {
            AlertRule current = rules.get(name);
            if (current == null) {
                throw new RuleNotFoundException(name);
            }
            AlertRule updated = current.withUpdate(update);
            rules.put(name, updated);
            LOG.info("Rule [{}] updated: {}", name, update);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "RuleSet{rules=" + rules().size()
                + ", overloadMetrics=" + overloadMetrics
                + ", underloadMetrics=" + underloadMetrics
                + ", underloadQuorum=" + underloadQuorum + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuleSet}. Rule names must be unique.
     */
    public static class Builder {
        private final Map<String, AlertRule> rules = new LinkedHashMap<>();
        private final Set<String> overloadMetrics = new LinkedHashSet<>();
        private final Set<String> underloadMetrics = new LinkedHashSet<>();
        private int underloadQuorum = DEFAULT_UNDERLOAD_QUORUM;

        /**
         * @param rule rule to append
         * @return this builder
         * @throws IllegalArgumentException if a rule with the same name was already added
         */
        public Builder rule(AlertRule rule) {
            Objects.requireNonNull(rule, "AlertRule must not be null");
            if (rules.putIfAbsent(rule.getName(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule name: '" + rule.getName() + "'");
            }
            return this;
        }

        public Builder rules(Collection<AlertRule> rules) {
            rules.forEach(this::rule);
            return this;
        }

        public Builder overloadMetrics(Collection<String> metrics) {
            overloadMetrics.addAll(metrics);
            return this;
        }

        public Builder underloadMetrics(Collection<String> metrics) {
            underloadMetrics.addAll(metrics);
            return this;
        }

        public Builder underloadQuorum(int underloadQuorum) {
            this.underloadQuorum = underloadQuorum;
            return this;
        }

        /**
         * @return the rule set
         * @throws IllegalArgumentException if {@code underloadQuorum < 1}
         */
        public RuleSet build() {
            if (underloadQuorum < 1) {
                throw new IllegalArgumentException("underloadQuorum must be >= 1, got: " + underloadQuorum);
            }
            return new RuleSet(this);
        }
    }
}
