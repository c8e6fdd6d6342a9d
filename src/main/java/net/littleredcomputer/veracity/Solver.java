// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.veracity.Expression.Conjunction;
import net.littleredcomputer.veracity.Expression.Disjunction;
import net.littleredcomputer.veracity.Expression.Implication;
import net.littleredcomputer.veracity.Expression.Literal;
import net.littleredcomputer.veracity.Expression.Negation;
import net.littleredcomputer.veracity.Expression.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Enumerates the models of a formula by backtracking search. The search tries to force the
 * formula to the value true; each connective says what its operands must evaluate to, and a
 * variable either takes on the value demanded of it or, if it is already bound to the other
 * value, kills the branch. A disjunction forced true (or a conjunction forced false) splits
 * the search in two.
 * <p>
 * The models are partial: a variable the search never had to bind may take either value.
 * They are produced depth first, left operand before right, and are not deduplicated.
 * <p>
 * Not thread safe: a solver keeps progress counters.
 */
public class Solver {
    private static final Logger log = LogManager.getFormatterLogger(Solver.class);
    final int logCheckSteps = 10000;
    long stepCount;
    private long lastStepCount;
    private int depth;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private boolean simplification = true;

    public Solver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * @param simplification whether to constant-fold the formula before searching (the default)
     */
    public Solver setSimplification(boolean simplification) {
        this.simplification = simplification;
        return this;
    }

    private void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        stepCount = lastStepCount = 0;
        depth = 0;
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / tween.toMillis();
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %s", stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * @return every model found, in discovery order; empty if the formula is unsatisfiable
     */
    public ImmutableList<Assignment> solve(Expression formula) {
        start();
        final Expression e = simplification ? Simplifier.simplify(formula) : formula;
        ImmutableList<Assignment> models = unify(e, true, Assignment.empty());
        stopwatch.stop();
        log.debug("%s: %d models in %d steps %s", e, models.size(), stepCount, stopwatch);
        return models;
    }

    public ImmutableList<Assignment> solve(String formula) {
        return solve(Parser.parse(formula));
    }

    /**
     * @return the extensions of {@code a} under which {@code e} evaluates to {@code target}
     */
    ImmutableList<Assignment> unify(Expression e, boolean target, Assignment a) {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> "depth " + depth);
        ++depth;
        ImmutableList<Assignment> result = e.accept(new Unifier(target, a));
        --depth;
        return result;
    }

    // Every assignment in `as` extended so that e evaluates to target.
    private ImmutableList<Assignment> unifyEach(Expression e, boolean target, List<Assignment> as) {
        ImmutableList.Builder<Assignment> b = ImmutableList.builder();
        for (Assignment a : as) b.addAll(unify(e, target, a));
        return b.build();
    }

    private class Unifier implements Expression.Visitor<ImmutableList<Assignment>> {
        private final boolean target;
        private final Assignment a;

        Unifier(boolean target, Assignment a) {
            this.target = target;
            this.a = a;
        }

        // Both operands must take on the target value, under one assignment.
        private ImmutableList<Assignment> both(Expression l, Expression r) {
            return unifyEach(r, target, unify(l, target, a));
        }

        // Either operand may take on the target value; each gets its own branch.
        private ImmutableList<Assignment> either(Expression l, Expression r) {
            return ImmutableList.<Assignment>builder()
                    .addAll(unify(l, target, a))
                    .addAll(unify(r, target, a))
                    .build();
        }

        @Override
        public ImmutableList<Assignment> visit(Literal l) {
            return l.value() == target ? ImmutableList.of(a) : ImmutableList.of();
        }

        @Override
        public ImmutableList<Assignment> visit(Variable v) {
            return a.get(v.identifier())
                    .map(bound -> bound == target ? ImmutableList.of(a) : ImmutableList.<Assignment>of())
                    .orElseGet(() -> ImmutableList.of(a.with(v.identifier(), target)));
        }

        @Override
        public ImmutableList<Assignment> visit(Negation n) {
            return unify(n.operand(), !target, a);
        }

        @Override
        public ImmutableList<Assignment> visit(Conjunction c) {
            return target ? both(c.lhs(), c.rhs()) : either(c.lhs(), c.rhs());
        }

        @Override
        public ImmutableList<Assignment> visit(Disjunction d) {
            return target ? either(d.lhs(), d.rhs()) : both(d.lhs(), d.rhs());
        }

        @Override
        public ImmutableList<Assignment> visit(Implication i) {
            return unify(Expression.or(Expression.not(i.lhs()), i.rhs()), target, a);
        }
    }
}
