package com.docflow.consensus;

import com.docflow.flowdefinition.consensus.ConsensusConfig;
import com.docflow.flowdefinition.consensus.TieBreak;
import com.docflow.flowdefinition.consensus.VotingLevel;
import com.docflow.observability.HookDispatcher;
import com.docflow.observability.event.ConsensusCompleteEvent;
import com.docflow.observability.event.ConsensusRunCompleteEvent;
import com.docflow.observability.event.ConsensusStartEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs a call {@code runs} times concurrently and reduces the successful results by vote.
 * <p>
 * Failed runs are excluded from the vote but count toward the agreement denominator. A result group wins
 * under MAJORITY when it holds strictly more than half of the successful runs, under UNANIMOUS when it holds
 * all of them. Otherwise the tie policy applies: RANDOM picks among the leading groups, FAIL throws,
 * RETRY performs one extra run (index {@code runs}) and votes again, failing on a second tie.
 */
public final class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    private final HookDispatcher hooks;
    private final Random random;

    public ConsensusEngine(HookDispatcher hooks, Random random) {
        this.hooks = hooks != null ? hooks : HookDispatcher.noop();
        this.random = random != null ? random : new Random();
    }

    public ConsensusEngine() {
        this(HookDispatcher.noop(), new Random());
    }

    /**
     * @param config   runs, strategy, tie policy and voting level
     * @param invoker  one run; invoked once per run index
     * @param valueOf  projects a run result to the value that is voted on
     * @param scope    step and trace for hooks
     * @throws ConsensusException when no run succeeded or a tie is not resolved
     */
    public <T> ConsensusResult<T> run(ConsensusConfig config, RunInvoker<T> invoker,
                                      Function<? super T, ?> valueOf, ConsensusScope scope) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(invoker, "invoker");
        Objects.requireNonNull(valueOf, "valueOf");
        if (config.runs() < 1) {
            throw new IllegalArgumentException("Consensus runs must be at least 1, got " + config.runs());
        }
        String stepId = scope.stepId();
        hooks.onConsensusStart(new ConsensusStartEvent(scope.trace(), stepId, config.runs(),
                config.strategy().toValue(), config.onTie().toValue()));

        List<RunOutcome<T>> outcomes = new ArrayList<>(executeRuns(0, config.runs(), invoker, scope));
        Decision decision = decide(config, outcomes, valueOf, stepId);
        boolean retried = false;
        if (decision.tie() && config.onTie() == TieBreak.RETRY) {
            log.info("Consensus tie on step {}; performing one retry run", stepId);
            retried = true;
            outcomes.addAll(executeRuns(config.runs(), 1, invoker, scope));
            decision = decide(config, outcomes, valueOf, stepId);
            if (decision.tie()) {
                throw new ConsensusException(stepId, "Consensus still tied after retry on step " + stepId
                        + " (" + decision.describeLeaders() + ")");
            }
        } else if (decision.tie() && config.onTie() == TieBreak.FAIL) {
            throw new ConsensusException(stepId, "Consensus tie on step " + stepId
                    + " (" + decision.describeLeaders() + ")");
        } else if (decision.tie()) {
            decision = decision.breakTie(random);
            log.debug("Consensus tie on step {} broken at random: run {}", stepId, decision.selectedRunIndex());
        }

        boolean tieBroken = retried || decision.tieBreakerUsed();
        double agreement = (double) decision.agreeingRuns() / outcomes.size();
        ConsensusResult<T> result = new ConsensusResult<>(decision.value(), decision.selectedRunIndex(), agreement,
                outcomes, tieBroken ? config.onTie() : null, retried, decision.synthetic(),
                decision.fieldAgreement());
        hooks.onConsensusComplete(new ConsensusCompleteEvent(scope.trace(), stepId, agreement,
                result.successfulRuns(), result.failedRuns(), tieBroken, retried));
        return result;
    }

    private <T> Decision decide(ConsensusConfig config, List<RunOutcome<T>> outcomes,
                                Function<? super T, ?> valueOf, String stepId) {
        Map<Integer, Object> values = new LinkedHashMap<>();
        Throwable lastError = null;
        for (RunOutcome<T> o : outcomes) {
            if (o.success()) {
                values.put(o.runIndex(), valueOf.apply(o.result()));
            } else {
                lastError = o.error();
            }
        }
        if (values.isEmpty()) {
            throw new ConsensusException(stepId, "All " + outcomes.size() + " consensus runs failed on step " + stepId,
                    lastError);
        }
        if (config.level() == VotingLevel.FIELD) {
            if (FieldVoter.supports(values.values())) {
                return FieldVoter.vote(values, config.strategy(), random);
            }
            log.debug("Step {} requested field-level voting but results are not objects; voting on whole values",
                    stepId);
        }
        return Decision.of(VoteCounter.count(values, config.strategy()));
    }

    private <T> List<RunOutcome<T>> executeRuns(int firstIndex, int count, RunInvoker<T> invoker, ConsensusScope scope) {
        ExecutorService pool = Executors.newFixedThreadPool(count);
        try {
            List<Future<RunOutcome<T>>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int runIndex = firstIndex + i;
                futures.add(pool.submit(() -> runOnce(runIndex, invoker)));
            }
            List<RunOutcome<T>> outcomes = new ArrayList<>(count);
            for (Future<RunOutcome<T>> f : futures) {
                RunOutcome<T> outcome = f.get();
                outcomes.add(outcome);
                hooks.onConsensusRunComplete(new ConsensusRunCompleteEvent(scope.trace(), scope.stepId(),
                        outcome.runIndex(), outcome.success(), outcome.error(), outcome.durationMs()));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsensusException(scope.stepId(), "Consensus interrupted on step " + scope.stepId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error err) throw err;
            throw new ConsensusException(scope.stepId(), "Consensus run crashed on step " + scope.stepId(), cause);
        } finally {
            pool.shutdownNow();
            try {
                pool.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static <T> RunOutcome<T> runOnce(int runIndex, RunInvoker<T> invoker) {
        long start = System.currentTimeMillis();
        try {
            T value = invoker.run(runIndex);
            return RunOutcome.succeeded(runIndex, value, System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.debug("Consensus run {} failed: {}", runIndex, e.getMessage());
            return RunOutcome.failed(runIndex, e, System.currentTimeMillis() - start);
        }
    }
}
