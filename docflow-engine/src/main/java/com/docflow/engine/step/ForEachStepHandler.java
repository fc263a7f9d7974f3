package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.ExecutionException;
import com.docflow.engine.StepMetric;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.ForEachStep;
import com.docflow.flowdefinition.step.StepKind;
import com.docflow.observability.event.BatchEndEvent;
import com.docflow.observability.event.BatchItemEndEvent;
import com.docflow.observability.event.BatchStartEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Splits the input into items and runs the item flow once per item on a bounded pool.
 * <p>
 * Item failures are recorded, not thrown; the step fails only when fewer items succeed than
 * {@link com.docflow.engine.EngineConfig#getMinSuccessfulItems()} (capped at the item count).
 * Item metrics are merged under {@code <id>.item[<index>]}; a wrapper metric then rolls up the splitter and
 * item costs with the item counts. A failed step records a failed wrapper instead.
 */
public final class ForEachStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ForEachStepHandler.class);

    static final String ITEMS_FIELD = "items";
    static final String ITEM_INPUT_FIELD = "input";
    static final String WRAPPER_TYPE = "forEach";

    @Override
    public Set<StepKind> supportedKinds() {
        return Set.of(StepKind.FOR_EACH);
    }

    @Override
    public StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                HandlerContext hc) {
        ForEachStep forEach = step.as(ForEachStep.class);
        long start = System.currentTimeMillis();
        List<?> items = null;
        try {
            ProviderStepOutcome split = hc.getProviderInvoker().invoke(step, "split", forEach.getConfig(), input,
                    scope);
            ctx.addMetric(split.metric());

            items = itemsOf(split.value());
            if (items == null) {
                throw new ExecutionException(step.getId(), scope.flowPath(),
                        "Splitter did not return a list of items: " + split.value(), null);
            }
            return runBatch(step, items, split.metric(), ctx, scope, hc, start);
        } catch (RuntimeException e) {
            ctx.addMetric(StepMetric.failedWrapper(step.getId(), WRAPPER_TYPE, System.currentTimeMillis() - start,
                    items != null ? items.size() : 0, e));
            throw e;
        }
    }

    private StepOutcome runBatch(PlannedStep step, List<?> items, StepMetric splitMetric, ExecutionContext ctx,
                                 FlowScope scope, HandlerContext hc, long start) {
        long batchStart = System.currentTimeMillis();
        hc.getHooks().onBatchStart(new BatchStartEvent(scope.trace(), step.getId(), items.size()));

        List<ItemRun> runs = items.isEmpty()
                ? List.of()
                : runItems(step, items, scope, ctx, hc);
        List<ItemResult> results = new ArrayList<>(runs.size());
        List<StepMetric> itemMetrics = new ArrayList<>();
        for (ItemRun run : runs) {
            results.add(run.result());
            if (run.outcome() != null) {
                itemMetrics.addAll(run.outcome().metrics());
            }
        }
        ForEachResult aggregate = ForEachResult.of(results);

        hc.getHooks().onBatchEnd(new BatchEndEvent(scope.trace(), step.getId(), aggregate.totalItems(),
                aggregate.successfulItems(), aggregate.failedItems(), System.currentTimeMillis() - batchStart));
        log.info("ForEach {} finished: {}/{} items succeeded", step.getId(), aggregate.successfulItems(),
                aggregate.totalItems());

        int required = Math.min(hc.getConfig().getMinSuccessfulItems(), aggregate.totalItems());
        if (aggregate.successfulItems() < required) {
            String firstError = results.stream().filter(r -> !r.isSuccess()).map(ItemResult::error)
                    .findFirst().orElse("unknown");
            throw new ExecutionException(step.getId(), scope.flowPath(),
                    aggregate.successfulItems() + " of " + aggregate.totalItems() + " items succeeded (minimum "
                            + required + "); first error: " + firstError, null);
        }
        ctx.addMetric(StepMetric.wrapper(step.getId(), splitMetric, itemMetrics, System.currentTimeMillis() - start,
                WRAPPER_TYPE, aggregate.totalItems(), aggregate.successfulItems(), aggregate.failedItems()));
        return StepOutcome.of(aggregate);
    }

    private List<ItemRun> runItems(PlannedStep step, List<?> items, FlowScope scope, ExecutionContext ctx,
                                   HandlerContext hc) {
        int total = items.size();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(hc.getConfig().getForEachConcurrency(), total));
        List<ItemRun> runs = new ArrayList<>(total);
        try {
            List<Future<ItemRun>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                int index = i;
                Object itemInput = itemInput(items.get(i));
                FlowScope itemScope = scope.nested(step.getId() + "[" + index + "]").withTrace(scope.trace().child());
                futures.add(pool.submit(() -> runItem(step, index, itemInput, itemScope, hc)));
            }
            for (Future<ItemRun> future : futures) {
                ItemRun run = future.get();
                runs.add(run);
                if (run.outcome() != null) {
                    ctx.addNestedMetrics(step.getId() + ".item[" + run.result().index() + "]", run.outcome().metrics());
                }
                hc.getHooks().onBatchItemEnd(new BatchItemEndEvent(scope.trace(), step.getId(), run.result().index(),
                        total, run.result().isSuccess(), run.error(), run.result().durationMs()));
            }
            return runs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException(step.getId(), scope.flowPath(), "ForEach interrupted", e);
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error err) throw err;
            throw new ExecutionException(step.getId(), scope.flowPath(), cause);
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ItemRun runItem(PlannedStep step, int index, Object itemInput, FlowScope itemScope,
                                   HandlerContext hc) {
        long start = System.currentTimeMillis();
        try {
            SubFlowOutcome outcome = hc.getSubFlowRunner().run(step.getChildFlow(), itemInput, itemScope);
            return new ItemRun(new ItemResult(index, ItemResult.Status.SUCCESS, outcome.output(), null,
                    System.currentTimeMillis() - start), outcome, null);
        } catch (RuntimeException e) {
            log.warn("ForEach {} item {} failed: {}", step.getId(), index, e.getMessage());
            return new ItemRun(new ItemResult(index, ItemResult.Status.FAILED, null, e.getMessage(),
                    System.currentTimeMillis() - start), null, e);
        }
    }

    static List<?> itemsOf(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Map<?, ?> map && map.get(ITEMS_FIELD) instanceof List<?> list) {
            return list;
        }
        return null;
    }

    static Object itemInput(Object item) {
        if (item instanceof Map<?, ?> map && map.containsKey(ITEM_INPUT_FIELD)) {
            return map.get(ITEM_INPUT_FIELD);
        }
        return item;
    }

    private record ItemRun(ItemResult result, SubFlowOutcome outcome, Throwable error) {
    }
}
