package io.failforge;

import io.failforge.internal.Backtraces;
import io.failforge.internal.FailureCollector;
import io.failforge.internal.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * failforge 的失败聚合块。
 *
 * <p>普通情况下第一个失败的断言就会中止测试；在聚合块内，通过
 * {@link AggregationContext#notifyFailure} 上报的断言失败只会被收集，
 * 块体继续执行，块结束时再统一抛出。
 *
 * <p>结束时的行为：
 * 没有问题则正常返回；
 * 恰好一个问题则原样重新抛出该对象（与未聚合时无法区分）；
 * 两个及以上则抛出 {@link AggregateFailureError}。
 *
 * <p>块体抛出的非断言异常会被记录并立即中止块体剩余语句。
 * 嵌套在外层块中时，本块的结果不会向外抛出，而是作为一项失败写入外层块，
 * 位置按本块进入的先后顺序排列。
 *
 * <p>推荐用法示例：
 * <pre>{@code
 * FailureAggregator.open()
 *     .withLabel("user payload")
 *     .withMetadata("case", 42)
 *     .run(() -> {
 *         Expectations.expect(user.id() > 0, () -> "expected positive id");
 *         Expectations.expect(user.name() != null, () -> "expected a name");
 *     });
 * }</pre>
 */
public final class FailureAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(FailureAggregator.class);
    private static final AtomicLong BLOCK_IDS = new AtomicLong(1L);

    private final AggregationContext context;
    private final AtomicBoolean configLocked;
    private final Map<String, Object> metadata;

    private volatile String label;
    private volatile AggregationHook hook;

    private FailureAggregator(AggregationContext context) {
        this.context = context;
        this.configLocked = new AtomicBoolean(false);
        this.metadata = Collections.synchronizedMap(new LinkedHashMap<String, Object>());
        this.hook = AggregationHooks.NOOP;
    }

    /**
     * 基于全局上下文创建聚合器。
     */
    public static FailureAggregator open() {
        return new FailureAggregator(AggregationContext.global());
    }

    /**
     * 基于指定上下文创建聚合器，适用于彼此隔离的运行环境。
     */
    public static FailureAggregator open(AggregationContext context) {
        Objects.requireNonNull(context, "context");
        return new FailureAggregator(context);
    }

    /**
     * 在全局上下文中执行一个未命名的聚合块。
     */
    public static void aggregate(AggregationBody body) {
        open().run(body);
    }

    /**
     * 在全局上下文中执行一个具名聚合块。
     */
    public static void aggregate(String label, AggregationBody body) {
        open().withLabel(label).run(body);
    }

    /**
     * 在全局上下文中执行一个带名称和元数据的聚合块。
     *
     * <p>{@code label} 与 {@code metadata} 均可为 {@code null}。
     */
    public static void aggregate(String label, Map<String, ?> metadata, AggregationBody body) {
        FailureAggregator aggregator = open();
        if (label != null) {
            aggregator.withLabel(label);
        }
        if (metadata != null) {
            aggregator.withMetadata(metadata);
        }
        aggregator.run(body);
    }

    /**
     * 设置块名称，用于汇总报告的标题。
     *
     * <p>必须在首次执行前调用，否则抛出 {@link IllegalStateException}。
     */
    public FailureAggregator withLabel(String label) {
        Objects.requireNonNull(label, "label");
        ensureConfigurable();
        this.label = label;
        return this;
    }

    /**
     * 追加块元数据。元数据原样附加到 {@link AggregateFailureError} 上，引擎不做解释。
     */
    public FailureAggregator withMetadata(Map<String, ?> metadata) {
        Objects.requireNonNull(metadata, "metadata");
        ensureConfigurable();
        this.metadata.putAll(metadata);
        return this;
    }

    /**
     * 追加单个元数据项。
     */
    public FailureAggregator withMetadata(String key, Object value) {
        Objects.requireNonNull(key, "key");
        ensureConfigurable();
        this.metadata.put(key, value);
        return this;
    }

    /**
     * 设置生命周期回调；多次调用时回调按注册顺序组合。
     */
    public FailureAggregator withHook(AggregationHook hook) {
        Objects.requireNonNull(hook, "hook");
        ensureConfigurable();
        AggregationHook current = this.hook;
        this.hook = current == AggregationHooks.NOOP ? hook : AggregationHooks.compose(current, hook);
        return this;
    }

    public AggregationContext context() {
        return context;
    }

    public String label() {
        return label;
    }

    public Map<String, Object> metadata() {
        synchronized (metadata) {
            return Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
        }
    }

    /**
     * 执行聚合块。
     *
     * <p>有外层块时，本块产生的错误写入外层块并正常返回；
     * 否则按单个原样抛出或 {@link AggregateFailureError} 的规则抛出。
     * 受检异常同样原样抛出，不做包装。
     */
    public void run(AggregationBody body) {
        Objects.requireNonNull(body, "body");
        Execution execution = execute(body, true);
        Throwable error = execution.outcome.error();
        if (error == null) {
            return;
        }
        FailureCollector.Slot outerSlot = execution.entry.outerSlot();
        if (outerSlot != null && outerSlot.fill(error)) {
            LOG.debug("Handed {} result of {} to the enclosing block", error.getClass().getSimpleName(), execution.info);
            return;
        }
        throw Throwables.rethrow(error);
    }

    /**
     * 执行聚合块但不抛出，也不上报给外层块，结果以 {@link AggregationOutcome} 返回。
     */
    public AggregationOutcome collect(AggregationBody body) {
        Objects.requireNonNull(body, "body");
        return execute(body, false).outcome;
    }

    private Execution execute(AggregationBody body, boolean reportToOuter) {
        configLocked.set(true);
        final long blockId = BLOCK_IDS.getAndIncrement();
        final Map<String, Object> blockMetadata = metadata();
        final AggregationHook blockHook = hook;

        AggregationContext.Entry entry = context.enter(blockId, reportToOuter);
        FailureCollector collector = entry.collector();
        BlockInfo info = new BlockInfo(blockId, label, entry.depth(), Instant.now());
        long startNanos = System.nanoTime();
        try {
            AggregationHooks.safeEnter(blockHook, info);
            body.run();
        } catch (Throwable escaped) {
            recordEscaped(collector, escaped);
            AggregationHooks.safeAbort(blockHook, info, escaped);
        } finally {
            context.exit(entry);
        }

        AggregationOutcome outcome = new AggregationOutcome(
            label, blockMetadata, collector.failures(), collector.otherErrors());
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Aggregation {} finished in {} ms with {} failure(s) and {} other error(s)",
                info, duration.toMillis(), outcome.failures().size(), outcome.otherErrors().size());
        }
        AggregationHooks.safeComplete(blockHook, info, outcome, duration);
        return new Execution(entry, info, outcome);
    }

    private static void recordEscaped(FailureCollector collector, Throwable escaped) {
        if (escaped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (escaped instanceof ExpectationFailedError) {
            ExpectationFailedError failure = (ExpectationFailedError) escaped;
            failure.setBacktraceIfAbsent(Backtraces.of(failure));
            collector.addFailure(failure);
        } else if (escaped instanceof AggregateFailureError) {
            collector.addFailure(escaped);
        } else {
            collector.addOtherError(escaped);
        }
    }

    private void ensureConfigurable() {
        if (configLocked.get()) {
            throw new IllegalStateException("Configuration must be done before the first run");
        }
    }

    private static final class Execution {
        private final AggregationContext.Entry entry;
        private final BlockInfo info;
        private final AggregationOutcome outcome;

        private Execution(AggregationContext.Entry entry, BlockInfo info, AggregationOutcome outcome) {
            this.entry = entry;
            this.info = info;
            this.outcome = outcome;
        }
    }
}
