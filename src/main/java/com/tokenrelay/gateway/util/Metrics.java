package com.tokenrelay.gateway.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus 风格指标收集器
 * <p>
 * 刷新周期、重放、登出计数以及刷新耗时直方图，输出时统一加 relay_ 前缀
 */
public class Metrics {

    private static final Metrics INSTANCE = new Metrics();
    private static final String PREFIX = "relay_";
    private static final long[] LATENCY_BOUNDS_MS = {50, 100, 250, 500, 1000, 2500, 5000, 10000, 30000};

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LatencyHistogram> histograms = new ConcurrentHashMap<>();

    public static Metrics instance() {
        return INSTANCE;
    }

    public void increment(String name) {
        add(name, 1);
    }

    public void add(String name, long value) {
        counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(value);
    }

    public long get(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public void recordLatency(String name, long latencyMs) {
        histograms.computeIfAbsent(name, k -> new LatencyHistogram()).observe(latencyMs);
    }

    /**
     * 记录一次刷新周期结算
     *
     * @param success   刷新是否成功
     * @param waiters   该周期释放的等待者数量
     * @param latencyMs 从周期开始到结算的耗时
     */
    public void recordRefresh(boolean success, int waiters, long latencyMs) {
        increment("refresh_cycles_total");
        increment(success ? "refresh_success_total" : "refresh_failure_total");
        add("refresh_waiters_total", waiters);
        recordLatency("refresh_latency_ms", latencyMs);
    }

    /**
     * 输出 Prometheus 文本格式，指标按名称排序
     */
    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        new TreeMap<>(counters).forEach((name, value) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" counter\n");
            sb.append(PREFIX).append(name).append(' ').append(value.get()).append('\n');
        });

        for (Map.Entry<String, LatencyHistogram> entry : new TreeMap<>(histograms).entrySet()) {
            entry.getValue().appendTo(sb, PREFIX + entry.getKey());
        }
        return sb.toString();
    }

    /**
     * 累积桶直方图，桶边界单位为毫秒
     */
    private static final class LatencyHistogram {

        private final long[] buckets = new long[LATENCY_BOUNDS_MS.length + 1];
        private long sum;
        private long count;

        synchronized void observe(long latencyMs) {
            int index = 0;
            while (index < LATENCY_BOUNDS_MS.length && latencyMs > LATENCY_BOUNDS_MS[index]) {
                index++;
            }
            buckets[index]++;
            sum += latencyMs;
            count++;
        }

        synchronized void appendTo(StringBuilder sb, String name) {
            sb.append("# TYPE ").append(name).append(" histogram\n");
            long cumulative = 0;
            for (int i = 0; i < LATENCY_BOUNDS_MS.length; i++) {
                cumulative += buckets[i];
                sb.append(name).append("_bucket{le=\"").append(LATENCY_BOUNDS_MS[i]).append("\"} ")
                        .append(cumulative).append('\n');
            }
            sb.append(name).append("_bucket{le=\"+Inf\"} ").append(count).append('\n');
            sb.append(name).append("_sum ").append(sum).append('\n');
            sb.append(name).append("_count ").append(count).append('\n');
        }
    }
}
