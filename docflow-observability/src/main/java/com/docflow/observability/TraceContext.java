package com.docflow.observability;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Trace/span pair shared by every event of one flow run. Trace ids are 32 hex chars, span ids 16.
 * {@code sampled} is decided once per run; unsampled runs skip hook invocation only.
 */
public record TraceContext(String traceId, String spanId, String parentSpanId, boolean sampled) {

    public static TraceContext root(boolean sampled) {
        return new TraceContext(randomHex(32), randomHex(16), null, sampled);
    }

    /** New span under this one, same trace and sampling decision. */
    public TraceContext child() {
        return new TraceContext(traceId, randomHex(16), spanId, sampled);
    }

    private static String randomHex(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        while (sb.length() < length) {
            sb.append(String.format("%016x", random.nextLong()));
        }
        return sb.substring(0, length);
    }
}
