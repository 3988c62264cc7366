package com.modelrouter.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace id of one routing request, from the inbound call to the decision record.
 *
 * <p>The id is the request's own {@code requestId} when it has one, otherwise the
 * {@value #TRACE_HEADER} header, otherwise a fresh UUID. Inside a pipeline it lives only in
 * the Reactor Context; MDC holds it just for the duration of one log call.
 *
 * <pre>
 *     String traceId = RequestTrace.resolve(request.requestId(), header);
 *     return RequestTrace.bind(pipeline, traceId);
 * </pre>
 */
public final class RequestTrace {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String UNKNOWN = "unknown";

    private RequestTrace() {}

    public static String resolve(String requestId, String headerValue) {
        if (usable(requestId)) return requestId;
        if (usable(headerValue)) return headerValue;
        return UUID.randomUUID().toString();
    }

    public static String ensure(String requestId) {
        return resolve(requestId, null);
    }

    /** For error paths that must not invent an id: the header value or {@value #UNKNOWN}. */
    public static String orUnknown(String headerValue) {
        return usable(headerValue) ? headerValue : UNKNOWN;
    }

    /** Binds the id to everything upstream of this call; apply last. */
    public static <T> Mono<T> bind(Mono<T> pipeline, String traceId) {
        return pipeline.contextWrite(Context.of(TRACE_ID_KEY, traceId));
    }

    public static String current(ContextView ctx) {
        return ctx.<String>getOrEmpty(TRACE_ID_KEY).filter(RequestTrace::usable).orElse(UNKNOWN);
    }

    public static void logWith(String traceId, Runnable logAction) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(TRACE_ID_KEY, orUnknown(traceId))) {
            logAction.run();
        }
    }

    private static boolean usable(String id) {
        return id != null && !id.isBlank();
    }
}
