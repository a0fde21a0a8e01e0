package com.eainde.forecast.llm;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Classifies provider exceptions into retry decisions.
 *
 * <p>Walks the whole cause chain: LangChain4j providers wrap HTTP errors at varying depths.
 * Never throws. Messages are truncated so provider payloads do not leak into traces.</p>
 */
public final class ModelErrorClassifier {

    private static final int MAX_HOPS = 20;
    private static final int MAX_MESSAGE = 160;
    // 429 as a status token, not inside ids, counts or decimals
    private static final Pattern STATUS_429 = Pattern.compile("(?<![\\w.])429(?![\\w.])");

    private ModelErrorClassifier() {
    }

    public record Result(String code, boolean rateLimited, boolean retryable, Integer statusCode,
                         String shortMessage) {
    }

    public static Result classify(Throwable t) {
        List<Throwable> chain = causeChain(t);

        for (Throwable x : chain) {
            if (x instanceof RateLimitException) {
                return new Result("RATE_LIMIT", true, true, 429, shortMessage(x.getMessage()));
            }
            if (x instanceof ModelNotFoundException) {
                return new Result("MODEL_NOT_FOUND", false, false, null, shortMessage(x.getMessage()));
            }
            if (x instanceof AuthenticationException) {
                return new Result("AUTH", false, false, null, shortMessage(x.getMessage()));
            }
            if (x instanceof InvalidRequestException) {
                return new Result("INVALID_REQUEST", false, false, null, shortMessage(x.getMessage()));
            }
            if (x instanceof CancellationException) {
                return new Result("CANCELLED", false, false, null, shortMessage(x.getMessage()));
            }
        }

        for (Throwable x : chain) {
            if (!(x instanceof HttpException he)) {
                continue;
            }
            int sc = he.statusCode();
            String m = he.getMessage();
            if (sc == 429) {
                return new Result("RATE_LIMIT", true, true, sc, shortMessage(m));
            }
            if (sc == 401 || sc == 403) {
                return new Result("AUTH", false, false, sc, shortMessage(m));
            }
            if (sc == 404) {
                return new Result("MODEL_NOT_FOUND", false, false, sc, shortMessage(m));
            }
            if (sc == 408) {
                return new Result("TIMEOUT", false, true, sc, shortMessage(m));
            }
            if (sc >= 500 && sc <= 599) {
                return new Result("UPSTREAM_5XX", false, true, sc, shortMessage(m));
            }
            if (sc >= 400 && sc <= 499) {
                return new Result("HTTP_4XX", false, false, sc, shortMessage(m));
            }
        }

        StringBuilder sb = new StringBuilder();
        for (Throwable x : chain) {
            String lm = lower(x.getMessage());
            if (!lm.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(" | ");
                }
                sb.append(lm);
            }
        }
        String all = sb.toString();
        String topMessage = t == null ? null : t.getMessage();

        if (all.contains("resource_exhausted") || STATUS_429.matcher(all).find()
                || (all.contains("rate") && all.contains("limit"))) {
            return new Result("RATE_LIMIT", true, true, null, shortMessage(topMessage));
        }
        for (Throwable x : chain) {
            if (x instanceof TimeoutException || lower(x.getMessage()).contains("timed out")
                    || lower(x.getMessage()).contains("timeout")) {
                return new Result("TIMEOUT", false, true, null, shortMessage(x.getMessage()));
            }
        }
        if (all.contains("api key") || all.contains("permission_denied") || all.contains("unauthenticated")) {
            return new Result("AUTH", false, false, null, shortMessage(topMessage));
        }
        if (all.contains("interrupted")) {
            return new Result("INTERRUPTED", false, false, null, shortMessage(topMessage));
        }

        Throwable root = chain.isEmpty() ? null : chain.get(chain.size() - 1);
        return new Result("UNKNOWN", false, true, null, shortMessage(root == null ? null : root.getMessage()));
    }

    /**
     * Translates a provider exception into a {@link ModelBackendException}.
     */
    public static ModelBackendException toBackendException(String backend, Throwable t) {
        if (t instanceof ModelBackendException mbe) {
            return mbe;
        }
        Result r = classify(t);
        String message = backend + " call failed [" + r.code() + "]"
                + (r.shortMessage().isEmpty() ? "" : ": " + r.shortMessage());
        return new ModelBackendException(message, r.statusCode(), r.rateLimited(), r.retryable(), t);
    }

    private static List<Throwable> causeChain(Throwable t) {
        List<Throwable> chain = new ArrayList<>();
        Throwable cur = t;
        int hops = 0;
        while (cur != null && hops++ < MAX_HOPS) {
            chain.add(cur);
            Throwable next = cur.getCause();
            if (next == cur) {
                break;
            }
            cur = next;
        }
        return chain;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    static String shortMessage(String s) {
        if (s == null) {
            return "";
        }
        String collapsed = s.replaceAll("\\s+", " ").trim();
        if (collapsed.length() > MAX_MESSAGE) {
            return collapsed.substring(0, MAX_MESSAGE) + "...";
        }
        return collapsed;
    }
}
