package com.myorg.hitl.drafting.llm;

import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.core.exception.HitlException;
import com.myorg.hitl.contracts.core.exception.UpstreamRejectedException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.ModelNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a failed completion or embedding call onto the pipeline's error taxonomy. HTTP 4xx
 * other than 429 is a permanent rejection; everything else (5xx, 429, timeouts, I/O) is
 * treated as a connectivity problem and retried.
 */
public final class CompletionErrorClassifier {

    private static final int MAX_MSG = 300;

    private CompletionErrorClassifier() {
    }

    public static HitlException classify(String operation, Throwable t) {
        List<Throwable> chain = chain(t);

        for (Throwable x : chain) {
            if (x instanceof ModelNotFoundException) {
                return new UpstreamRejectedException("MODEL_NOT_FOUND", operation + " rejected: " + shortMsg(x), t);
            }
        }

        for (Throwable x : chain) {
            if (!(x instanceof HttpException he)) continue;
            int sc = he.statusCode();
            if (sc == 429) {
                return new ConnectivityException(operation + " rate limited: " + shortMsg(x), t);
            }
            if (sc == 401 || sc == 403) {
                return new UpstreamRejectedException("AUTH", operation + " rejected (" + sc + "): " + shortMsg(x), t);
            }
            if (sc >= 400 && sc <= 499) {
                return new UpstreamRejectedException("HTTP_4XX", operation + " rejected (" + sc + "): " + shortMsg(x), t);
            }
            return new ConnectivityException(operation + " failed (" + sc + "): " + shortMsg(x), t);
        }

        for (Throwable x : chain) {
            if (x instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return new ConnectivityException(operation + " failed: " + shortMsg(chain.get(chain.size() - 1)), t);
    }

    private static List<Throwable> chain(Throwable t) {
        List<Throwable> out = new ArrayList<>();
        Throwable cur = t == null ? new RuntimeException("null") : t;
        int hops = 0;
        while (cur != null && hops++ < 20) {
            out.add(cur);
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return out;
    }

    private static String shortMsg(Throwable x) {
        String m = x.getMessage() == null ? x.getClass().getSimpleName() : x.getMessage();
        m = m.replaceAll("\\s+", " ").trim();
        if (m.toLowerCase(Locale.ROOT).contains("bearer ")) {
            m = m.replaceAll("(?i)bearer\\s+\\S+", "Bearer ***");
        }
        return m.length() > MAX_MSG ? m.substring(0, MAX_MSG) + "..." : m;
    }
}
