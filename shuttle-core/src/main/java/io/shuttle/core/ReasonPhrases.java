package io.shuttle.core;

import org.apache.hc.core5.http.impl.EnglishReasonPhraseCatalog;

import java.util.Locale;

/**
 * Status code to reason phrase registry, backed by the HttpCore catalog.
 */
public final class ReasonPhrases {
    private ReasonPhrases() {}

    /**
     * @return the standard phrase for {@code status}, or an empty string if the code is unknown
     */
    public static String lookup(int status) {
        if (status < 100 || status >= 600) return "";
        String reason = EnglishReasonPhraseCatalog.INSTANCE.getReason(status, Locale.ROOT);
        return reason == null ? "" : reason;
    }
}
