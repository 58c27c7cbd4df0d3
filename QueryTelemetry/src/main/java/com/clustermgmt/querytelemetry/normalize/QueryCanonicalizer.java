package com.clustermgmt.querytelemetry.normalize;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces raw statement text, as reported by pg_stat_statements, to the canonical
 * shape shared by every statement that differs only in bound values or in the
 * number of values of an {@code IN (...)} membership test.
 *
 * Example:
 *    SELECT * FROM t WHERE id IN ($1, $2, $3) AND kind = $4
 *    SELECT * FROM t WHERE id IN ($?) AND kind = $?
 *
 * Canonicalization is deterministic and idempotent; the fingerprint is the MD5 of the
 * UTF-8 canonical text, hex encoded, so it is stable across restarts and platforms.
 */
@Slf4j
@Component
public class QueryCanonicalizer {

    /** Placeholder every positional parameter is rewritten to. */
    public static final String PLACEHOLDER = "$?";

    private static final Pattern IN_LIST_OPEN = Pattern.compile("\\bIN\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIONAL_PARAMETER = Pattern.compile("\\$\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Canonical text of a statement together with its fingerprint.
     */
    public record CanonicalForm(String canonicalText, String fingerprint) {}

    /**
     * Canonicalizes a raw statement. Never throws: null or empty input yields the empty
     * shape, and an unexpected failure degrades to treating the raw text as canonical.
     */
    public CanonicalForm canonicalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return new CanonicalForm("", fingerprint(""));
        }

        try {
            String canonical = rawText.trim();
            canonical = collapseInLists(canonical);
            canonical = POSITIONAL_PARAMETER.matcher(canonical).replaceAll(Matcher.quoteReplacement(PLACEHOLDER));
            canonical = WHITESPACE.matcher(canonical).replaceAll(" ").trim();
            return new CanonicalForm(canonical, fingerprint(canonical));
        } catch (RuntimeException e) {
            log.warn("Canonicalization failed, keeping raw text as canonical: {}", e.getMessage());
            return new CanonicalForm(rawText, fingerprint(rawText));
        }
    }

    /**
     * MD5 fingerprint of a text, used for raw and canonical statement identity alike.
     */
    public String fingerprint(String text) {
        return DigestUtils.md5Hex(text == null ? "" : text);
    }

    /**
     * Rewrites every {@code IN (p1, p2, ...)} whose members are all positional
     * placeholders to {@code IN ($?)}. Lists holding anything else (literals,
     * sub-selects, expressions) are left alone.
     */
    String collapseInLists(String sql) {
        Matcher matcher = IN_LIST_OPEN.matcher(sql);
        StringBuilder out = new StringBuilder(sql.length());
        int copied = 0;
        int searchFrom = 0;

        while (searchFrom < sql.length() && matcher.find(searchFrom)) {
            int listEnd = placeholderListEnd(sql, matcher.end());
            if (listEnd < 0) {
                searchFrom = matcher.end();
                continue;
            }
            // keyword keeps its case, spacing inside the list is normalized
            out.append(sql, copied, matcher.start() + 2).append(" (").append(PLACEHOLDER).append(')');
            copied = listEnd;
            searchFrom = listEnd;
        }

        out.append(sql, copied, sql.length());
        return out.toString();
    }

    // Scanned by hand: a regex repetition over thousands of list members overflows the stack.
    private static int placeholderListEnd(String sql, int from) {
        int i = skipWhitespace(sql, from);
        while (true) {
            int next = placeholderEnd(sql, i);
            if (next < 0) {
                return -1;
            }
            i = skipWhitespace(sql, next);
            if (i >= sql.length()) {
                return -1;
            }
            char c = sql.charAt(i);
            if (c == ')') {
                return i + 1;
            }
            if (c != ',') {
                return -1;
            }
            i = skipWhitespace(sql, i + 1);
        }
    }

    private static int placeholderEnd(String sql, int from) {
        if (from + 1 >= sql.length() || sql.charAt(from) != '$') {
            return -1;
        }
        if (sql.charAt(from + 1) == '?') {
            return from + 2;
        }
        int i = from + 1;
        while (i < sql.length() && sql.charAt(i) >= '0' && sql.charAt(i) <= '9') {
            i++;
        }
        return i > from + 1 ? i : -1;
    }

    private static int skipWhitespace(String sql, int from) {
        int i = from;
        while (i < sql.length() && Character.isWhitespace(sql.charAt(i))) {
            i++;
        }
        return i;
    }
}
