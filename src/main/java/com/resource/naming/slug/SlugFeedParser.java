package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.error.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the upstream slug definitions snapshot: an HCL-like {@code az = { name = "slug" ... }} block.
 * Parsing is permissive but bounded; entries that are too long or carry unexpected characters
 * are rejected before they can reach the slug table.
 */
public class SlugFeedParser {
    private static final Logger log = LoggerFactory.getLogger(SlugFeedParser.class);

    public static final String SOURCE = "upstream";
    public static final int MAX_NAME_LENGTH = 128;
    public static final int MAX_SLUG_LENGTH = 32;

    private static final String BLOCK_START = "az = {";
    private static final Pattern ENTRY = Pattern.compile("\\s*(\\w+)\\s*=\\s*\"([^\"\\n]+)\"");
    private static final Pattern NAME = Pattern.compile("^[a-z0-9_]+$");
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+$");

    /**
     * Outcome of a parse.
     *
     * @param mappings accepted mappings, one per resource type, in feed order
     * @param rejected number of entries dropped by validation
     */
    public record ParseResult(List<SlugMapping> mappings, int rejected) {
        public ParseResult {
            mappings = List.copyOf(mappings);
        }
    }

    /**
     * @throws UpstreamException if the snapshot is empty or has no {@code az} block
     */
    public ParseResult parse(String snapshot) {
        if (snapshot == null || snapshot.isBlank()) {
            throw new UpstreamException("Slug feed snapshot is empty");
        }
        int start = snapshot.indexOf(BLOCK_START);
        if (start < 0) {
            throw new UpstreamException("Could not locate 'az = { ... }' block in slug feed");
        }
        int end = findBlockEnd(snapshot, start + BLOCK_START.length());
        String block = snapshot.substring(start + BLOCK_START.length(), end);

        Instant now = Instant.now();
        Map<String, SlugMapping> accepted = new LinkedHashMap<>();
        int rejected = 0;
        for (String line : block.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("//")) {
                continue;
            }
            Matcher matcher = ENTRY.matcher(line);
            if (!matcher.lookingAt() || !matcher.group(0).trim().equals(trimmed)) {
                log.warn("slug.feed.rejected reason=malformed length={}", trimmed.length());
                rejected++;
                continue;
            }
            String name = matcher.group(1).toLowerCase(Locale.ROOT);
            String slug = matcher.group(2).trim().toLowerCase(Locale.ROOT);
            String reason = rejectionReason(name, slug);
            if (reason != null) {
                log.warn("slug.feed.rejected reason={} name={}", reason, abbreviate(name));
                rejected++;
                continue;
            }
            accepted.put(name, new SlugMapping(name, slug, name.replace('_', ' '), now, SOURCE));
        }
        if (accepted.isEmpty() && rejected == 0) {
            throw new UpstreamException("Slug feed 'az' block contains no entries");
        }
        log.info("slug.feed.parsed accepted={} rejected={}", accepted.size(), rejected);
        return new ParseResult(new ArrayList<>(accepted.values()), rejected);
    }

    private static int findBlockEnd(String snapshot, int from) {
        int end = snapshot.indexOf("}\n", from);
        if (end < 0) {
            end = snapshot.indexOf('}', from);
        }
        if (end < 0) {
            throw new UpstreamException("Unterminated 'az = { ... }' block in slug feed");
        }
        return end;
    }

    private static String rejectionReason(String name, String slug) {
        if (name.length() > MAX_NAME_LENGTH) {
            return "name_too_long";
        }
        if (slug.length() > MAX_SLUG_LENGTH) {
            return "slug_too_long";
        }
        if (slug.indexOf('\'') >= 0 || slug.indexOf('`') >= 0) {
            return "quote_in_slug";
        }
        if (!NAME.matcher(name).matches()) {
            return "invalid_name";
        }
        if (!SLUG.matcher(slug).matches()) {
            return "invalid_slug";
        }
        return null;
    }

    private static String abbreviate(String value) {
        return value.length() <= 64 ? value : value.substring(0, 64) + "...";
    }
}
