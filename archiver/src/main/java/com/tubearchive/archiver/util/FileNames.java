package com.tubearchive.archiver.util;

import com.tubearchive.archiver.model.VideoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filesystem-safe names for archived videos.
 */
public final class FileNames {

    private static final Logger logger = LoggerFactory.getLogger(FileNames.class);

    static final int MAX_NAME_LENGTH = 180;
    static final Set<String> TEMPLATE_FIELDS = Set.of("title", "uploader", "upload_date", "ext");

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/:*?\"<>|]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FileNames() {
    }

    /**
     * Strips characters that are unsafe in file names, collapses whitespace,
     * NFC-normalizes and trims to {@value #MAX_NAME_LENGTH} characters.
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String cleaned = UNSAFE_CHARS.matcher(name).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        cleaned = Normalizer.normalize(cleaned, Normalizer.Form.NFC);
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH).stripTrailing();
        }
        return cleaned;
    }

    /**
     * {@code Title - Channel (MM-YYYY)}, or {@code Title - Channel} without a
     * valid upload date.
     */
    public static String displayName(String title, String channel, String uploadDate) {
        String base = sanitize(title) + " - " + sanitize(channel);
        if (VideoMetadata.isCompactDate(uploadDate)) {
            return base + " (" + uploadDate.substring(4, 6) + "-" + uploadDate.substring(0, 4) + ")";
        }
        return base;
    }

    public static String displayName(VideoMetadata meta) {
        return displayName(meta.title(), meta.channel(), meta.uploadDate());
    }

    /**
     * Destination file name. Uses the configured template when it renders,
     * otherwise {@code <display name>_<first 8 chars of id>.<ext>}.
     */
    public static String finalFileName(String template, VideoMetadata meta, String videoId, String extension) {
        if (template != null && !template.isBlank()) {
            Map<String, String> fields = Map.of(
                    "title", sanitize(meta.title().isBlank() ? videoId : meta.title()),
                    "uploader", sanitize(meta.channel()),
                    "upload_date", meta.uploadDate(),
                    "ext", extension);
            try {
                return renderTemplate(template, fields);
            } catch (IllegalArgumentException e) {
                logger.warn("[{}] filename_template unusable ({}); using default name", videoId, e.getMessage());
            }
        }
        String shortId = videoId.length() > 8 ? videoId.substring(0, 8) : videoId;
        return displayName(meta) + "_" + shortId + "." + extension;
    }

    /**
     * Renders {@code %(name)s} placeholders; {@code %%} is a literal percent.
     *
     * @throws IllegalArgumentException on an unknown field or a stray {@code %}
     */
    static String renderTemplate(String template, Map<String, String> fields) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            if (i + 1 < template.length() && template.charAt(i + 1) == '%') {
                out.append('%');
                i += 2;
                continue;
            }
            int close = template.indexOf(')', i);
            if (i + 1 >= template.length() || template.charAt(i + 1) != '('
                    || close < 0 || close + 1 >= template.length() || template.charAt(close + 1) != 's') {
                throw new IllegalArgumentException("Malformed placeholder at index " + i + " in " + template);
            }
            String key = template.substring(i + 2, close);
            if (!TEMPLATE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown template field: " + key);
            }
            out.append(fields.getOrDefault(key, ""));
            i = close + 2;
        }
        return out.toString();
    }
}
