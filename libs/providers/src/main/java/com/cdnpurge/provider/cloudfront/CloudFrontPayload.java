package com.cdnpurge.provider.cloudfront;

import com.cdnpurge.invalidation.InvalidationSerializationException;
import com.cdnpurge.invalidation.ProviderType;
import java.util.List;

/**
 * Builds the {@code InvalidationBatch} XML document CloudFront expects.
 *
 * <p>Every path is XML-escaped. Non-ASCII characters pass through unchanged and are carried by the
 * UTF-8 encoding of the body.
 */
public final class CloudFrontPayload {

    public static final int MAX_PATHS = ProviderType.CLOUDFRONT.defaultMaxBatchSize();

    private CloudFrontPayload() {
        // utility class
    }

    /**
     * @throws InvalidationSerializationException if {@code paths} is empty, exceeds
     *         {@link #MAX_PATHS}, or holds a character XML 1.0 cannot carry
     */
    public static String toXml(List<String> paths, String callerReference) {
        if (paths == null || paths.isEmpty()) {
            throw new InvalidationSerializationException("CloudFront batch must contain at least one path");
        }
        if (paths.size() > MAX_PATHS) {
            throw new InvalidationSerializationException(
                    "CloudFront batch of " + paths.size() + " paths exceeds the limit of " + MAX_PATHS);
        }

        StringBuilder xml = new StringBuilder(128 + paths.size() * 48);
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<InvalidationBatch>\n")
                .append("    <Paths>\n")
                .append("        <Quantity>").append(paths.size()).append("</Quantity>\n")
                .append("        <Items>\n");
        for (String path : paths) {
            xml.append("            <Path>").append(escape(path)).append("</Path>\n");
        }
        xml.append("        </Items>\n")
                .append("    </Paths>\n")
                .append("    <CallerReference>").append(escape(callerReference)).append("</CallerReference>\n")
                .append("</InvalidationBatch>");
        return xml.toString();
    }

    /** Escapes the five XML special characters. */
    public static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> {
                    if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                        throw new InvalidationSerializationException(
                                String.format("Character U+%04X cannot be encoded in XML", (int) c));
                    }
                    out.append(c);
                }
            }
        }
        return out.toString();
    }
}
