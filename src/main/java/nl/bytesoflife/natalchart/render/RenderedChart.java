package nl.bytesoflife.natalchart.render;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Rendered chart: SVG text, the HTML document embedding it and the SHA-256 of the SVG.
 */
public record RenderedChart(String svg, String html, String contentHash) {

    public static RenderedChart of(String svg, String html) {
        return new RenderedChart(svg, html, sha256(svg));
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
