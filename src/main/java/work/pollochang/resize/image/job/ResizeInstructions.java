package work.pollochang.resize.image.job;

import lombok.extern.slf4j.Slf4j;

import java.awt.Color;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析查詢字串格式的縮放指令，例如 {@code width=200&height=100&mode=crop&format=png}。
 * <p>
 * 支援的鍵 (不分大小寫)：
 * <ul>
 *   <li>{@code width}, {@code w}, {@code maxwidth}</li>
 *   <li>{@code height}, {@code h}, {@code maxheight}</li>
 *   <li>{@code mode} - max, pad, crop, stretch, carve</li>
 *   <li>{@code scale} - down, both, canvas</li>
 *   <li>{@code bgcolor} - RGB / RRGGBB / RRGGBBAA 十六進位，或 transparent、white、black</li>
 *   <li>{@code format} - jpg, jpeg, png</li>
 *   <li>{@code quality} - 0 到 100</li>
 *   <li>{@code ignoreicc} - true / false</li>
 * </ul>
 * 無法辨識的鍵會被忽略。值無效時拋出 {@link IllegalArgumentException}。
 */
@Slf4j
public final class ResizeInstructions {

    private static final Pattern HEX_COLOR = Pattern.compile("#?([0-9a-fA-F]{3}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");

    private ResizeInstructions() {}

    public static ResizeJob parse(String query) {
        ResizeJob.ResizeJobBuilder builder = ResizeJob.builder();
        if (query == null || query.isBlank()) {
            return builder.build();
        }

        String trimmed = query.trim();
        if (trimmed.startsWith("?")) {
            trimmed = trimmed.substring(1);
        }

        for (String pair : trimmed.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq)).trim().toLowerCase(Locale.ROOT);
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1)).trim();

            switch (key) {
                case "width":
                case "w":
                case "maxwidth":
                    builder.width(parseInt(key, value));
                    break;
                case "height":
                case "h":
                case "maxheight":
                    builder.height(parseInt(key, value));
                    break;
                case "mode":
                    builder.fitMode(FitMode.parse(value));
                    break;
                case "scale":
                    builder.scaleMode(ScaleMode.parse(value));
                    break;
                case "bgcolor":
                    builder.background(parseColor(value));
                    break;
                case "format":
                    builder.format(OutputFormat.parse(value));
                    break;
                case "quality":
                    builder.quality(parseInt(key, value));
                    break;
                case "ignoreicc":
                    builder.ignoreIcc(parseBoolean(key, value));
                    break;
                default:
                    log.debug("忽略無法辨識的指令: {}", key);
            }
        }
        return builder.build();
    }

    /**
     * 解析色彩字串。十六進位格式的第四組位元組為 alpha。
     */
    public static Color parseColor(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "transparent":
                return ResizeJob.TRANSPARENT;
            case "white":
                return Color.WHITE;
            case "black":
                return Color.BLACK;
            default:
                break;
        }

        Matcher matcher = HEX_COLOR.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("無法辨識的顏色: " + value);
        }

        String hex = matcher.group(1);
        if (hex.length() == 3) {
            // RGB -> RRGGBB
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        int r = Integer.parseInt(hex.substring(0, 2), 16);
        int g = Integer.parseInt(hex.substring(2, 4), 16);
        int b = Integer.parseInt(hex.substring(4, 6), 16);
        int a = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) : 255;
        return new Color(r, g, b, a);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("指令 " + key + " 需要整數: " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if (value.isEmpty() || value.equalsIgnoreCase("true") || value.equals("1")) {
            return true;
        }
        if (value.equalsIgnoreCase("false") || value.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException("指令 " + key + " 需要 true 或 false: " + value);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
