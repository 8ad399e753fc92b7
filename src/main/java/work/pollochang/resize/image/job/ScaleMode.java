package work.pollochang.resize.image.job;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * 是否允許放大超過原圖尺寸。內容與畫布可分開決定。
 */
public enum ScaleMode {
    DOWNSCALE_ONLY("只縮小", "down", "downscaleonly"),
    BOTH("允許放大", "both"),
    UPSCALE_CANVAS("只放大畫布", "canvas", "upscalecanvas");

    private final String description;
    private final String[] aliases;

    ScaleMode(String description, String... aliases) {
        this.description = description;
        this.aliases = aliases;
    }

    public String getDescription() { return description; }

    @JsonCreator
    public static ScaleMode parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScaleMode mode : values()) {
            if (mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return mode;
            }
            for (String alias : mode.aliases) {
                if (alias.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("無法辨識的放大模式: " + value);
    }
}
