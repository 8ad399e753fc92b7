package work.pollochang.resize.image.job;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * 指定寬高與原圖長寬比不同時的處理方式。
 */
public enum FitMode {
    MAX("等比縮放至框內", "max", "fit", "inside"),
    PAD("等比縮放並補邊", "pad"),
    CROP("裁切填滿", "crop", "fill"),
    STRETCH("拉伸變形", "stretch"),
    // 沒有實作內容感知縮放，行為與 STRETCH 相同
    CARVE("與拉伸相同", "carve");

    private final String description;
    private final String[] aliases;

    FitMode(String description, String... aliases) {
        this.description = description;
        this.aliases = aliases;
    }

    public String getDescription() { return description; }

    /**
     * 不分大小寫解析模式名稱，也接受列舉常數名稱。
     *
     * @throws IllegalArgumentException 無法辨識的名稱
     */
    @JsonCreator
    public static FitMode parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FitMode mode : values()) {
            if (mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return mode;
            }
            for (String alias : mode.aliases) {
                if (alias.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("無法辨識的縮放模式: " + value);
    }
}
