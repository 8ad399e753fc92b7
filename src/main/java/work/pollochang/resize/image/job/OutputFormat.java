package work.pollochang.resize.image.job;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * 輸出的編碼格式。
 */
public enum OutputFormat {
    JPEG("jpg", true),
    PNG("png", false);

    private final String formatName;
    private final boolean lossy;

    OutputFormat(String formatName, boolean lossy) {
        this.formatName = formatName;
        this.lossy = lossy;
    }

    /**
     * ImageIO 使用的格式名稱。
     */
    public String getFormatName() { return formatName; }

    public boolean isLossy() { return lossy; }

    /**
     * JPEG 不支援透明度。
     */
    public boolean supportsTransparency() { return this == PNG; }

    @JsonCreator
    public static OutputFormat parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return PNG;
            default:
                throw new IllegalArgumentException("不支援的輸出格式: " + value);
        }
    }
}
