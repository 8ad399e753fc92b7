package work.pollochang.resize.image.job;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Builder;

import java.awt.Color;

/**
 * 一次縮放作業的參數，建立後不可變更。
 * <p>
 * 所有驗證都在建構時完成：指定的寬或高必須大於 0，品質會被限制在 {@value #MIN_QUALITY} 到
 * {@value #MAX_QUALITY} 之間。未指定的欄位使用預設值。
 *
 * <pre>{@code
 * ResizeJob job = ResizeJob.builder()
 *         .width(200)
 *         .height(200)
 *         .fitMode(FitMode.CROP)
 *         .format(OutputFormat.PNG)
 *         .build();
 * }</pre>
 *
 * @param width      目標寬度，{@code null} 表示不限制
 * @param height     目標高度，{@code null} 表示不限制
 * @param fitMode    長寬比的處理方式，預設 {@link FitMode#MAX}
 * @param scaleMode  是否允許放大，預設 {@link ScaleMode#DOWNSCALE_ONLY}
 * @param background 背景色，預設完全透明
 * @param format     輸出格式，預設 {@link OutputFormat#JPEG}
 * @param quality    JPEG 品質 (0-100)，預設 {@value #DEFAULT_QUALITY}
 * @param ignoreIcc  解碼時是否忽略內嵌的色彩描述檔
 */
@Builder(toBuilder = true)
public record ResizeJob(
        Integer width,
        Integer height,
        FitMode fitMode,
        ScaleMode scaleMode,
        @JsonDeserialize(using = ColorDeserializer.class) Color background,
        OutputFormat format,
        Integer quality,
        boolean ignoreIcc
) {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 100;
    public static final int DEFAULT_QUALITY = 90;

    public static final Color TRANSPARENT = new Color(0, 0, 0, 0);

    public ResizeJob {
        if (width != null && width <= 0) {
            throw new IllegalArgumentException("寬度必須大於 0: " + width);
        }
        if (height != null && height <= 0) {
            throw new IllegalArgumentException("高度必須大於 0: " + height);
        }
        fitMode = fitMode != null ? fitMode : FitMode.MAX;
        scaleMode = scaleMode != null ? scaleMode : ScaleMode.DOWNSCALE_ONLY;
        background = background != null ? background : TRANSPARENT;
        format = format != null ? format : OutputFormat.JPEG;
        quality = quality != null ? Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, quality)) : DEFAULT_QUALITY;
    }

    /**
     * 是否有指定寬或高。兩者皆未指定時維持原尺寸。
     */
    public boolean hasDimensions() {
        return width != null || height != null;
    }
}
