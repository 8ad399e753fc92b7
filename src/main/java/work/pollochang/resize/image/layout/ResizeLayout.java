package work.pollochang.resize.image.layout;

import work.pollochang.resize.image.job.FitMode;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.job.ScaleMode;

import java.util.Objects;

/**
 * 版面計算：由原圖尺寸與 {@link ResizeJob} 算出來源取樣區域、畫布尺寸與內容放置區域。
 * <p>
 * 計算過程全部使用浮點數，只在最後一步取整數 (四捨五入，每邊至少 1)。
 * 相同輸入永遠得到相同結果，不做任何 I/O。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class ResizeLayout {

    private ResizeLayout() {}

    /**
     * 計算縮放版面。
     *
     * @param originalSize 原圖尺寸
     * @param job          縮放參數 (寬高已在建構時驗證)
     * @return 版面計算結果
     */
    public static LayoutResult compute(Size originalSize, ResizeJob job) {
        Objects.requireNonNull(originalSize, "originalSize must not be null");
        Objects.requireNonNull(job, "job must not be null");

        Rect originalRect = Rect.of(originalSize);
        Rect copyRegion = originalRect;
        Size targetSize;
        Size canvasSize;

        if (job.hasDimensions()) {
            Size bounds = resolveBounds(originalSize, job);

            FitMode mode = job.fitMode();
            switch (mode) {
                case MAX:
                    canvasSize = targetSize = BoxMath.scaleInside(originalSize, bounds);
                    break;
                case PAD:
                    canvasSize = bounds;
                    targetSize = BoxMath.scaleInside(originalSize, canvasSize);
                    break;
                case CROP:
                    canvasSize = targetSize = bounds;
                    // 來源中與目標長寬比相同的最大區域，置中裁切
                    Size sourceSize = BoxMath.roundPoints(BoxMath.scaleInside(canvasSize, originalSize));
                    copyRegion = BoxMath.centerInside(sourceSize, originalRect);
                    break;
                default:
                    // STRETCH 與 CARVE 都直接拉伸
                    canvasSize = targetSize = bounds;
                    break;
            }
        } else {
            canvasSize = targetSize = originalSize;
        }

        // 不允許放大時，原圖已能放入目標就維持原尺寸
        ScaleMode scale = job.scaleMode();
        if (scale != ScaleMode.BOTH && BoxMath.fitsInside(originalSize, targetSize)) {
            targetSize = originalSize;
            copyRegion = originalRect;

            if (scale != ScaleMode.UPSCALE_CANVAS) {
                canvasSize = targetSize;
            }
        }

        PixelSize canvas = BoxMath.toPixelSize(canvasSize);
        PixelSize target = BoxMath.toPixelSize(targetSize);
        Rect targetRegion = BoxMath.centerInside(
                new Size(target.width(), target.height()),
                new Rect(0, 0, canvas.width(), canvas.height()));

        return new LayoutResult(copyRegion, canvas, targetRegion);
    }

    /**
     * 只指定一邊時，依原圖長寬比推算另一邊。長寬比一律以原圖尺寸計算。
     */
    private static Size resolveBounds(Size originalSize, ResizeJob job) {
        double imageRatio = originalSize.aspectRatio();
        Integer width = job.width();
        Integer height = job.height();

        if (width != null && height != null) {
            return new Size(width, height);
        } else if (width != null) {
            return new Size(width, width / imageRatio);
        } else {
            return new Size(height * imageRatio, height);
        }
    }
}
