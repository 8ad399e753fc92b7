package work.pollochang.resize.image.layout;

/**
 * 版面計算過程中使用的浮點尺寸。
 * <p>
 * 只有在 {@link ResizeLayout} 的最後一步才會取整數，中間的計算都保留小數，避免誤差累積。
 *
 * @param width  寬度
 * @param height 高度
 */
public record Size(double width, double height) {

    /**
     * 寬高比 (寬 / 高)。
     */
    public double aspectRatio() {
        return width / height;
    }

    @Override
    public String toString() {
        return "(" + width + ", " + height + ')';
    }
}
