package work.pollochang.resize.image.layout;

/**
 * 以像素為單位的整數尺寸，例如要配置的畫布大小。
 *
 * @param width  寬度，至少為 1
 * @param height 高度，至少為 1
 */
public record PixelSize(int width, int height) {

    public PixelSize {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("像素尺寸必須至少為 1x1: " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
