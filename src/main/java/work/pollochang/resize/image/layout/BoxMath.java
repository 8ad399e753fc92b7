package work.pollochang.resize.image.layout;

/**
 * 盒子縮放相關的幾何運算。所有方法都是純函式。
 */
public final class BoxMath {

    private BoxMath() {}

    /**
     * 在不改變 {@code content} 長寬比的情況下，找出能完整放入 {@code bounds} 的最大尺寸。
     * <p>
     * 任何一邊為 0 或負數時不做除法，結果每一邊至少為 1。
     *
     * @param content 要縮放的內容尺寸
     * @param bounds  限制範圍
     * @return 縮放後的尺寸 (未取整數)
     */
    public static Size scaleInside(Size content, Size bounds) {
        if (content.width() <= 0 || content.height() <= 0 || bounds.width() <= 0 || bounds.height() <= 0) {
            return new Size(Math.max(1, bounds.width()), Math.max(1, bounds.height()));
        }

        double widthRatio = bounds.width() / content.width();
        double heightRatio = bounds.height() / content.height();
        double scale = Math.min(widthRatio, heightRatio);

        return new Size(Math.max(1, content.width() * scale), Math.max(1, content.height() * scale));
    }

    /**
     * 將 {@code inner} 置中於 {@code outer} 內。內容比外框大時位移為負。
     */
    public static Rect centerInside(Size inner, Rect outer) {
        double x = outer.x() + (outer.width() - inner.width()) / 2;
        double y = outer.y() + (outer.height() - inner.height()) / 2;
        return new Rect(x, y, inner.width(), inner.height());
    }

    /**
     * {@code a} 的兩個邊是否都不大於 {@code b}。
     */
    public static boolean fitsInside(Size a, Size b) {
        return a.width() <= b.width() && a.height() <= b.height();
    }

    /**
     * 兩邊各自四捨五入到最接近的整數。
     */
    public static Size roundPoints(Size size) {
        return new Size(Math.round(size.width()), Math.round(size.height()));
    }

    /**
     * 四捨五入並保證每邊至少為 1，用於版面計算的最後一步。
     */
    public static PixelSize toPixelSize(Size size) {
        int width = (int) Math.max(1, Math.round(size.width()));
        int height = (int) Math.max(1, Math.round(size.height()));
        return new PixelSize(width, height);
    }
}
