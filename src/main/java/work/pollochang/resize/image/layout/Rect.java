package work.pollochang.resize.image.layout;

/**
 * 浮點矩形，用來描述來源取樣區域與畫布上的放置區域 (可含次像素位移)。
 */
public record Rect(double x, double y, double width, double height) {

    public static Rect of(Size size) {
        return new Rect(0, 0, size.width(), size.height());
    }
}
