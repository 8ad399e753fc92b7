package work.pollochang.resize.image.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

// 封裝圖片與其讀取器，方便資源管理；繪製產生的圖片沒有讀取器
public record DecodedImage(BufferedImage image, ImageReader reader) implements BackendImage {

    public DecodedImage(BufferedImage image) {
        this(image, null);
    }

    @Override
    public int width() {
        return image.getWidth();
    }

    @Override
    public int height() {
        return image.getHeight();
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
