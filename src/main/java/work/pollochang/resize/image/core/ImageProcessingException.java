package work.pollochang.resize.image.core;

import java.io.IOException;

/**
 * 後端處理圖片失敗。相同的輸入重試也會得到相同結果，因此不做重試。
 */
public class ImageProcessingException extends IOException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
