package work.pollochang.resize.image.core;

/**
 * 輸出編碼時發生錯誤。
 */
public class ImageEncodeException extends ImageProcessingException {

    public ImageEncodeException(String message) {
        super(message);
    }

    public ImageEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
