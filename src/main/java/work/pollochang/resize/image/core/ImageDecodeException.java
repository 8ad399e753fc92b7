package work.pollochang.resize.image.core;

/**
 * 來源不是支援的圖片格式，或內容已損毀。
 */
public class ImageDecodeException extends ImageProcessingException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
