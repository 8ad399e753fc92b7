package work.pollochang.resize.image.core;

/**
 * 取樣或合成時發生錯誤。
 */
public class ImageRenderException extends ImageProcessingException {

    public ImageRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
