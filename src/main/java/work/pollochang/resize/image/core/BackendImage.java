package work.pollochang.resize.image.core;

/**
 * 後端產生的圖片。縮放管線負責在使用完畢後呼叫 {@link #close()} 釋放資源。
 */
public interface BackendImage extends AutoCloseable {

    int width();

    int height();

    /**
     * 釋放圖片佔用的資源。不得拋出例外。
     */
    @Override
    void close();
}
