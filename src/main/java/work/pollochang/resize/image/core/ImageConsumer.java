package work.pollochang.resize.image.core;

import java.io.IOException;

/**
 * 接收縮放結果的回呼。呼叫結束後圖片會立即被釋放，不可保留參照。
 */
@FunctionalInterface
public interface ImageConsumer<I extends BackendImage> {

    void accept(I image) throws IOException;
}
