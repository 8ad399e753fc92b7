package work.pollochang.resize.image.core;

import work.pollochang.resize.image.job.OutputFormat;
import work.pollochang.resize.image.layout.PixelSize;
import work.pollochang.resize.image.layout.Rect;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 解碼、繪製與編碼的後端。版面計算與縮放管線只透過這個介面操作圖片，
 * 因此可以用假的後端進行測試。
 *
 * @param <I> 後端使用的圖片型別
 */
public interface ImageBackend<I extends BackendImage> {

    /**
     * 從位元組串流解碼圖片。不得關閉 {@code source}。
     *
     * @param source            來源串流
     * @param honorColorProfile 是否套用內嵌的色彩描述檔
     * @throws ImageDecodeException 內容不是支援的圖片格式或已損毀
     * @throws IOException          讀取串流失敗
     */
    I decode(InputStream source, boolean honorColorProfile) throws IOException;

    /**
     * 將 {@code source} 的 {@code copyRegion} 以高品質取樣繪製到 {@code canvasSize} 畫布的
     * {@code targetRegion}，其餘部分填入背景色。不得釋放 {@code source}。
     *
     * @throws ImageRenderException 繪製失敗
     */
    I render(I source, Rect copyRegion, PixelSize canvasSize, Rect targetRegion,
             Color background, OutputFormat format) throws IOException;

    /**
     * 將圖片編碼寫入 {@code target}。不得關閉 {@code target}。
     *
     * @param quality 0 到 100，PNG 忽略此參數
     * @throws ImageEncodeException 編碼失敗
     */
    void encode(I image, OutputFormat format, int quality, OutputStream target) throws IOException;
}
