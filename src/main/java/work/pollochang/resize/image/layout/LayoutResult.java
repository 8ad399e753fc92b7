package work.pollochang.resize.image.layout;

/**
 * 一次縮放的版面計算結果，交由後端的繪製步驟使用。
 *
 * @param copyRegion   要從來源圖片取樣的區域 (預設為整張圖)
 * @param canvasSize   輸出畫布的像素尺寸
 * @param targetRegion 取樣內容在畫布上的放置位置，其餘部分填背景色
 */
public record LayoutResult(Rect copyRegion, PixelSize canvasSize, Rect targetRegion) {}
