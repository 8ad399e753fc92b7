package work.pollochang.resize.image;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.resize.image.core.ImageDecodeException;
import work.pollochang.resize.image.core.ImageProcessingException;
import work.pollochang.resize.image.core.ResizeResult;
import work.pollochang.resize.image.core.StreamOption;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.report.ResizeReport;
import work.pollochang.resize.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * 處理單一檔案的縮放，並將結果轉成 {@link ResizeReport}，不向外拋出例外。
 */
@Slf4j
public final class ResizeTask {

    private ResizeTask() {}

    /**
     * 縮放 {@code inputPath}，輸出到 {@code outputDir} 下同名 (副檔名依輸出格式) 的檔案。
     *
     * @param inputPath 來源檔案
     * @param outputDir 輸出目錄
     * @param job       縮放參數
     * @param options   串流選項
     * @param resizer   執行縮放的物件
     * @return 處理結果與前後檔案大小
     */
    public static ResizeReport processImage(
            Path inputPath,
            Path outputDir,
            ResizeJob job,
            Set<StreamOption> options,
            ImageResizer<?> resizer
    ) {
        long originalSize;
        try {
            if (!Files.exists(inputPath) || !Files.isReadable(inputPath)) {
                log.warn("{} - 檔案不存在或不可讀，跳過", inputPath);
                return new ResizeReport(ResizeResult.SKIPPED_NOT_FOUND, 0, 0);
            }
            originalSize = Files.size(inputPath);
        } catch (IOException e) {
            log.warn("{} - 無法讀取檔案大小", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_IO_ERROR, 0, 0);
        }

        Path outputFile = outputDir.resolve(
                FileTools.replaceExtension(inputPath.getFileName().toString(), job.format().getFormatName()));
        log.debug("{} - 開始處理", inputPath);

        try {
            resizer.resize(inputPath, options, outputFile, job);
            long resizedSize = Files.size(outputFile);
            log.info("{} - 處理成功 -> {} (大小: {} -> {})",
                    inputPath, outputFile,
                    FileTools.formatFileSize(originalSize), FileTools.formatFileSize(resizedSize));
            return new ResizeReport(ResizeResult.RESIZED_SUCCESS, originalSize, resizedSize);
        } catch (ImageDecodeException e) {
            log.warn("{} - 非支援格式或檔案損毀", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_UNSUPPORTED_FORMAT, originalSize, 0);
        } catch (ImageProcessingException e) {
            log.warn("{} - 繪製或編碼失敗", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_PROCESSING, originalSize, 0);
        } catch (IOException e) {
            log.warn("{} - 處理圖片時發生 I/O 錯誤", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_IO_ERROR, originalSize, 0);
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大)", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_OUT_OF_MEMORY, originalSize, 0);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", inputPath, e);
            return new ResizeReport(ResizeResult.FAILED_UNKNOWN, originalSize, 0);
        }
    }
}
