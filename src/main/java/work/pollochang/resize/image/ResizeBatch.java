package work.pollochang.resize.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.resize.image.core.ResizeResult;
import work.pollochang.resize.image.core.StreamOption;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.report.ResizeReport;
import work.pollochang.resize.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 進行批次縮放。檔案列表每行一個路徑，每個檔案各自呼叫一次縮放管線。
 */
@Setter
@Slf4j
public class ResizeBatch {

    private Path fileListPath;
    private Path outputDir;
    private ResizeJob job;
    private Set<StreamOption> options = EnumSet.noneOf(StreamOption.class);
    private long timeOutHr = 24;
    private int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    private ImageResizer<?> resizer = ImageResizer.withDefaultBackend();

    /**
     * @return 各種結果的檔案數量
     * @throws IOException 無法建立輸出目錄或讀取檔案列表
     */
    public Map<ResizeResult, Long> execute() throws IOException {
        FileTools.ensureDirectoryExists(outputDir);

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<ResizeResult, AtomicLong> counters = new EnumMap<>(ResizeResult.class);
        for (ResizeResult result : ResizeResult.values()) {
            counters.put(result, new AtomicLong(0));
        }
        AtomicLong totalFiles = new AtomicLong(0);
        AtomicLong totalOriginalSize = new AtomicLong(0);
        AtomicLong totalResizedSize = new AtomicLong(0);

        log.info("建立固定大小為 {} 的執行緒池。", threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            // 使用 Stream API 逐行讀取檔案，避免一次性將整個列表載入記憶體
            try (Stream<String> lines = Files.lines(fileListPath)) {
                lines.forEach(line -> {
                    if (line != null && !line.trim().isEmpty()) {
                        totalFiles.incrementAndGet();
                        Path inputPath = Paths.get(line.trim());
                        executor.submit(() -> {
                            ResizeReport report = ResizeTask.processImage(inputPath, outputDir, job, options, resizer);

                            counters.get(report.result()).incrementAndGet();
                            totalOriginalSize.addAndGet(report.originalSize());
                            totalResizedSize.addAndGet(report.resizedSize());
                        });
                    }
                });
            }

            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();

            try {
                if (!executor.awaitTermination(timeOutHr, TimeUnit.HOURS)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt(); // 恢復中斷狀態
            }
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        long successCount = counters.get(ResizeResult.RESIZED_SUCCESS).get();
        long skippedCount = counters.get(ResizeResult.SKIPPED_NOT_FOUND).get();
        long failedCount = totalFiles.get() - successCount - skippedCount;

        log.info("處理結果 -> 總計: {}, 成功縮放: {}, 跳過: {}, 失敗: {}",
                totalFiles.get(), successCount, skippedCount, failedCount);
        counters.forEach((result, count) -> {
            if (count.get() > 0) {
                log.info("  {}: {}", result.getDescription(), count.get());
            }
        });

        log.info("========================================空間統計報告========================================");
        log.info(" 原始檔案總大小: {}", FileTools.formatFileSize(totalOriginalSize.get()));
        log.info(" 縮放後檔案總大小: {}", FileTools.formatFileSize(totalResizedSize.get()));
        log.info("========================================空間統計報告========================================");

        Map<ResizeResult, Long> summary = new EnumMap<>(ResizeResult.class);
        counters.forEach((result, count) -> summary.put(result, count.get()));
        return summary;
    }
}
