package work.pollochang.resize.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.layout.LayoutResult;
import work.pollochang.resize.image.layout.ResizeLayout;
import work.pollochang.resize.image.layout.Size;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 縮放管線：讀取來源、解碼、計算版面、繪製，最後把結果交給 {@link ImageConsumer}。
 *
 * <p>資源釋放順序固定如下，不論哪個階段拋出例外：
 * <ol>
 *   <li>解碼後的來源圖片</li>
 *   <li>記憶體緩衝 (如果有)</li>
 *   <li>原始來源串流：關閉，或在 {@link StreamOption#LEAVE_SOURCE_OPEN} 時還原位置</li>
 *   <li>繪製結果：在 consumer 結束後釋放，consumer 失敗也一樣</li>
 * </ol>
 * 釋放資源時的錯誤不會取代原本的例外，而是以 suppressed 的方式附加並記錄在日誌中。
 *
 * <p>本類別沒有可變狀態，可同時在多個執行緒使用，只要每次呼叫使用各自的串流。
 *
 * @param <I> 後端的圖片型別
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ResizePipeline<I extends BackendImage> {

    private final ImageBackend<I> backend;
    private final Function<byte[], InputStream> bufferFactory;

    public ResizePipeline(ImageBackend<I> backend) {
        this(backend, SourceHandle.IN_MEMORY);
    }

    /**
     * @param bufferFactory {@link StreamOption#BUFFER_IN_MEMORY} 時用來包裝讀入的位元組
     */
    ResizePipeline(ImageBackend<I> backend, Function<byte[], InputStream> bufferFactory) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.bufferFactory = Objects.requireNonNull(bufferFactory, "bufferFactory must not be null");
    }

    /**
     * 執行一次縮放。
     *
     * @param source   來源串流
     * @param options  來源選項，只接受 {@link StreamOption#sourceOptions()}
     * @param job      縮放參數
     * @param consumer 接收縮放結果，呼叫結束後圖片即被釋放
     * @throws IllegalArgumentException 包含非來源的選項
     * @throws ImageDecodeException     來源不是支援的圖片
     * @throws ImageRenderException     繪製失敗
     * @throws IOException              讀取來源或 consumer 發生 I/O 錯誤
     */
    public void run(InputStream source, Set<StreamOption> options, ResizeJob job,
                    ImageConsumer<? super I> consumer) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");
        validateOptions(options);

        I destination = null;
        try {
            try (SourceHandle handle = SourceHandle.acquire(source, options, bufferFactory);
                 I decoded = backend.decode(handle.stream(), !job.ignoreIcc())) {

                Size originalSize = new Size(decoded.width(), decoded.height());
                LayoutResult layout = ResizeLayout.compute(originalSize, job);
                log.debug("原圖 {}x{} -> 畫布 {}, 取樣區域 {}, 放置區域 {}",
                        decoded.width(), decoded.height(),
                        layout.canvasSize(), layout.copyRegion(), layout.targetRegion());

                destination = backend.render(decoded, layout.copyRegion(), layout.canvasSize(),
                        layout.targetRegion(), job.background(), job.format());
            } catch (IOException | RuntimeException e) {
                // consumer 的例外不經過這裡，只記錄讀取與解碼階段附加的例外
                for (Throwable suppressed : e.getSuppressed()) {
                    log.warn("讀取來源階段失敗 ({})，另有附加的例外", e.toString(), suppressed);
                }
                throw e;
            }

            consumer.accept(destination);
        } finally {
            if (destination != null) {
                destination.close();
            }
        }
    }

    private static void validateOptions(Set<StreamOption> options) {
        Set<StreamOption> invalid = EnumSet.noneOf(StreamOption.class);
        invalid.addAll(options);
        invalid.removeAll(StreamOption.sourceOptions());
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("不支援的來源選項: " + invalid);
        }
    }
}
