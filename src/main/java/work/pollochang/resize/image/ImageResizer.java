package work.pollochang.resize.image;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.resize.image.core.BackendImage;
import work.pollochang.resize.image.core.DecodedImage;
import work.pollochang.resize.image.core.ImageBackend;
import work.pollochang.resize.image.core.ImageConsumer;
import work.pollochang.resize.image.core.Java2DImageBackend;
import work.pollochang.resize.image.core.ResizePipeline;
import work.pollochang.resize.image.core.StreamOption;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.tools.FileTools;
import work.pollochang.resize.image.tools.StreamTools;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 圖片縮放的進入點，支援 {檔案路徑, 輸入串流} × {檔案路徑, 輸出串流, 回呼} 的各種組合。
 *
 * <p>使用範例：
 * <pre>{@code
 * ImageResizer<DecodedImage> resizer = ImageResizer.withDefaultBackend();
 * ResizeJob job = ResizeJob.builder().width(200).height(200).fitMode(FitMode.CROP).build();
 * resizer.resize(Paths.get("in.jpg"), EnumSet.of(StreamOption.CREATE_DESTINATION_DIRECTORY),
 *         Paths.get("out/thumb.jpg"), job);
 * }</pre>
 *
 * <p>以檔案路徑作為來源時，串流由本類別開啟與關閉，只有 {@link StreamOption#BUFFER_IN_MEMORY}
 * 有作用；來源與目的為同一個檔案時會自動啟用。
 *
 * <p>寫入檔案時會先編碼到記憶體再寫入，編碼失敗不會留下不完整的檔案。
 * 目的目錄不存在且沒有指定 {@link StreamOption#CREATE_DESTINATION_DIRECTORY} 時拋出
 * {@link NoSuchFileException}。
 *
 * @param <I> 後端的圖片型別
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImageResizer<I extends BackendImage> {

    private final ImageBackend<I> backend;
    private final ResizePipeline<I> pipeline;

    public ImageResizer(ImageBackend<I> backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.pipeline = new ResizePipeline<>(backend);
    }

    public static ImageResizer<DecodedImage> withDefaultBackend() {
        return new ImageResizer<>(new Java2DImageBackend());
    }

    /**
     * 讀取檔案，寫入檔案。
     */
    public void resize(Path source, Set<StreamOption> options, Path destination, ResizeJob job) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(job, "job must not be null");

        Set<StreamOption> effective = pathSourceOptions(options);
        if (source.toAbsolutePath().normalize().equals(destination.toAbsolutePath().normalize())) {
            // 讀寫同一個檔案，必須先讀完並關閉來源
            effective.add(StreamOption.BUFFER_IN_MEMORY);
        }
        resize(Files.newInputStream(source), effective, destination, job);
    }

    /**
     * 讀取檔案，寫入串流。
     */
    public void resize(Path source, Set<StreamOption> options, OutputStream destination, ResizeJob job) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(job, "job must not be null");

        Set<StreamOption> effective = pathSourceOptions(options);
        resize(Files.newInputStream(source), effective, destination, job);
    }

    /**
     * 讀取檔案，結果交給回呼。
     */
    public void resize(Path source, Set<StreamOption> options, ResizeJob job, ImageConsumer<? super I> consumer) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");

        Set<StreamOption> effective = pathSourceOptions(options);
        resize(Files.newInputStream(source), effective, job, consumer);
    }

    /**
     * 讀取串流，寫入檔案。
     */
    public void resize(InputStream source, Set<StreamOption> options, Path destination, ResizeJob job) throws IOException {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(job, "job must not be null");
        boolean createDirectory = options.contains(StreamOption.CREATE_DESTINATION_DIRECTORY);

        resize(source, options, job, image -> writeToFile(image, destination, createDirectory, job));
    }

    /**
     * 讀取串流，寫入串流。除非指定 {@link StreamOption#LEAVE_DESTINATION_OPEN}，結束時會關閉目的串流。
     */
    public void resize(InputStream source, Set<StreamOption> options, OutputStream destination, ResizeJob job) throws IOException {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(job, "job must not be null");
        boolean leaveOpen = options.contains(StreamOption.LEAVE_DESTINATION_OPEN);

        try (OutputStream out = leaveOpen ? StreamTools.nonClosing(destination) : destination) {
            resize(source, options, job, image -> backend.encode(image, job.format(), job.quality(), out));
        }
    }

    /**
     * 讀取串流，結果交給回呼。回呼結束後圖片即被釋放。
     */
    public void resize(InputStream source, Set<StreamOption> options, ResizeJob job, ImageConsumer<? super I> consumer) throws IOException {
        Objects.requireNonNull(options, "options must not be null");
        pipeline.run(source, StreamOption.sourceOptionsOf(options), job, consumer);
    }

    private void writeToFile(I image, Path destination, boolean createDirectory, ResizeJob job) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            if (!createDirectory) {
                throw new NoSuchFileException(parent.toString(), null, "目的目錄不存在");
            }
            FileTools.ensureDirectoryExists(parent);
        }

        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            backend.encode(image, job.format(), job.quality(), bos);
            Files.write(destination, bos.toByteArray());
            log.debug("{} - 已寫入 {}", destination, FileTools.formatFileSize(bos.size()));
        }
    }

    /**
     * 以檔案路徑為來源時，串流由這裡開啟，不可保持開啟或還原位置。
     */
    private static Set<StreamOption> pathSourceOptions(Set<StreamOption> options) {
        Objects.requireNonNull(options, "options must not be null");
        Set<StreamOption> effective = EnumSet.noneOf(StreamOption.class);
        effective.addAll(options);
        effective.remove(StreamOption.LEAVE_SOURCE_OPEN);
        effective.remove(StreamOption.REWIND_SOURCE);
        return effective;
    }
}
