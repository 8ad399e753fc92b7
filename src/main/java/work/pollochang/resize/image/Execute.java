package work.pollochang.resize.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import work.pollochang.resize.image.core.ResizeResult;
import work.pollochang.resize.image.core.StreamOption;
import work.pollochang.resize.image.job.FitMode;
import work.pollochang.resize.image.job.OutputFormat;
import work.pollochang.resize.image.job.ResizeInstructions;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.job.ResizeJobFiles;
import work.pollochang.resize.image.job.ScaleMode;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-resize",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "圖片縮放工具 (單一檔案或批次)")
public class Execute implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "來源圖片。")
    private File input;

    @Option(names = {"-o", "--output"}, description = "輸出圖片。可與來源相同 (會先讀入記憶體)。")
    private File output;

    @Option(names = {"-f", "--file-list"}, description = "包含圖片路徑的文字檔案 (批次模式)。")
    private File fileList;

    @Option(names = {"-d", "--output-dir"}, description = "批次模式的輸出目錄。")
    private File outputDir;

    @Option(names = {"-W", "--width"}, description = "目標寬度。")
    private Integer width;

    @Option(names = {"-H", "--height"}, description = "目標高度。")
    private Integer height;

    @Option(names = {"-m", "--mode"}, description = "縮放模式: max, pad, crop, stretch, carve (預設: max)。")
    private FitMode fitMode;

    @Option(names = {"-s", "--scale"}, description = "放大模式: down, both, canvas (預設: down)。")
    private ScaleMode scaleMode;

    @Option(names = {"-b", "--bgcolor"}, description = "背景色，例如 ffffff、#00000080、transparent (預設: transparent)。")
    private Color background;

    @Option(names = {"--format"}, description = "輸出格式: jpg, png (預設: jpg)。")
    private OutputFormat format;

    @Option(names = {"-q", "--quality"}, description = "JPEG 品質 0-100 (預設: 90)。")
    private Integer quality;

    @Option(names = {"--ignore-icc"}, description = "忽略內嵌的色彩描述檔。")
    private boolean ignoreIcc;

    @Option(names = {"--instructions"}, description = "查詢字串格式的縮放指令，例如 \"width=200&height=100&mode=crop\"。")
    private String instructions;

    @Option(names = {"--job-file"}, description = "JSON 格式的縮放參數檔。")
    private File jobFile;

    @Option(names = {"--create-dir"}, description = "輸出目錄不存在時自動建立。")
    private boolean createDirectory;

    @Option(names = {"--buffer"}, description = "先將來源完整讀入記憶體。")
    private boolean bufferInMemory;

    @Option(names = {"-t", "--threads"}, description = "批次模式的執行緒數量 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "批次模式的執行時間上限(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Override
    public Integer call() throws Exception {
        boolean singleMode = input != null || output != null;
        boolean batchMode = fileList != null || outputDir != null;
        if (singleMode == batchMode) {
            throw new ParameterException(spec.commandLine(), "請指定 -i/-o (單一檔案) 或 -f/-d (批次) 其中一種模式。");
        }
        if (singleMode && (input == null || output == null)) {
            throw new ParameterException(spec.commandLine(), "單一檔案模式需要同時指定 -i 與 -o。");
        }
        if (batchMode && (fileList == null || outputDir == null)) {
            throw new ParameterException(spec.commandLine(), "批次模式需要同時指定 -f 與 -d。");
        }

        ResizeJob job = resolveJob();
        Set<StreamOption> options = EnumSet.noneOf(StreamOption.class);
        if (createDirectory) {
            options.add(StreamOption.CREATE_DESTINATION_DIRECTORY);
        }
        if (bufferInMemory) {
            options.add(StreamOption.BUFFER_IN_MEMORY);
        }

        log.info("========================================縮放程式參數設定========================================");
        log.info("縮放參數: {}", job);
        log.info("縮放模式: {} ({}), 放大模式: {} ({})",
                job.fitMode(), job.fitMode().getDescription(), job.scaleMode(), job.scaleMode().getDescription());
        log.info("串流選項: {}", options);
        log.info("========================================縮放程式參數設定========================================");

        if (singleMode) {
            ImageResizer.withDefaultBackend().resize(input.toPath(), options, output.toPath(), job);
            log.info("{} -> {} 縮放完成", input, output);
            return 0;
        }

        ResizeBatch batch = new ResizeBatch();
        batch.setFileListPath(fileList.toPath());
        batch.setOutputDir(outputDir.toPath());
        batch.setJob(job);
        batch.setOptions(options);
        batch.setTimeOutHr(timeOutHr);
        if (threads != null) {
            batch.setThreads(threads);
        }
        Map<ResizeResult, Long> summary = batch.execute();

        log.info("所有任務執行完畢");
        long failed = summary.entrySet().stream()
                .filter(e -> e.getKey().name().startsWith("FAILED"))
                .mapToLong(Map.Entry::getValue)
                .sum();
        return failed == 0 ? 0 : 1;
    }

    /**
     * 以參數檔或指令字串為基礎，再套用個別指定的選項。
     */
    ResizeJob resolveJob() throws IOException {
        ResizeJob base;
        if (jobFile != null) {
            base = ResizeJobFiles.read(jobFile.toPath());
        } else {
            base = ResizeInstructions.parse(instructions);
        }

        ResizeJob.ResizeJobBuilder builder = base.toBuilder();
        if (width != null) builder.width(width);
        if (height != null) builder.height(height);
        if (fitMode != null) builder.fitMode(fitMode);
        if (scaleMode != null) builder.scaleMode(scaleMode);
        if (background != null) builder.background(background);
        if (format != null) builder.format(format);
        if (quality != null) builder.quality(quality);
        if (ignoreIcc) builder.ignoreIcc(true);
        return builder.build();
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new Execute());
        commandLine.registerConverter(FitMode.class, FitMode::parse);
        commandLine.registerConverter(ScaleMode.class, ScaleMode::parse);
        commandLine.registerConverter(OutputFormat.class, OutputFormat::parse);
        commandLine.registerConverter(Color.class, ResizeInstructions::parseColor);
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
