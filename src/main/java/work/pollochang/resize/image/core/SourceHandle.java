package work.pollochang.resize.image.core;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.util.Set;
import java.util.function.Function;

/**
 * 管理一次縮放期間的來源串流：記錄還原位置、必要時緩衝到記憶體，
 * 並在結束時依選項關閉或還原來源串流。
 * <p>
 * 可還原位置的來源有兩種：{@link FileInputStream} 透過其 {@link FileChannel} 記錄與設定位置，
 * 其他串流使用 {@link InputStream#mark(int)} / {@link InputStream#reset()}。
 * 只有保持開啟的來源才會記錄位置，會被關閉的來源不需要還原。
 * <p>
 * {@link #close()} 先釋放緩衝，再決定原始串流的去留。
 */
@Slf4j
final class SourceHandle implements Closeable {

    static final Function<byte[], InputStream> IN_MEMORY = ByteArrayInputStream::new;

    private static final long NO_POSITION = -1;

    private final InputStream source;
    private final boolean leaveOpen;
    private final FileChannel channel;
    private final long channelPosition;
    private final boolean marked;

    private InputStream buffer;
    private boolean sourceClosed;

    private SourceHandle(InputStream source, boolean leaveOpen, FileChannel channel, long channelPosition, boolean marked) {
        this.source = source;
        this.leaveOpen = leaveOpen;
        this.channel = channel;
        this.channelPosition = channelPosition;
        this.marked = marked;
    }

    /**
     * 依選項取得來源。失敗時來源串流一樣會依選項關閉或還原。
     *
     * @param bufferFactory 以讀入的位元組建立記憶體緩衝
     */
    static SourceHandle acquire(InputStream source, Set<StreamOption> options,
                                Function<byte[], InputStream> bufferFactory) throws IOException {
        boolean leaveOpen = options.contains(StreamOption.LEAVE_SOURCE_OPEN);

        FileChannel channel = null;
        long channelPosition = NO_POSITION;
        boolean marked = false;
        if (leaveOpen && options.contains(StreamOption.REWIND_SOURCE)) {
            if (source instanceof FileInputStream) {
                channel = ((FileInputStream) source).getChannel();
                channelPosition = channel.position();
            } else if (source.markSupported()) {
                source.mark(Integer.MAX_VALUE);
                marked = true;
            } else {
                log.debug("來源串流不支援 mark/reset，無法還原位置");
            }
        }

        SourceHandle handle = new SourceHandle(source, leaveOpen, channel, channelPosition, marked);
        if (options.contains(StreamOption.BUFFER_IN_MEMORY)) {
            try {
                byte[] bytes = source.readAllBytes();
                handle.buffer = bufferFactory.apply(bytes);
                log.debug("來源已緩衝至記憶體，共 {} bytes", bytes.length);

                // 提早關閉來源，才能讀寫同一個檔案
                if (!leaveOpen) {
                    handle.closeSource();
                }
            } catch (Throwable e) {
                try {
                    handle.close();
                } catch (IOException | RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
        }
        return handle;
    }

    /**
     * 解碼時要讀取的串流：有緩衝時為記憶體緩衝，否則為原始來源。
     */
    InputStream stream() {
        return buffer != null ? buffer : source;
    }

    @Override
    public void close() throws IOException {
        try {
            if (buffer != null) {
                buffer.close();
            }
        } finally {
            buffer = null;
            if (!leaveOpen) {
                closeSource();
            } else if (channel != null) {
                channel.position(channelPosition);
            } else if (marked) {
                source.reset();
            }
        }
    }

    private void closeSource() throws IOException {
        if (!sourceClosed) {
            sourceClosed = true;
            source.close();
        }
    }
}
