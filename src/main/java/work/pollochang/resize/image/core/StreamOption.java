package work.pollochang.resize.image.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * 來源與目的串流的處理選項。
 */
public enum StreamOption {
    /** 先將整個來源讀入記憶體，可用來讀寫同一個檔案。 */
    BUFFER_IN_MEMORY(true),
    /** 處理完不關閉來源串流。 */
    LEAVE_SOURCE_OPEN(true),
    /**
     * 處理完將來源串流還原到原本的位置，只在 {@link #LEAVE_SOURCE_OPEN} 時有作用。
     * 需要 {@link java.io.FileInputStream} 或支援 {@link java.io.InputStream#markSupported()} 的串流。
     */
    REWIND_SOURCE(true),
    /** 處理完不關閉目的串流。 */
    LEAVE_DESTINATION_OPEN(false),
    /** 目的檔案的目錄不存在時自動建立。 */
    CREATE_DESTINATION_DIRECTORY(false);

    private final boolean sourceOption;

    StreamOption(boolean sourceOption) {
        this.sourceOption = sourceOption;
    }

    public boolean isSourceOption() { return sourceOption; }

    /**
     * 縮放管線本身接受的選項。
     */
    public static Set<StreamOption> sourceOptions() {
        return EnumSet.of(BUFFER_IN_MEMORY, LEAVE_SOURCE_OPEN, REWIND_SOURCE);
    }

    /**
     * 只保留來源相關的選項，目的相關的選項由呼叫端自行處理。
     */
    public static Set<StreamOption> sourceOptionsOf(Set<StreamOption> options) {
        Set<StreamOption> result = EnumSet.noneOf(StreamOption.class);
        for (StreamOption option : options) {
            if (option.isSourceOption()) {
                result.add(option);
            }
        }
        return result;
    }
}
