package work.pollochang.resize.image.tools;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

public class StreamTools {

    /**
     * 包裝目的串流，{@code close()} 只做 flush，不會關閉底層串流。
     */
    public static OutputStream nonClosing(OutputStream out) {
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }
}
