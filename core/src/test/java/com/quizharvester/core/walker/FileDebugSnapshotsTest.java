package com.quizharvester.core.walker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileDebugSnapshotsTest {

    @TempDir Path tmp;

    @Test
    void writesLabelQnoKindFile() throws Exception {
        FileDebugSnapshots snaps = new FileDebugSnapshots(tmp.resolve("debug_pages"));

        snaps.save("令和6年 春期", 7, "response.html", "<html>第8問</html>");

        assertThat(tmp.resolve("debug_pages/令和6年_春期_qno7.response.html"))
                .usingCharset(StandardCharsets.UTF_8).hasContent("<html>第8問</html>");
        assertThat(FileDebugSnapshots.fileName("a/b", 0, "request.txt")).isEqualTo("a_b_qno0.request.txt");
    }
}
