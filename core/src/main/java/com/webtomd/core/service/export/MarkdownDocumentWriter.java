package com.webtomd.core.service.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/** 최종 문서 저장: 같은 폴더의 임시 파일에 쓴 뒤 이동. 중간에 끊겨도 반쪽 문서는 남지 않는다. */
public class MarkdownDocumentWriter {
    private final Logger log;

    public MarkdownDocumentWriter() {
        this(LoggerFactory.getLogger(MarkdownDocumentWriter.class));
    }

    public MarkdownDocumentWriter(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public Path write(Path target, String content) throws IOException {
        Path abs = target.toAbsolutePath();
        Path dir = abs.getParent();
        Files.createDirectories(dir);

        Path tmp = Files.createTempFile(dir, abs.getFileName().toString() + ".", ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, abs, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.info("Markdown document saved: {}", abs);
        return abs;
    }
}
