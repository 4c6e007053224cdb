package com.quizharvester.core.store;

import java.io.IOException;
import java.nio.file.Path;

/** 코퍼스 파일이 JSON이 아니거나 구조(questions 배열 등)가 틀린 경우. */
public class CorpusFormatException extends IOException {
    private final Path path;

    public CorpusFormatException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
