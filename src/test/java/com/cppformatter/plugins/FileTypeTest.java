package com.cppformatter.plugins;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileTypeTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearCache() {
        FileType.clearCache();
    }

    @ParameterizedTest
    @CsvSource({
            "main.c, C_SOURCE",
            "util.h, C_HEADER",
            "app.cpp, CPP_SOURCE",
            "app.CC, CPP_SOURCE",
            "lib.cxx, CPP_SOURCE",
            "widget.hpp, CPP_HEADER",
            "impl.ipp, CPP_HEADER",
            "legacy.C, CPP_SOURCE",
            "legacy.H, CPP_HEADER",
            "notes.txt, UNKNOWN",
            "Makefile, UNKNOWN",
            "trailing., UNKNOWN"
    })
    void detectsByExtension(String name, FileType expected) {
        assertThat(FileType.detectByExtension(Path.of("src", name))).isEqualTo(expected);
    }

    @Test
    void headersAreFlagged() {
        assertThat(FileType.C_HEADER.isHeader()).isTrue();
        assertThat(FileType.CPP_SOURCE.isHeader()).isFalse();
        assertThat(FileType.CPP_SOURCE.getExtensions()).contains("cpp", "cc");
        assertThat(FileType.UNKNOWN.getDescription()).isEqualTo("Unknown file type");
    }

    @Test
    void sniffsExtensionlessStandardStyleHeader() throws IOException {
        Path header = tempDir.resolve("vector");
        Files.writeString(header, "#pragma once\n#include <memory>\nnamespace std {\n}\n");

        assertThat(FileType.detect(header)).isEqualTo(FileType.CPP_HEADER);
    }

    @Test
    void sniffsExtensionlessCHeader() throws IOException {
        Path header = tempDir.resolve("config");
        Files.writeString(header, "#ifndef CONFIG_H\n#define CONFIG_H 1\n#endif\n");

        assertThat(FileType.detect(header)).isEqualTo(FileType.C_HEADER);
    }

    @Test
    void binaryAndPlainTextStayUnknown() throws IOException {
        Path binary = tempDir.resolve("blob");
        Files.write(binary, new byte[]{'#', 'i', 'n', 0, 1, 2});
        Path readme = tempDir.resolve("README");
        Files.writeString(readme, "Just some prose.\n");
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, "#include <vector>\n");

        assertThat(FileType.detect(binary)).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.detect(readme)).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.detect(notes)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void cachesDetectionResults() {
        FileType.clearCache();
        FileType.detect(Path.of("a.cpp"));
        FileType.detect(Path.of("a.cpp"));
        FileType.detect(Path.of("b.h"));

        assertThat(FileType.getCacheSize()).isEqualTo(2);
    }
}
