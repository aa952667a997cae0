package com.docingest.extract;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.docingest.ingest.ContentType;

public class PlainTextExtractor implements DocumentTextExtractor {
    private final List<String> extensions;

    public PlainTextExtractor() {
        this(List.of(".txt", ".text", ".md", ".markdown"));
    }

    public PlainTextExtractor(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public Optional<ExtractedText> extract(Path path) throws IOException {
        if (!supports(path)) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedText(path, Files.readString(path, StandardCharsets.UTF_8), ContentType.TEXT));
    }
}
