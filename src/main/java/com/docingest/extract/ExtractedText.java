package com.docingest.extract;

import java.nio.file.Path;

import com.docingest.ingest.ContentType;

public record ExtractedText(Path sourcePath, String text, ContentType contentType) {
}
