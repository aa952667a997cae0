package com.docingest.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface DocumentTextExtractor {
    boolean supports(Path path);

    Optional<ExtractedText> extract(Path path) throws IOException;
}
