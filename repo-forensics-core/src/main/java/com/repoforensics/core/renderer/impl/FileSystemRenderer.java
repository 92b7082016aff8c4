package com.repoforensics.core.renderer.impl;

import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.renderer.OutputRenderer;
import com.repoforensics.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes every report into the output directory as UTF-8, overwriting existing files.
 *
 * <p>The output directory is created if needed. A file name that resolves outside the
 * output directory is rejected.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDisplayName() {
        return "File System Renderer";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.debug("Writing {} reports to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.fileName()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Report file escapes output directory: " + file.fileName());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.info("Wrote {} ({} bytes)", target, file.sizeInBytes());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + target, e);
        }
    }
}
