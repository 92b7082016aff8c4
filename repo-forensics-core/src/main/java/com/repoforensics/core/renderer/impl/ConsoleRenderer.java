package com.repoforensics.core.renderer.impl;

import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.renderer.OutputRenderer;
import com.repoforensics.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Prints reports to a console stream.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.types} - comma-separated content types to print (default: "text/plain"),
 *       or "*" for every report</li>
 *   <li>{@code console.headers} - print the file name above each report ("true"/"false",
 *       default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    static final String TYPES_SETTING = "console.types";
    static final String HEADERS_SETTING = "console.headers";

    private static final String ALL_TYPES = "*";
    private static final String DEFAULT_TYPES = "text/plain";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDisplayName() {
        return "Console Renderer";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        String types = context.getSettingOrDefault(TYPES_SETTING, DEFAULT_TYPES);
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(HEADERS_SETTING, "false"));
        List<String> accepted = Arrays.stream(types.split(","))
            .map(String::trim)
            .filter(type -> !type.isEmpty())
            .toList();

        List<GeneratedFile> printed = output.files().stream()
            .filter(file -> accepted.contains(ALL_TYPES) || accepted.stream().anyMatch(file::hasContentType))
            .toList();
        log.debug("Printing {} of {} reports", printed.size(), output.files().size());

        for (GeneratedFile file : printed) {
            if (showHeaders) {
                out.println("# " + file.fileName());
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
