package com.shellpilot.engine.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of the context assembler.
 *
 * @param command the input with every reference marker removed, trimmed
 * @param blocks  piped stdin first, then one block per file reference
 *                (content or notice) in order of appearance, then clipboard
 * @param files   absolute paths of the files actually read
 */
public record ContextBundle(String command, List<ContextBlock> blocks, List<Path> files) {

    public ContextBundle {
        blocks = List.copyOf(blocks);
        files  = List.copyOf(files);
    }

    public static ContextBundle of(String command) {
        return new ContextBundle(command, List.of(), List.of());
    }

    public boolean hasContext() {
        return !blocks.isEmpty();
    }

    /** Rendered text of every block, used in translation prompts. */
    public List<String> renderedBlocks() {
        return blocks.stream().map(ContextBlock::render).toList();
    }
}
