package com.eyelevel.flambientprocessor.model.blend;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The ordered compositing instructions for one group and the file they produce.
 *
 * <p>Rendering joins tokens into script lines: comments and skip markers stand alone, and a
 * {@code +delete} closes the current line.
 *
 * @param groupNumber  The group's sequence number.
 * @param instructions The tokens in execution order.
 * @param outputPath   The blended output; {@code null} for a skip recipe.
 */
public record BlendRecipe(int groupNumber, List<BlendInstruction> instructions, Path outputPath) {

    public BlendRecipe {
        instructions = List.copyOf(instructions);
    }

    public boolean isBlendable() {
        return outputPath != null && instructions.stream().noneMatch(i -> i.type() == InstructionType.SKIP);
    }

    public Optional<Path> output() {
        return Optional.ofNullable(outputPath);
    }

    public Optional<String> skipReason() {
        return instructions.stream()
                           .filter(i -> i.type() == InstructionType.SKIP)
                           .map(i -> i.operands().get(0))
                           .findFirst();
    }

    public String paddedGroupNumber() {
        return String.format("%02d", groupNumber);
    }

    public List<String> renderLines() {
        List<String> lines = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (BlendInstruction instruction : instructions) {
            if (instruction.type().isStandalone()) {
                flush(current, lines);
                lines.add(instruction.render());
                continue;
            }
            current.add(instruction.render());
            if (instruction.type() == InstructionType.DELETE) {
                flush(current, lines);
            }
        }
        flush(current, lines);
        return lines;
    }

    /**
     * @return the engine script text, newline-terminated.
     */
    public String render() {
        return String.join("\n", renderLines()) + "\n";
    }

    private static void flush(List<String> current, List<String> lines) {
        if (!current.isEmpty()) {
            lines.add(String.join(" ", current));
            current.clear();
        }
    }
}
