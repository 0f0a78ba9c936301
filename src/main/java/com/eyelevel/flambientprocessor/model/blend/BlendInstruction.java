package com.eyelevel.flambientprocessor.model.blend;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One token of a blend recipe.
 *
 * @param type     What the token does.
 * @param operands Its arguments. For {@link InstructionType#MERGE} the first operand is the compose
 *                 operator and the rest are the files to fold.
 */
public record BlendInstruction(InstructionType type, List<String> operands) {

    private static final String BUFFER_PREFIX = "mpr:";

    public BlendInstruction {
        operands = List.copyOf(operands);
    }

    public static BlendInstruction comment(String text) {
        return new BlendInstruction(InstructionType.COMMENT, List.of(text));
    }

    public static BlendInstruction merge(String composeOperator, List<String> files) {
        List<String> operands = new ArrayList<>();
        operands.add(composeOperator);
        operands.addAll(files);
        return new BlendInstruction(InstructionType.MERGE, operands);
    }

    public static BlendInstruction load(String... sources) {
        return new BlendInstruction(InstructionType.LOAD, List.of(sources));
    }

    public static BlendInstruction channel(String channel) {
        return new BlendInstruction(InstructionType.CHANNEL, List.of(channel));
    }

    public static BlendInstruction level(String low, String high, String gamma) {
        return new BlendInstruction(InstructionType.LEVEL, List.of(low, high, gamma));
    }

    public static BlendInstruction resetChannel() {
        return new BlendInstruction(InstructionType.RESET_CHANNEL, List.of());
    }

    public static BlendInstruction compose(String operator) {
        return new BlendInstruction(InstructionType.COMPOSE, List.of(operator));
    }

    public static BlendInstruction write(String target) {
        return new BlendInstruction(InstructionType.WRITE, List.of(target));
    }

    public static BlendInstruction delete() {
        return new BlendInstruction(InstructionType.DELETE, List.of());
    }

    public static BlendInstruction skip(String reason) {
        return new BlendInstruction(InstructionType.SKIP, List.of(reason));
    }

    /**
     * Renders the token as an engine script fragment. Files are double-quoted; named buffers are not.
     */
    public String render() {
        return switch (type) {
            case COMMENT -> operands.get(0).isEmpty() ? "" : "# " + operands.get(0);
            case SKIP -> "# SKIP: " + operands.get(0);
            case MERGE -> renderMerge();
            case LOAD -> operands.stream().map(BlendInstruction::source).collect(Collectors.joining(" "));
            case CHANNEL -> "-channel " + operands.get(0);
            case LEVEL -> "-level " + String.join(",", operands);
            case RESET_CHANNEL -> "+channel";
            case COMPOSE -> "-compose " + operands.get(0) + " -composite";
            case WRITE -> "-write " + source(operands.get(0));
            case DELETE -> "+delete";
        };
    }

    private String renderMerge() {
        String operator = operands.get(0);
        List<String> files = operands.subList(1, operands.size());
        StringBuilder fragment = new StringBuilder();
        for (int i = 0; i < files.size(); i++) {
            if (i > 0) {
                fragment.append(' ');
            }
            fragment.append(source(files.get(i)));
            if (i > 0) {
                fragment.append(" -compose ").append(operator).append(" -composite");
            }
        }
        return fragment.toString();
    }

    private static String source(String value) {
        return value.startsWith(BUFFER_PREFIX) ? value : "\"" + value + "\"";
    }
}
