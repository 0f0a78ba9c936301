package com.eyelevel.flambientprocessor.model.blend;

/**
 * Tokens of a blend recipe, in the vocabulary of the compositing engine's script language.
 */
public enum InstructionType {
    COMMENT,
    /**
     * Left-to-right fold of several files with one compose operator.
     */
    MERGE,
    LOAD,
    CHANNEL,
    LEVEL,
    RESET_CHANNEL,
    COMPOSE,
    WRITE,
    DELETE,
    /**
     * Marks a group that cannot be blended; carries the reason.
     */
    SKIP;

    public boolean isCompositing() {
        return this == MERGE || this == COMPOSE;
    }

    /**
     * @return whether the token occupies a script line of its own.
     */
    public boolean isStandalone() {
        return this == COMMENT || this == SKIP;
    }
}
