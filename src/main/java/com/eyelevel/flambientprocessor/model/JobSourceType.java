package com.eyelevel.flambientprocessor.model;

/**
 * Where the files of a remote editing job came from.
 */
public enum JobSourceType {
    /**
     * A directory given directly by the operator.
     */
    MANUAL,
    /**
     * The blended outputs of a flambient run.
     */
    FLAMBIENT,
    SHORTCUT,
    PRODUCT
}
