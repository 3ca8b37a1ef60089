package com.fsmkit.cli;

/**
 * Input formats accepted by the commands.
 */
public enum InputType {
    /** Detect from the first meaningful line of the file */
    AUTO,

    /** A Mermaid flowchart or state diagram */
    MERMAID,

    /** A YAML FSM specification */
    FSM_SPEC
}
