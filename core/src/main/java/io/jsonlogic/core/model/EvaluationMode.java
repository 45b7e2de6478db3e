package io.jsonlogic.core.model;

/** How the evaluator prepares an operator's operands before calling it. */
public enum EvaluationMode {
    /** Every operand is evaluated against the current context first; the operator sees values. */
    EAGER,
    /**
     * Operands are passed unevaluated; the operator decides when, and against which context, each
     * one is evaluated. Required for short-circuiting and for operators that narrow the context.
     */
    LAZY
}
