package com.mainframe.jcl.symbol;

public enum ScopeKind {
    /** SET statements of the job stream. */
    GLOBAL,
    /** Defaults declared on a PROC statement. */
    PROC_DEFAULT,
    /** KEYWORD=value overrides on the EXEC that called the procedure. */
    CALL_OVERRIDE
}
