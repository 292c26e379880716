package com.mainframe.jcl.model.node;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserved operation-field keywords. A field matching one of these is always the
 * operation, never a name.
 */
public enum JclOpcode {
    EXEC,
    DD,
    PROC,
    PEND,
    SET,
    IF,
    THEN,
    ELSE,
    ENDIF,
    INCLUDE,
    OUTPUT,
    JCLLIB,
    JOB,
    CNTL,
    ENDCNTL,
    EXPORT,
    NOTIFY,
    SCHEDULE,
    XMIT,
    COMMAND;

    private static final Map<String, JclOpcode> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    public static Optional<JclOpcode> fromKeyword(String word) {
        if (word == null) return Optional.empty();
        return Optional.ofNullable(BY_KEYWORD.get(word.toUpperCase(Locale.ROOT)));
    }

    public static boolean isReserved(String word) {
        return fromKeyword(word).isPresent();
    }
}
