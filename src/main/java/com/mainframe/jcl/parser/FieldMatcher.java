package com.mainframe.jcl.parser;

import java.util.regex.Pattern;

import com.mainframe.jcl.model.node.JclOpcode;

/**
 * Named matchers for the leading fields of a statement, in priority order.
 * The first matcher that accepts a field decides what the field is, so a reserved
 * operation word can never be taken for a name.
 */
public enum FieldMatcher {
    OPCODE {
        @Override
        public boolean matches(String field) {
            return JclOpcode.isReserved(field);
        }
    },
    LABEL {
        @Override
        public boolean matches(String field) {
            return NAME.matcher(field).matches();
        }
    },
    UNMATCHED {
        @Override
        public boolean matches(String field) {
            return true;
        }
    };

    // NAME or PROCSTEP.NAME (override form)
    private static final Pattern NAME = Pattern.compile(
            "[A-Z#$@][A-Z0-9#$@]{0,7}(\\.[A-Z#$@][A-Z0-9#$@]{0,7})?", Pattern.CASE_INSENSITIVE);

    public abstract boolean matches(String field);

    public static FieldMatcher match(String field) {
        for (FieldMatcher matcher : values()) {
            if (matcher.matches(field)) {
                return matcher;
            }
        }
        return UNMATCHED;
    }
}
