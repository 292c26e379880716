package com.mainframe.jcl.model.node;

import lombok.Value;

/**
 * One comma-separated operand element: {@code KEYWORD=value} or a positional value.
 * An omitted positional slot has a null value.
 */
@Value
public class JclParameter {
    String keyword;
    JclValue value;

    public static JclParameter positional(JclValue value) {
        return new JclParameter(null, value);
    }

    public static JclParameter keyword(String keyword, JclValue value) {
        return new JclParameter(keyword, value);
    }

    public boolean isPositional() {
        return keyword == null;
    }

    public String render() {
        String rendered = value == null ? "" : value.render();
        return isPositional() ? rendered : keyword + "=" + rendered;
    }
}
