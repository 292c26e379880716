package com.mainframe.jcl.model.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Value of an operand parameter: a scalar (possibly quoted) or an ordered sub-list.
 */
public final class JclValue {

    private final String text;
    private final boolean quoted;
    private final List<JclParameter> items;

    private JclValue(String text, boolean quoted, List<JclParameter> items) {
        this.text = text;
        this.quoted = quoted;
        this.items = items;
    }

    public static JclValue scalar(String text) {
        return new JclValue(text, false, null);
    }

    public static JclValue quoted(String text) {
        return new JclValue(text, true, null);
    }

    public static JclValue list(List<JclParameter> items) {
        return new JclValue(null, false, List.copyOf(items));
    }

    public boolean isList() {
        return items != null;
    }

    public boolean isQuoted() {
        return quoted;
    }

    /**
     * Scalar text (quotes removed for quoted values); null for lists.
     */
    public String getText() {
        return text;
    }

    public List<JclParameter> getItems() {
        return items != null ? items : List.of();
    }

    /**
     * First scalar found: the value itself, or the first non-empty positional item of a list.
     */
    public Optional<String> firstScalar() {
        if (!isList()) {
            return Optional.ofNullable(text);
        }
        for (JclParameter item : items) {
            if (item.isPositional() && item.getValue() != null) {
                Optional<String> nested = item.getValue().firstScalar();
                if (nested.isPresent()) return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * Positional slot texts of a list (null for empty slots), or a single slot for a scalar.
     */
    public List<String> positionalSlots() {
        List<String> slots = new ArrayList<>();
        if (!isList()) {
            slots.add(text);
            return slots;
        }
        for (JclParameter item : items) {
            if (item.isPositional()) {
                slots.add(item.getValue() == null ? null : item.getValue().render());
            }
        }
        return slots;
    }

    public Optional<JclValue> keyword(String name) {
        for (JclParameter item : getItems()) {
            if (!item.isPositional() && item.getKeyword().equalsIgnoreCase(name)) {
                return Optional.ofNullable(item.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Re-render the value as operand text, with quotes removed.
     */
    public String render() {
        if (!isList()) {
            return text;
        }
        return items.stream().map(JclParameter::render).collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public String toString() {
        return quoted ? "'" + text + "'" : render();
    }
}
