package com.mainframe.jcl.model;

import java.util.List;

import lombok.Value;

/**
 * Raw card images of one member, as returned by a member source.
 * Held only until the normalizer has turned it into statements.
 */
@Value
public class SourceMember {
    String name;
    String origin;
    List<String> lines;

    public SourceMember(String name, String origin, List<String> lines) {
        this.name = name;
        this.origin = origin;
        this.lines = List.copyOf(lines);
    }

    public static SourceMember fromText(String name, String origin, String text) {
        return new SourceMember(name, origin, text.lines().toList());
    }
}
