package com.mainframe.jcl.resolver;

import com.mainframe.jcl.model.SourceMember;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Member source backed by maps, keyed by location then member name.
 */
class InMemoryMemberSource implements MemberSource {

    private final Map<String, Map<String, String>> libraries = new HashMap<>();

    InMemoryMemberSource add(String location, String memberName, String text) {
        libraries.computeIfAbsent(location, l -> new HashMap<>()).put(memberName, text);
        return this;
    }

    InMemoryMemberSource add(String memberName, String text) {
        return add(".", memberName, text);
    }

    @Override
    public Optional<SourceMember> find(String memberName, String location) {
        String text = libraries.getOrDefault(location, Map.of()).get(memberName);
        return Optional.ofNullable(text)
                .map(t -> SourceMember.fromText(memberName, location + "/" + memberName, t));
    }
}
