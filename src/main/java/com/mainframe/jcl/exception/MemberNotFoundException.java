package com.mainframe.jcl.exception;

import java.util.List;

public class MemberNotFoundException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    private final String missingMember;
    private final List<String> searchedLocations;

    public MemberNotFoundException(String missingMember, List<String> searchedLocations,
                                   String referencingMember, int line) {
        super(String.format("Member '%s' not found in %s (referenced from %s line %d)",
                missingMember, searchedLocations, referencingMember, line), referencingMember, line);
        this.missingMember = missingMember;
        this.searchedLocations = List.copyOf(searchedLocations);
    }

    public String getMissingMember() {
        return missingMember;
    }

    public List<String> getSearchedLocations() {
        return searchedLocations;
    }

    @Override
    public String getKind() {
        return "MemberNotFound";
    }
}
