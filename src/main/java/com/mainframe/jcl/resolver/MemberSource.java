package com.mainframe.jcl.resolver;

import java.io.IOException;
import java.util.Optional;

import com.mainframe.jcl.model.SourceMember;

/**
 * Where members come from. A location is one entry of the library search path; what it
 * means (directory, library name) is up to the implementation.
 */
public interface MemberSource {

    /**
     * Look up one member in one location.
     *
     * @return the member, or empty when the location does not hold it
     * @throws IOException when the member exists but cannot be read
     */
    Optional<SourceMember> find(String memberName, String location) throws IOException;

    /**
     * Human-readable form of a location, used in not-found reports.
     */
    default String describe(String location) {
        return location;
    }
}
