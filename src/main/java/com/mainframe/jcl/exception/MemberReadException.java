package com.mainframe.jcl.exception;

import java.io.IOException;

/**
 * A member was located but could not be read.
 */
public class MemberReadException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    private final String location;

    public MemberReadException(String memberName, String location, IOException cause) {
        super("Failed to read member '" + memberName + "' from " + location + " (" + cause.getMessage() + ")",
                memberName, 0);
        this.location = location;
        initCause(cause);
    }

    public String getLocation() {
        return location;
    }

    @Override
    public String getKind() {
        return "MemberRead";
    }
}
