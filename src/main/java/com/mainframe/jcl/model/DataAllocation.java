package com.mainframe.jcl.model;

import lombok.Builder;
import lombok.Value;

/**
 * One DD entry of a step. Concatenated DDs share a dd name and are told apart by
 * {@code allocationOffset} (1-based within the step and dd name).
 */
@Value
@Builder(toBuilder = true)
public class DataAllocation {
    public static final String DUMMY_DSN = "(dummy)";
    public static final String INSTREAM_DSN = "(input stream)";
    public static final String SYSOUT_DSN = "(output stream)";
    public static final String WORK_DSN = "(work_ds)";

    String ddName;
    int allocationOffset;
    String dsn;
    @Builder.Default
    Disposition disposition = Disposition.DEFAULT;
    String unit;
    String volSer;
    boolean dummy;
    String instreamRef;
    String lrecl;
    String blksize;
    String recfm;
    @Builder.Default
    DcbAttributes dcbAttributes = DcbAttributes.empty();

    public String getDispStatus() {
        return disposition.getStatus();
    }

    public String getDispNormal() {
        return disposition.getNormal();
    }

    public String getDispAbnormal() {
        return disposition.getAbnormal();
    }
}
