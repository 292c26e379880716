package com.mainframe.jcl.export;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mainframe.jcl.model.DataAllocation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"dd_name", "allocation_offset", "dsn", "disp_status", "disp_normal", "disp_abnormal",
        "unit", "vol_ser", "is_dummy", "instream_ref", "lrecl", "blksize", "recfm", "dcb_attributes"})
public class ExportedAllocation {
    String ddName;
    int allocationOffset;
    String dsn;
    String dispStatus;
    String dispNormal;
    String dispAbnormal;
    String unit;
    String volSer;
    @JsonProperty("is_dummy")
    boolean dummy;
    String instreamRef;
    String lrecl;
    String blksize;
    String recfm;
    Map<String, Object> dcbAttributes;

    static ExportedAllocation from(DataAllocation allocation) {
        return ExportedAllocation.builder()
                .ddName(allocation.getDdName())
                .allocationOffset(allocation.getAllocationOffset())
                .dsn(allocation.getDsn())
                .dispStatus(allocation.getDispStatus())
                .dispNormal(allocation.getDispNormal())
                .dispAbnormal(allocation.getDispAbnormal())
                .unit(allocation.getUnit())
                .volSer(allocation.getVolSer())
                .dummy(allocation.isDummy())
                .instreamRef(allocation.getInstreamRef())
                .lrecl(allocation.getLrecl())
                .blksize(allocation.getBlksize())
                .recfm(allocation.getRecfm())
                .dcbAttributes(allocation.getDcbAttributes().asMap())
                .build();
    }
}
