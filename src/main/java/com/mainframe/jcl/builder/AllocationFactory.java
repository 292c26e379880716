package com.mainframe.jcl.builder;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.mainframe.jcl.model.DataAllocation;
import com.mainframe.jcl.model.DcbAttributes;
import com.mainframe.jcl.model.Disposition;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.JclParameter;
import com.mainframe.jcl.model.node.JclValue;

/**
 * Interprets the operands of one DD statement.
 *
 * DSN precedence: DUMMY (or DSN=NULLFILE), then in-stream data, then SYSOUT, then the
 * literal DSN, then a work data set. LRECL, BLKSIZE and RECFM become allocation fields,
 * a DD-level keyword winning over the DCB sub-parameter. Every other DCB attribute lands
 * in {@link DcbAttributes}.
 */
public class AllocationFactory {

    static final String NULLFILE = "NULLFILE";
    static final String MODEL_KEY = "MODEL";

    private static final Set<String> PROMOTED = Set.of("LRECL", "BLKSIZE", "RECFM");

    /** DCB sub-parameters that may also be coded directly on the DD statement. */
    private static final Set<String> DD_LEVEL_DCB = Set.of(
            "DSORG", "KEYLEN", "KEYOFF", "BUFNO", "BUFL", "BUFOFF", "OPTCD", "NCP", "EROPT",
            "LIMCT", "RKP", "DEN", "TRTCH", "BFALN", "BFTEK", "DIAGNS", "FUNC", "MODE",
            "PRTSP", "STACK", "THRESH", "CPRI", "GNCP", "INTVL", "IPLTXID", "PCI", "RESERVE");

    /**
     * Build the allocation for a DD. The dd name and offset are left to the caller.
     */
    public DataAllocation.DataAllocationBuilder create(DdNode dd) {
        Objects.requireNonNull(dd, "dd");

        String dsnText = dd.keyword("DSN").flatMap(JclValue::firstScalar).orElse(null);
        boolean dummy = dd.isDummy() || NULLFILE.equalsIgnoreCase(dsnText);
        boolean instream = dd.isInstream();

        String dsn;
        if (dummy) {
            dsn = DataAllocation.DUMMY_DSN;
        } else if (instream) {
            dsn = DataAllocation.INSTREAM_DSN;
        } else if (dd.hasKeyword("SYSOUT")) {
            dsn = DataAllocation.SYSOUT_DSN;
        } else if (dsnText != null && !dsnText.isBlank()) {
            dsn = dsnText.toUpperCase(Locale.ROOT);
        } else {
            dsn = DataAllocation.WORK_DSN;
        }

        DcbAttributes.Builder dcb = DcbAttributes.builder();
        String lrecl = null;
        String blksize = null;
        String recfm = null;

        Optional<JclValue> dcbValue = dd.keyword("DCB");
        if (dcbValue.isPresent()) {
            JclValue value = dcbValue.get();
            if (!value.isList()) {
                dcb.put(MODEL_KEY, value.getText());
            } else {
                for (JclParameter item : value.getItems()) {
                    if (item.getValue() == null) {
                        continue;
                    }
                    if (item.isPositional()) {
                        dcb.putIfAbsent(MODEL_KEY, item.getValue().render());
                        continue;
                    }
                    String name = item.getKeyword();
                    String text = item.getValue().render();
                    switch (name) {
                        case "LRECL" -> lrecl = text;
                        case "BLKSIZE" -> blksize = text;
                        case "RECFM" -> recfm = text;
                        default -> dcb.put(name, text);
                    }
                }
            }
        }

        lrecl = ddLevel(dd, "LRECL").orElse(lrecl);
        blksize = ddLevel(dd, "BLKSIZE").orElse(blksize);
        recfm = ddLevel(dd, "RECFM").orElse(recfm);

        for (String name : dd.getKeywords().keySet()) {
            if (DD_LEVEL_DCB.contains(name) && !PROMOTED.contains(name)) {
                ddLevel(dd, name).ifPresent(text -> dcb.put(name, text));
            }
        }

        return DataAllocation.builder()
                .dsn(dsn)
                .dummy(dummy)
                .instreamRef(instream ? String.join("\n", dd.getInstreamData()) : null)
                .disposition(disposition(dd))
                .unit(dd.keyword("UNIT").flatMap(JclValue::firstScalar).map(this::upper).orElse(null))
                .volSer(volSer(dd))
                .lrecl(lrecl)
                .blksize(blksize)
                .recfm(upper(recfm))
                .dcbAttributes(dcb.build());
    }

    private Disposition disposition(DdNode dd) {
        return dd.keyword("DISP")
                .map(JclValue::positionalSlots)
                .map(Disposition::fromSlots)
                .orElse(Disposition.DEFAULT);
    }

    /**
     * VOL=SER=X or VOL=(,,,SER=(A,B)); several serials are joined with commas.
     */
    private String volSer(DdNode dd) {
        Optional<JclValue> vol = dd.keyword("VOL");
        if (vol.isEmpty() || !vol.get().isList()) {
            return null;
        }
        return vol.get().keyword("SER")
                .map(ser -> ser.positionalSlots().stream()
                        .filter(s -> s != null && !s.isBlank())
                        .map(this::upper)
                        .collect(Collectors.joining(",")))
                .filter(s -> !s.isEmpty())
                .orElse(null);
    }

    private static Optional<String> ddLevel(DdNode dd, String name) {
        return dd.keyword(name).map(JclValue::render).filter(s -> !s.isBlank());
    }

    private String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }
}
