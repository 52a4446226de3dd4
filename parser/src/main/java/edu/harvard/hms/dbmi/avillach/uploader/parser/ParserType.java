package edu.harvard.hms.dbmi.avillach.uploader.parser;

import edu.harvard.hms.dbmi.avillach.uploader.parser.miseq.MiSeqParser;
import edu.harvard.hms.dbmi.avillach.uploader.parser.nextseq.NextSeqParser;

import java.util.function.Supplier;

/**
 * Instruments a run directory can come from.
 */
public enum ParserType {
    NEXTSEQ(NextSeqParser::new),
    MISEQ(MiSeqParser::new);

    private final Supplier<SampleSheetParser> factory;

    ParserType(Supplier<SampleSheetParser> factory) {
        this.factory = factory;
    }

    public SampleSheetParser create() {
        return factory.get();
    }
}
