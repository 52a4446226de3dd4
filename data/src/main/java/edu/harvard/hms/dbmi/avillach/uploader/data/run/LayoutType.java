package edu.harvard.hms.dbmi.avillach.uploader.data.run;

public enum LayoutType {
    PAIRED_END,
    SINGLE_END
}
