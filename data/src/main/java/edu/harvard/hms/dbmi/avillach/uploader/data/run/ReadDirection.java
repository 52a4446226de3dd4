package edu.harvard.hms.dbmi.avillach.uploader.data.run;

public enum ReadDirection {
    FORWARD,
    REVERSE,
    SINGLE
}
