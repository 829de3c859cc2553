package com.eyelevel.invoiceingestion.model;

public enum SourceKind {
    LOCAL,
    FTP,
    SFTP,
    MANUAL_UPLOAD
}
