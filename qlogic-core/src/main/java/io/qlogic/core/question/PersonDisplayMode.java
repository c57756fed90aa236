package io.qlogic.core.question;

/// How a person question offers existing person records.
public enum PersonDisplayMode {
    AUTOCOMPLETE,
    DROPDOWN
}
