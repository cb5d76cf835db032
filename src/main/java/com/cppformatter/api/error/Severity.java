package com.cppformatter.api.error;

public enum Severity {
    FATAL,   // Input rejected, nothing was formatted
    ERROR,   // Issues requiring manual intervention
    WARNING, // Formatting completed but a rule could not be applied
    INFO     // Informational messages about formatting
}
