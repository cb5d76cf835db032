package com.cppformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.Severity;

/**
 * Result of a formatting operation. An unsuccessful result never carries
 * formatted code.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<Refactoring> appliedRefactorings;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.successful ? builder.formattedCode : null;
        this.errors = Collections.unmodifiableList(builder.errors);
        this.appliedRefactorings = Collections.unmodifiableList(builder.appliedRefactorings);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    public boolean hasWarnings() {
        return errors.stream().anyMatch(e -> e.getSeverity() == Severity.WARNING);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<Refactoring> appliedRefactorings = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder appliedRefactorings(List<Refactoring> refactorings) {
            this.appliedRefactorings = new ArrayList<>(refactorings);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
