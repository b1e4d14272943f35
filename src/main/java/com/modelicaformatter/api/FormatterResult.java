package com.modelicaformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.modelicaformatter.api.error.FormatterError;

/**
 * Result of formatting one file.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<AppliedRewrite> appliedRewrites;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.appliedRewrites = Collections.unmodifiableList(new ArrayList<>(builder.appliedRewrites));
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

    public List<AppliedRewrite> getAppliedRewrites() {
        return appliedRewrites;
    }

    /**
     * True when formatting succeeded and produced text different from {@code original}.
     */
    public boolean changes(String original) {
        return successful && formattedCode != null && !formattedCode.equals(original);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<AppliedRewrite> appliedRewrites = new ArrayList<>();

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

        public Builder appliedRewrites(List<AppliedRewrite> rewrites) {
            this.appliedRewrites = new ArrayList<>(rewrites);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
