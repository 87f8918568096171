package com.cstruct.extractor.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.Value;

/**
 * Rejected command line. Each {@link OptionError} names the option it concerns, so
 * every problem can be reported in one run.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<OptionError> optionErrors;

    public OptionsValidationException(List<OptionError> optionErrors) {
        super(optionErrors.size() + " invalid option value(s): "
                + optionErrors.stream().map(OptionError::toString).collect(Collectors.joining("; ")));
        this.optionErrors = List.copyOf(optionErrors);
    }

    /**
     * @return one line per error, {@code "<option>: <message>"}
     */
    public List<String> getErrors() {
        return optionErrors.stream().map(OptionError::toString).collect(Collectors.toList());
    }

    @Value
    public static class OptionError {
        String option;
        String message;

        @Override
        public String toString() {
            return option + ": " + message;
        }
    }
}
