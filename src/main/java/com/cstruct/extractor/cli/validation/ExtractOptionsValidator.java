package com.cstruct.extractor.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cstruct.extractor.cli.exception.OptionsValidationException;
import com.cstruct.extractor.cli.exception.OptionsValidationException.OptionError;
import com.cstruct.extractor.cli.model.ExtractOptions;
import com.cstruct.extractor.cli.model.ValidatedExtractOptions;
import com.cstruct.extractor.extract.config.ErrorPolicy;
import com.cstruct.extractor.extract.config.ExtractionConfig;
import com.cstruct.extractor.extract.config.InitializerMatching;
import com.cstruct.extractor.extract.config.NestedInitializerMode;

public class ExtractOptionsValidator {

	public ValidatedExtractOptions validate(ExtractOptions o) {
		List<OptionError> errors = new ArrayList<>();

		Path file = o.getFile();
		if (file == null) {
			errors.add(new OptionError("--file", "a source file is required"));
		} else if (!Files.exists(file)) {
			errors.add(new OptionError("--file", "source file does not exist: " + file));
		} else if (!Files.isRegularFile(file)) {
			errors.add(new OptionError("--file", "source file is not a regular file: " + file));
		} else if (!Files.isReadable(file)) {
			errors.add(new OptionError("--file", "source file is not readable: " + file));
		}

		String cpp = o.isNoCpp() ? null : o.getPreprocessorCommand();
		if (!o.isNoCpp() && (cpp == null || cpp.isBlank())) {
			errors.add(new OptionError("--cpp", "preprocessor command must not be blank; use --no-cpp to read the file as is"));
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ExtractionConfig config = ExtractionConfig.builder()
				.errorPolicy(o.isKeepGoing() ? ErrorPolicy.SKIP : ErrorPolicy.FAIL_FAST)
				.initializerMatching(o.isDesignated() ? InitializerMatching.DESIGNATED : InitializerMatching.POSITIONAL)
				.nestedInitializers(o.isAggregates() ? NestedInitializerMode.AGGREGATE : NestedInitializerMode.FLATTEN)
				.build();

		return new ValidatedExtractOptions(file.toAbsolutePath().normalize(), config, cpp);
	}
}
