package com.cstruct.extractor.cli.model;

import java.nio.file.Path;

import com.cstruct.extractor.cli.util.ShellPathConverter;
import com.cstruct.extractor.parser.Preprocessor;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options of the extract command. No validation, no execution logic.
 */
@Getter
public class ExtractOptions {

	@Option(names = { "--file", "-f" }, defaultValue = "./main.c", converter = ShellPathConverter.class,
			description = "C source file; ~, $VAR and ${VAR} are expanded (default: ${DEFAULT-VALUE})")
	private Path file;

	@Option(names = { "--verbose", "-v" }, description = "More diagnostics on stderr; repeat for more (-vvv)")
	private boolean[] verbose = new boolean[0];

	@Option(names = { "--quiet", "-q" }, description = "Fewer diagnostics on stderr; -qq silences them")
	private boolean[] quiet = new boolean[0];

	@Option(names = { "--cpp" }, paramLabel = "<command>", defaultValue = Preprocessor.DEFAULT_COMMAND,
			description = "Preprocessor run over the file first, through the shell; the file path is appended "
					+ "(default: ${DEFAULT-VALUE})")
	private String preprocessorCommand;

	@Option(names = { "--no-cpp" }, description = "Read the file as is: directive lines are skipped and macros stay unexpanded")
	private boolean noCpp;

	@Option(names = { "--keep-going" }, description = "Skip declarations that cannot be catalogued instead of failing")
	private boolean keepGoing;

	@Option(names = { "--designated" }, description = "Bind .field = designators by name")
	private boolean designated;

	@Option(names = { "--aggregates" }, description = "Keep nested brace lists as Aggregate values instead of flattening")
	private boolean aggregates;

	public int getVerbosity() {
		return verbose.length;
	}

	public int getQuietness() {
		return quiet.length;
	}
}
