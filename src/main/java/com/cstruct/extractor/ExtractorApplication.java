package com.cstruct.extractor;

import com.cstruct.extractor.cli.ExtractCommand;

import picocli.CommandLine;

/**
 * Main entry point of the C struct extractor.
 * Reads one C translation unit and prints the struct type catalog followed by every
 * initialized struct instance and scalar found in it.
 */
public class ExtractorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExtractCommand()).execute(args);
        System.exit(exitCode);
    }
}
