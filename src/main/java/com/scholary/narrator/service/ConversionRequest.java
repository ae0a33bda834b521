package com.scholary.narrator.service;

import java.nio.file.Path;

/**
 * A document staged for conversion.
 *
 * @param sourceFile the staged copy of the document; deleted once the conversion ends
 * @param originalFilename the name the client uploaded, used to pick the format and name the MP3
 * @param voice the requested voice, may be null or blank for the default
 * @param chunkingEnabled whether to split the text before synthesis
 */
public record ConversionRequest(
    Path sourceFile, String originalFilename, String voice, boolean chunkingEnabled) {}
