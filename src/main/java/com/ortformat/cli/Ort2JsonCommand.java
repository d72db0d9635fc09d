package com.ortformat.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ortformat.Ort;
import com.ortformat.json.OrtJson;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "ort2json",
        mixinStandardHelpOptions = true,
        description = "Converts an ORT file to JSON (<input>.json, or <output-dir>/<stem>.json)."
)
public class Ort2JsonCommand extends AbstractConvertCommand {

    @Option(names = {"--compact"}, description = "Write JSON on a single line instead of pretty-printing it")
    private boolean compact;

    @Override
    protected String name() {
        return "ort2json";
    }

    @Override
    protected String targetExtension() {
        return "json";
    }

    @Override
    protected String convert(String source) throws JsonProcessingException {
        return OrtJson.toJson(Ort.parse(source), !compact);
    }
}
