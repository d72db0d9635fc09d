package com.ortformat.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ortformat.Ort;
import com.ortformat.json.OrtJson;

import picocli.CommandLine.Command;

@Command(
        name = "json2ort",
        mixinStandardHelpOptions = true,
        description = "Converts a JSON file to ORT (<input>.ort, or <output-dir>/<stem>.ort)."
)
public class Json2OrtCommand extends AbstractConvertCommand {

    @Override
    protected String name() {
        return "json2ort";
    }

    @Override
    protected String targetExtension() {
        return "ort";
    }

    @Override
    protected String convert(String source) throws JsonProcessingException {
        return Ort.generate(OrtJson.fromJson(source));
    }
}
