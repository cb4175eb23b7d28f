package com.mainframe.fixedwidth.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;
import com.mainframe.fixedwidth.cli.output.ResultsPrinter;
import com.mainframe.fixedwidth.cli.validation.CommandOptionsValidator.Requirement;
import com.mainframe.fixedwidth.record.RecordText;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import picocli.CommandLine.Command;

/**
 * Formats key=value records (separated by blank lines; {@code #} lines ignored) into fixed-width
 * lines.
 */
@Command(name = "format", mixinStandardHelpOptions = true,
        description = "Formats key=value records of the input file into fixed-width lines of the named schema.")
public class FormatCommand extends LayoutCommand {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Override
    protected Requirement[] requirements() {
        return new Requirement[] { Requirement.INPUT, Requirement.SCHEMA };
    }

    @Override
    protected int execute(Definition definition, ValidatedCommandOptions options, ResultsPrinter printer)
            throws IOException {
        Schema schema = requireSchema(definition, options.getSchema());
        schema.requireValid();

        int formatted = 0;
        for (List<String> record : splitRecords(Files.readAllLines(options.getInput(), StandardCharsets.UTF_8))) {
            printer.printLine(schema.format(RecordText.unflatten(record)));
            formatted++;
        }

        log.info("Formatted {} record(s) with schema '{}'", formatted, schema.getName());
        return 0;
    }

    static List<List<String>> splitRecords(List<String> lines) {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                if (!current.isEmpty()) {
                    records.add(current);
                    current = new ArrayList<>();
                }
            } else if (!line.startsWith("#")) {
                current.add(line);
            }
        }
        if (!current.isEmpty()) {
            records.add(current);
        }
        return records;
    }
}
