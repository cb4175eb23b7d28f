package com.mainframe.fixedwidth.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;
import com.mainframe.fixedwidth.cli.output.ResultsPrinter;
import com.mainframe.fixedwidth.cli.validation.CommandOptionsValidator.Requirement;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import picocli.CommandLine.Command;

/**
 * Parses each non-blank input line and prints it as key=value lines.
 */
@Command(name = "parse", mixinStandardHelpOptions = true,
        description = "Parses each line of the input file with the named schema, or the first schema matching it.")
public class ParseCommand extends LayoutCommand {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Override
    protected Requirement[] requirements() {
        return new Requirement[] { Requirement.INPUT };
    }

    @Override
    protected int execute(Definition definition, ValidatedCommandOptions options, ResultsPrinter printer)
            throws IOException {
        Schema fixed = options.getSchema() == null ? null : requireSchema(definition, options.getSchema());
        List<String> lines = Files.readAllLines(options.getInput(), StandardCharsets.UTF_8);

        int parsed = 0;
        int unmatched = 0;
        int lineNum = 0;
        for (String line : lines) {
            lineNum++;
            if (line.isBlank()) {
                continue;
            }

            Optional<Schema> schema = fixed != null ? Optional.of(fixed) : definition.findMatching(line);
            if (schema.isEmpty()) {
                log.warn("Line {} matches no schema", lineNum);
                unmatched++;
                continue;
            }
            printer.printRecord(lineNum, schema.get(), schema.get().parse(line, options.getOffset()));
            parsed++;
        }

        log.info("Parsed {} record(s), {} unmatched line(s)", parsed, unmatched);
        return unmatched == 0 ? 0 : 1;
    }
}
