package com.mainframe.fixedwidth.cli;

import java.util.List;

import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;
import com.mainframe.fixedwidth.cli.output.ResultsPrinter;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import picocli.CommandLine.Command;

/**
 * Prints the character ranges of every field of the layout's schemas.
 */
@Command(name = "describe", mixinStandardHelpOptions = true,
        description = "Prints offsets and widths of every field (of one schema with --schema).")
public class DescribeCommand extends LayoutCommand {

    @Override
    protected int execute(Definition definition, ValidatedCommandOptions options, ResultsPrinter printer) {
        List<Schema> schemas = options.getSchema() == null
                ? definition.getSchemas()
                : List.of(requireSchema(definition, options.getSchema()));
        schemas.forEach(printer::printLayout);
        return 0;
    }
}
