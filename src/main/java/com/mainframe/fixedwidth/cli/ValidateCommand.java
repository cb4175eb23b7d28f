package com.mainframe.fixedwidth.cli;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;
import com.mainframe.fixedwidth.cli.output.ResultsPrinter;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.SchemaProblem;

import picocli.CommandLine.Command;

/**
 * Reports every unresolvable reference and recursive layout. Exit code 1 when there is any.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Checks that every reference of the layout resolves.")
public class ValidateCommand extends LayoutCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    protected int execute(Definition definition, ValidatedCommandOptions options, ResultsPrinter printer) {
        List<SchemaProblem> problems = options.getSchema() == null
                ? definition.validate()
                : requireSchema(definition, options.getSchema()).validate();
        printer.printProblems(problems);
        log.info("Validated {} schema(s): {} problem(s)", definition.getSchemas().size(), problems.size());
        return problems.isEmpty() ? 0 : 1;
    }
}
